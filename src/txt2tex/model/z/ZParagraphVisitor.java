package txt2tex.model.z;

public abstract class ZParagraphVisitor<T, E extends Throwable> {
	public abstract T visit(ZGivenType zGivenType) throws E;
	public abstract T visit(ZFreeType zFreeType) throws E;
	public abstract T visit(ZAbbreviation zAbbreviation) throws E;
	public abstract T visit(ZAxiomaticDefinition zAxiomaticDefinition) throws E;
	public abstract T visit(ZGenericDefinition zGenericDefinition) throws E;
	public abstract T visit(ZSchema zSchema) throws E;
}
