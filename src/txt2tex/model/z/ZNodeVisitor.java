package txt2tex.model.z;

public abstract class ZNodeVisitor<T, E extends Throwable> {
	public abstract T visit(ZExpression expression) throws E;
	public abstract T visit(ZParagraph paragraph) throws E;
	public abstract T visit(ZBinding binding) throws E;
	public abstract T visit(ZDeclarationItem declarationItem) throws E;
	public abstract T visit(ZFreeTypeBranch branch) throws E;
}
