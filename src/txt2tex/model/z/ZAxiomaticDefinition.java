package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;

public class ZAxiomaticDefinition extends ZBlock {

	public ZAxiomaticDefinition(SourceLocation location, List<ZIdentifier> genericParameters,
	          List<ZDeclarationItem> declarations, List<ZExpression> predicates) {
		super(location, genericParameters, declarations, predicates);
	}

	@Override
	public <T, E extends Throwable> T accept(ZParagraphVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
