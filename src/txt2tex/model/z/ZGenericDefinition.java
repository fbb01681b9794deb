package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;

/**
 * gendef [X] ... end; unlike axdef the generic parameters are mandatory.
 */
public class ZGenericDefinition extends ZBlock {

	public ZGenericDefinition(SourceLocation location, List<ZIdentifier> genericParameters,
	          List<ZDeclarationItem> declarations, List<ZExpression> predicates) {
		super(location, genericParameters, declarations, predicates);
	}

	@Override
	public <T, E extends Throwable> T accept(ZParagraphVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
