package txt2tex.model.z;

import txt2tex.util.SourceLocation;

/**
 * Base Z expression representation. Predicates are expressions too.
 *
 */
public abstract class ZExpression extends ZNode {

	public ZExpression(SourceLocation location) {
		super(location);
	}

	/**
	 * @return a deep copy of this expression, so that no subtree is ever shared between two parents
	 */
	public abstract ZExpression copy();

	@Override
	public <T, E extends Throwable> T accept(ZNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E;

}
