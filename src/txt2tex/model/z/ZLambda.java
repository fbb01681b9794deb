package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;

/**
 * lambda x : S | P . body
 */
public class ZLambda extends ZBinder {

	public ZLambda(SourceLocation location, List<ZBinding> bindings, ZExpression constraint, ZExpression body) {
		super(location, bindings, constraint, body);
	}

	@Override
	public ZLambda copy() {
		return new ZLambda(getLocation(), copyBindings(), copyOrNull(getConstraint()), getBody().copy());
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
