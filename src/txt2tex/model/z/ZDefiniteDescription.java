package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;

/**
 * mu x : S | P . E, the unique value of E for the x satisfying P. Without ". E" the body is null and the
 * value is the bound variable itself.
 */
public class ZDefiniteDescription extends ZBinder {

	public ZDefiniteDescription(SourceLocation location, List<ZBinding> bindings, ZExpression constraint,
	                            ZExpression body) {
		super(location, bindings, constraint, body);
	}

	@Override
	public ZDefiniteDescription copy() {
		return new ZDefiniteDescription(getLocation(), copyBindings(), copyOrNull(getConstraint()),
				copyOrNull(getBody()));
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
