package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 *
 * AST node:
 *
 * { x : S | constraint . selector }
 *
 * Either part after the bindings may be missing, but not both.
 *
 */
public class ZSetComprehension extends ZExpression {

	private final List<ZBinding> bindings;
	private final ZExpression constraint;
	private final ZExpression selector;

	public ZSetComprehension(SourceLocation location, List<ZBinding> bindings, ZExpression constraint,
	                         ZExpression selector) {
		super(location);
		this.bindings = bindings;
		this.constraint = constraint;
		this.selector = selector;
	}

	public List<ZBinding> getBindings() {
		return bindings;
	}

	public ZExpression getConstraint() {
		return constraint;
	}

	public ZExpression getSelector() {
		return selector;
	}

	@Override
	public ZSetComprehension copy() {
		return new ZSetComprehension(getLocation(),
				bindings.stream().map(ZBinding::copy).collect(Collectors.toList()),
				constraint == null ? null : constraint.copy(),
				selector == null ? null : selector.copy());
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(bindings, constraint, selector);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZSetComprehension other = (ZSetComprehension) obj;
		return Objects.equals(bindings, other.bindings) && Objects.equals(constraint, other.constraint)
				&& Objects.equals(selector, other.selector);
	}
}
