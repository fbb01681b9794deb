package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Common shape of the expressions that bind names:
 *
 * Q bindings | constraint . body
 *
 * Either the constraint or (for mu) the body may be absent.
 */
public abstract class ZBinder extends ZExpression {

	private final List<ZBinding> bindings;
	private final ZExpression constraint;
	private final ZExpression body;

	public ZBinder(SourceLocation location, List<ZBinding> bindings, ZExpression constraint, ZExpression body) {
		super(location);
		this.bindings = bindings;
		this.constraint = constraint;
		this.body = body;
	}

	public List<ZBinding> getBindings() {
		return bindings;
	}

	public ZExpression getConstraint() {
		return constraint;
	}

	public ZExpression getBody() {
		return body;
	}

	protected List<ZBinding> copyBindings() {
		return bindings.stream().map(ZBinding::copy).collect(Collectors.toList());
	}

	protected static ZExpression copyOrNull(ZExpression e) {
		return e == null ? null : e.copy();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), bindings, constraint, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZBinder other = (ZBinder) obj;
		return Objects.equals(bindings, other.bindings) && Objects.equals(constraint, other.constraint)
				&& Objects.equals(body, other.body);
	}
}
