package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;

/**
 *
 * AST node:
 *
 * forall x : S | P . Q
 * exists x : S | P
 * exists1 x : S . Q
 *
 */
public class ZQuantified extends ZBinder {

	public enum Kind {
		FORALL,
		EXISTS,
		EXISTS1,
	}

	private final Kind kind;

	public ZQuantified(SourceLocation location, Kind kind, List<ZBinding> bindings, ZExpression constraint,
	                   ZExpression body) {
		super(location, bindings, constraint, body);
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}

	@Override
	public ZQuantified copy() {
		return new ZQuantified(getLocation(), kind, copyBindings(), copyOrNull(getConstraint()), getBody().copy());
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 31 * super.hashCode() + kind.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return super.equals(obj) && kind == ((ZQuantified) obj).kind;
	}
}
