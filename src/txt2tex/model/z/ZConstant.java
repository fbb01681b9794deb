package txt2tex.model.z;

import txt2tex.util.SourceLocation;

public class ZConstant extends ZExpression {

	public enum Kind {
		TRUE,
		FALSE,
		EMPTYSET,
	}

	private final Kind kind;

	public ZConstant(SourceLocation location, Kind kind) {
		super(location);
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}

	@Override
	public ZConstant copy() {
		return new ZConstant(getLocation(), kind);
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return kind.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return kind == ((ZConstant) obj).kind;
	}
}
