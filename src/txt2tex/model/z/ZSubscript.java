package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Objects;

public class ZSubscript extends ZExpression {

	private final ZExpression base;
	private final ZExpression subscript;

	public ZSubscript(SourceLocation location, ZExpression base, ZExpression subscript) {
		super(location);
		this.base = base;
		this.subscript = subscript;
	}

	public ZExpression getBase() {
		return base;
	}

	public ZExpression getSubscript() {
		return subscript;
	}

	@Override
	public ZSubscript copy() {
		return new ZSubscript(getLocation(), base.copy(), subscript.copy());
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(base, subscript);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZSubscript other = (ZSubscript) obj;
		return Objects.equals(base, other.base) && Objects.equals(subscript, other.subscript);
	}
}
