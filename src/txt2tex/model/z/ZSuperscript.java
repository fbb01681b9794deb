package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Objects;

/**
 * base^exponent, also used for relational iteration R^n.
 */
public class ZSuperscript extends ZExpression {

	private final ZExpression base;
	private final ZExpression exponent;

	public ZSuperscript(SourceLocation location, ZExpression base, ZExpression exponent) {
		super(location);
		this.base = base;
		this.exponent = exponent;
	}

	public ZExpression getBase() {
		return base;
	}

	public ZExpression getExponent() {
		return exponent;
	}

	@Override
	public ZSuperscript copy() {
		return new ZSuperscript(getLocation(), base.copy(), exponent.copy());
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(base, exponent);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZSuperscript other = (ZSuperscript) obj;
		return Objects.equals(base, other.base) && Objects.equals(exponent, other.exponent);
	}
}
