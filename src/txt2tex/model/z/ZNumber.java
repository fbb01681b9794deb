package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Objects;

/**
 * A numeric literal, kept as written (decimals included).
 */
public class ZNumber extends ZExpression {
	private final String value;

	public ZNumber(SourceLocation location, String value) {
		super(location);
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	public boolean isDecimal() {
		return value.indexOf('.') >= 0;
	}

	@Override
	public ZNumber copy() {
		return new ZNumber(getLocation(), value);
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZNumber other = (ZNumber) obj;
		return Objects.equals(value, other.value);
	}
}
