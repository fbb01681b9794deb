package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Objects;

/**
 * Field selection e.name, or tuple component selection e.1 when the field is numeric.
 */
public class ZProjection extends ZExpression {

	private final ZExpression base;
	private final String field;

	public ZProjection(SourceLocation location, ZExpression base, String field) {
		super(location);
		this.base = base;
		this.field = field;
	}

	public ZExpression getBase() {
		return base;
	}

	public String getField() {
		return field;
	}

	public boolean isPositional() {
		return !field.isEmpty() && Character.isDigit(field.charAt(0));
	}

	@Override
	public ZProjection copy() {
		return new ZProjection(getLocation(), base.copy(), field);
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(base, field);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZProjection other = (ZProjection) obj;
		return Objects.equals(base, other.base) && Objects.equals(field, other.field);
	}
}
