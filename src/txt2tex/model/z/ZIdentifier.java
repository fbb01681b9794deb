package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Objects;

public class ZIdentifier extends ZExpression {
	private final String name;

	public ZIdentifier(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public ZIdentifier copy() {
		return new ZIdentifier(getLocation(), name);
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZIdentifier other = (ZIdentifier) obj;
		return Objects.equals(name, other.name);
	}
}
