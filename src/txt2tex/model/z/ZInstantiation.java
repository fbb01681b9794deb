package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Square-bracket suffix: generic instantiation T[N] or indexing s[i].
 */
public class ZInstantiation extends ZExpression {

	private final ZExpression base;
	private final List<ZExpression> arguments;

	public ZInstantiation(SourceLocation location, ZExpression base, List<ZExpression> arguments) {
		super(location);
		this.base = base;
		this.arguments = arguments;
	}

	public ZExpression getBase() {
		return base;
	}

	public List<ZExpression> getArguments() {
		return arguments;
	}

	@Override
	public ZInstantiation copy() {
		return new ZInstantiation(getLocation(), base.copy(),
				arguments.stream().map(ZExpression::copy).collect(Collectors.toList()));
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(base, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZInstantiation other = (ZInstantiation) obj;
		return Objects.equals(base, other.base) && Objects.equals(arguments, other.arguments);
	}
}
