package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Function application, written f(x, y) or by juxtaposition as in "seq N" or "f x".
 */
public class ZApplication extends ZExpression {

	private final ZExpression function;
	private final List<ZExpression> arguments;

	public ZApplication(SourceLocation location, ZExpression function, List<ZExpression> arguments) {
		super(location);
		this.function = function;
		this.arguments = arguments;
	}

	public ZExpression getFunction() {
		return function;
	}

	public List<ZExpression> getArguments() {
		return arguments;
	}

	@Override
	public ZApplication copy() {
		return new ZApplication(getLocation(), function.copy(),
				arguments.stream().map(ZExpression::copy).collect(Collectors.toList()));
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZApplication other = (ZApplication) obj;
		return Objects.equals(function, other.function) && Objects.equals(arguments, other.arguments);
	}
}
