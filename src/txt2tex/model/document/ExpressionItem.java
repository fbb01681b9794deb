package txt2tex.model.document;

import txt2tex.model.z.ZExpression;
import txt2tex.util.SourceLocation;

import java.util.Objects;

/**
 * A predicate or expression standing on its own line.
 */
public class ExpressionItem extends DocumentItem {

	private final ZExpression expression;

	public ExpressionItem(SourceLocation location, ZExpression expression) {
		super(location);
		this.expression = expression;
	}

	public ZExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ExpressionItem other = (ExpressionItem) obj;
		return Objects.equals(expression, other.expression);
	}
}
