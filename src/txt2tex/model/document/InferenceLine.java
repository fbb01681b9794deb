package txt2tex.model.document;

import txt2tex.model.Node;
import txt2tex.model.z.ZExpression;
import txt2tex.util.SourceLocation;

import java.util.Objects;

public class InferenceLine extends Node {

	private final ZExpression expression;
	private final String label;

	public InferenceLine(SourceLocation location, ZExpression expression, String label) {
		super(location);
		this.expression = expression;
		this.label = label;
	}

	public ZExpression getExpression() {
		return expression;
	}

	/**
	 * @return the bracketed rule name after the expression, or null
	 */
	public String getLabel() {
		return label;
	}

	@Override
	public String toString() {
		return expression + (label == null ? "" : " [" + label + "]");
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression, label);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		InferenceLine other = (InferenceLine) obj;
		return Objects.equals(expression, other.expression) && Objects.equals(label, other.label);
	}
}
