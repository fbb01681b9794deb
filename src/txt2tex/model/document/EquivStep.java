package txt2tex.model.document;

import txt2tex.model.Node;
import txt2tex.model.z.ZExpression;
import txt2tex.model.z.ZOperator;
import txt2tex.util.SourceLocation;

import java.util.Objects;

public class EquivStep extends Node {

	private final ZOperator connective;
	private final ZExpression expression;
	private final String justification;

	/**
	 * @param connective the operator written at the start of the line (<=>, => or =), or null
	 * @param justification the text between the trailing brackets, or null
	 */
	public EquivStep(SourceLocation location, ZOperator connective, ZExpression expression, String justification) {
		super(location);
		this.connective = connective;
		this.expression = expression;
		this.justification = justification;
	}

	public ZOperator getConnective() {
		return connective;
	}

	public ZExpression getExpression() {
		return expression;
	}

	public String getJustification() {
		return justification;
	}

	@Override
	public String toString() {
		return (connective == null ? "" : connective.getSpelling() + " ") + expression
				+ (justification == null ? "" : " [" + justification + "]");
	}

	@Override
	public int hashCode() {
		return Objects.hash(connective, expression, justification);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		EquivStep other = (EquivStep) obj;
		return connective == other.connective && Objects.equals(expression, other.expression)
				&& Objects.equals(justification, other.justification);
	}
}
