package txt2tex.model.document;

import txt2tex.model.Node;
import txt2tex.model.z.ZExpression;
import txt2tex.util.SourceLocation;

import java.util.Objects;

/**
 * An expression found inside paragraph text. start and end index the paragraph text (end exclusive) and
 * include the dollar signs of an explicit span.
 */
public class ProseSpan extends Node {

	private final int start;
	private final int end;
	private final boolean explicit;
	private final ZExpression expression;

	public ProseSpan(SourceLocation location, int start, int end, boolean explicit, ZExpression expression) {
		super(location);
		this.start = start;
		this.end = end;
		this.explicit = explicit;
		this.expression = expression;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	/**
	 * @return true for a $...$ span, false for one found by prose detection
	 */
	public boolean isExplicit() {
		return explicit;
	}

	public ZExpression getExpression() {
		return expression;
	}

	@Override
	public String toString() {
		return "ProseSpan [" + start + ", " + end + ") " + expression;
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end, explicit, expression);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ProseSpan other = (ProseSpan) obj;
		return start == other.start && end == other.end && explicit == other.explicit
				&& Objects.equals(expression, other.expression);
	}
}
