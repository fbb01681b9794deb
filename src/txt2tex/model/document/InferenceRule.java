package txt2tex.model.document;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * INFRULE: premises, a line of dashes, and a conclusion.
 */
public class InferenceRule extends DocumentItem {

	private final List<InferenceLine> premises;
	private final InferenceLine conclusion;

	public InferenceRule(SourceLocation location, List<InferenceLine> premises, InferenceLine conclusion) {
		super(location);
		this.premises = premises;
		this.conclusion = conclusion;
	}

	public List<InferenceLine> getPremises() {
		return premises;
	}

	public InferenceLine getConclusion() {
		return conclusion;
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(premises, conclusion);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		InferenceRule other = (InferenceRule) obj;
		return Objects.equals(premises, other.premises) && Objects.equals(conclusion, other.conclusion);
	}
}
