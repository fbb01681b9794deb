package txt2tex.model.document;

import txt2tex.model.z.ZExpression;
import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * One line of a proof tree:
 *
 * [label] :: expression [justification]
 *
 * The label marks an assumption that a justification "... from n" further up discharges.
 */
public class ProofNode extends ProofElement {

	private final ZExpression expression;
	private final String justification;
	private final Integer label;
	private final boolean assumption;
	private final boolean sibling;
	private final List<Integer> discharges;

	public ProofNode(SourceLocation location, ZExpression expression, String justification, Integer label,
	                 boolean assumption, boolean sibling, List<Integer> discharges, List<ProofElement> children) {
		super(location, children);
		this.expression = expression;
		this.justification = justification;
		this.label = label;
		this.assumption = assumption;
		this.sibling = sibling;
		this.discharges = discharges;
	}

	public ZExpression getExpression() {
		return expression;
	}

	public String getJustification() {
		return justification;
	}

	/**
	 * @return the [n] label, or null
	 */
	public Integer getLabel() {
		return label;
	}

	public boolean isAssumption() {
		return assumption;
	}

	/**
	 * @return true if the line was marked "::", a premise set beside the previous one
	 */
	public boolean isSibling() {
		return sibling;
	}

	/**
	 * @return the assumption labels named by "from n, m" in the justification
	 */
	public List<Integer> getDischarges() {
		return discharges;
	}

	@Override
	public <T, E extends Throwable> T accept(ProofElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression, justification, label, assumption, sibling, discharges, getChildren());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ProofNode other = (ProofNode) obj;
		return assumption == other.assumption && sibling == other.sibling
				&& Objects.equals(expression, other.expression) && Objects.equals(justification, other.justification)
				&& Objects.equals(label, other.label) && Objects.equals(discharges, other.discharges)
				&& Objects.equals(getChildren(), other.getChildren());
	}
}
