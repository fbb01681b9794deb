package txt2tex.model.document;

import txt2tex.util.SourceLocation;

import java.util.Objects;

/**
 * PROOF: followed by a natural deduction tree written conclusion first, premises indented below.
 */
public class ProofTree extends DocumentItem {

	private final ProofNode conclusion;

	public ProofTree(SourceLocation location, ProofNode conclusion) {
		super(location);
		this.conclusion = conclusion;
	}

	public ProofNode getConclusion() {
		return conclusion;
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(conclusion);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ProofTree other = (ProofTree) obj;
		return Objects.equals(conclusion, other.conclusion);
	}
}
