package txt2tex.model.document;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * case name: followed by the steps of that case, indented below it.
 */
public class ProofCase extends ProofElement {

	private final String name;

	public ProofCase(SourceLocation location, String name, List<ProofElement> children) {
		super(location, children);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(ProofElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, getChildren());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ProofCase other = (ProofCase) obj;
		return Objects.equals(name, other.name) && Objects.equals(getChildren(), other.getChildren());
	}
}
