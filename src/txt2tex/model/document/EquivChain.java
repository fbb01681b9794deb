package txt2tex.model.document;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * EQUIV: or ARGUE: followed by one step per line.
 */
public class EquivChain extends DocumentItem {

	public enum Kind {
		EQUIV,
		ARGUE,
	}

	private final Kind kind;
	private final List<EquivStep> steps;

	public EquivChain(SourceLocation location, Kind kind, List<EquivStep> steps) {
		super(location);
		this.kind = kind;
		this.steps = steps;
	}

	public Kind getKind() {
		return kind;
	}

	public List<EquivStep> getSteps() {
		return steps;
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, steps);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		EquivChain other = (EquivChain) obj;
		return kind == other.kind && Objects.equals(steps, other.steps);
	}
}
