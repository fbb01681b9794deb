package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A bracketed, comma-separated list of expressions: set, sequence and bag displays and tuples.
 */
public abstract class ZEnumeration extends ZExpression {

	private final List<ZExpression> elements;

	public ZEnumeration(SourceLocation location, List<ZExpression> elements) {
		super(location);
		this.elements = elements;
	}

	public List<ZExpression> getElements() {
		return elements;
	}

	protected List<ZExpression> copyElements() {
		return elements.stream().map(ZExpression::copy).collect(Collectors.toList());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), elements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZEnumeration other = (ZEnumeration) obj;
		return Objects.equals(elements, other.elements);
	}
}
