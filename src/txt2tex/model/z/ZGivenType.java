package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * given A, B
 */
public class ZGivenType extends ZParagraph {

	private final List<ZIdentifier> names;

	public ZGivenType(SourceLocation location, List<ZIdentifier> names) {
		super(location);
		this.names = names;
	}

	public List<ZIdentifier> getNames() {
		return names;
	}

	@Override
	public <T, E extends Throwable> T accept(ZParagraphVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(names);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZGivenType other = (ZGivenType) obj;
		return Objects.equals(names, other.names);
	}
}
