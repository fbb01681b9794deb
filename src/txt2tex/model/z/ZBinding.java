package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One group of bound names sharing a domain, as in "x, y : N". The domain is null for "forall x | ...".
 * A tuple pattern such as "(x, y) : A cross B" binds the components of each element of the domain.
 */
public class ZBinding extends ZNode {

	private final List<ZIdentifier> names;
	private final ZExpression domain;
	private final boolean tuplePattern;

	public ZBinding(SourceLocation location, List<ZIdentifier> names, ZExpression domain) {
		this(location, names, domain, false);
	}

	public ZBinding(SourceLocation location, List<ZIdentifier> names, ZExpression domain, boolean tuplePattern) {
		super(location);
		this.names = names;
		this.domain = domain;
		this.tuplePattern = tuplePattern;
	}

	public List<ZIdentifier> getNames() {
		return names;
	}

	public ZExpression getDomain() {
		return domain;
	}

	public boolean isTuplePattern() {
		return tuplePattern;
	}

	public ZBinding copy() {
		return new ZBinding(getLocation(), names.stream().map(ZIdentifier::copy).collect(Collectors.toList()),
				domain == null ? null : domain.copy(), tuplePattern);
	}

	@Override
	public <T, E extends Throwable> T accept(ZNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(names, domain, tuplePattern);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZBinding other = (ZBinding) obj;
		return tuplePattern == other.tuplePattern && Objects.equals(names, other.names)
				&& Objects.equals(domain, other.domain);
	}
}
