package txt2tex.model;

import txt2tex.util.SourceLocatable;
import txt2tex.util.SourceLocation;

/**
 *
 * The base class for every AST node, Z or document structure. Every node knows the span of source text it
 * was read from. Equality is structural and ignores locations, so trees built with
 * {@link SourceLocation#unknown()} compare equal to parsed ones.
 *
 */
public abstract class Node extends SourceLocatable {
	private final SourceLocation location;

	public Node(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

}
