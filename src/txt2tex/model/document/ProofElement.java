package txt2tex.model.document;

import txt2tex.model.Node;
import txt2tex.util.SourceLocation;

import java.util.List;

/**
 * A child in a proof tree: a step, or a case split.
 */
public abstract class ProofElement extends Node {

	private final List<ProofElement> children;

	public ProofElement(SourceLocation location, List<ProofElement> children) {
		super(location);
		this.children = children;
	}

	public List<ProofElement> getChildren() {
		return children;
	}

	public abstract <T, E extends Throwable> T accept(ProofElementVisitor<T, E> v) throws E;

}
