package txt2tex.model.z;

import txt2tex.util.SourceLocation;

/**
 * An entry in the declaration part of a boxed definition: either a typed name or a schema inclusion.
 */
public abstract class ZDeclarationItem extends ZNode {

	public ZDeclarationItem(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(ZNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
