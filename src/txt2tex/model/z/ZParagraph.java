package txt2tex.model.z;

import txt2tex.util.SourceLocation;

/**
 * A Z declaration paragraph: given types, free types, abbreviations and the boxed definitions.
 */
public abstract class ZParagraph extends ZNode {

	public ZParagraph(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(ZNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(ZParagraphVisitor<T, E> v) throws E;

}
