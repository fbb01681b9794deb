package txt2tex.model.document;

import txt2tex.util.SourceLocation;

import java.util.List;

/**
 * (a), holding everything up to the next part, solution or section. The title is the letter.
 */
public class Part extends Container {

	public Part(SourceLocation location, String title, List<DocumentItem> items) {
		super(location, title, items);
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
