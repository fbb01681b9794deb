package txt2tex.model.document;

import txt2tex.util.SourceLocation;

import java.util.List;

/**
 * === title ===, holding everything up to the next section.
 */
public class Section extends Container {

	public Section(SourceLocation location, String title, List<DocumentItem> items) {
		super(location, title, items);
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
