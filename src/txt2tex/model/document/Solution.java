package txt2tex.model.document;

import txt2tex.util.SourceLocation;

import java.util.List;

/**
 * ** label **, holding everything up to the next solution or section.
 */
public class Solution extends Container {

	public Solution(SourceLocation location, String title, List<DocumentItem> items) {
		super(location, title, items);
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
