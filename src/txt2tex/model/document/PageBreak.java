package txt2tex.model.document;

import txt2tex.util.SourceLocation;

public class PageBreak extends DocumentItem {

	public PageBreak(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return PageBreak.class.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && getClass() == obj.getClass();
	}
}
