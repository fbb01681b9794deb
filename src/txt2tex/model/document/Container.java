package txt2tex.model.document;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A titled group of items: sections, solutions and parts.
 */
public abstract class Container extends DocumentItem {

	private final String title;
	private final List<DocumentItem> items;

	public Container(SourceLocation location, String title, List<DocumentItem> items) {
		super(location);
		this.title = title;
		this.items = items;
	}

	public String getTitle() {
		return title;
	}

	public List<DocumentItem> getItems() {
		return items;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), title, items);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Container other = (Container) obj;
		return Objects.equals(title, other.title) && Objects.equals(items, other.items);
	}
}
