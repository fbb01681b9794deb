package txt2tex.model.document;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * zed ... end: unboxed Z paragraphs and predicates set as one block.
 */
public class ZedBlock extends DocumentItem {

	private final List<DocumentItem> items;

	public ZedBlock(SourceLocation location, List<DocumentItem> items) {
		super(location);
		this.items = items;
	}

	/**
	 * @return {@link ZParagraphItem}s and {@link ExpressionItem}s
	 */
	public List<DocumentItem> getItems() {
		return items;
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(items);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZedBlock other = (ZedBlock) obj;
		return Objects.equals(items, other.items);
	}
}
