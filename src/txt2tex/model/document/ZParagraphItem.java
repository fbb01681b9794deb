package txt2tex.model.document;

import txt2tex.model.z.ZParagraph;
import txt2tex.util.SourceLocation;

import java.util.Objects;

public class ZParagraphItem extends DocumentItem {

	private final ZParagraph paragraph;

	public ZParagraphItem(SourceLocation location, ZParagraph paragraph) {
		super(location);
		this.paragraph = paragraph;
	}

	public ZParagraph getParagraph() {
		return paragraph;
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(paragraph);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZParagraphItem other = (ZParagraphItem) obj;
		return Objects.equals(paragraph, other.paragraph);
	}
}
