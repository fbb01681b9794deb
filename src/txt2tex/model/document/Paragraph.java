package txt2tex.model.document;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A line of prose. TEXT: paragraphs may embed expressions, recorded as spans over the text; PURETEXT: and
 * LATEX: paragraphs never do.
 */
public class Paragraph extends DocumentItem {

	public enum Kind {
		TEXT,
		PURETEXT,
		LATEX,
	}

	private final Kind kind;
	private final String text;
	private final List<ProseSpan> spans;

	public Paragraph(SourceLocation location, Kind kind, String text, List<ProseSpan> spans) {
		super(location);
		this.kind = kind;
		this.text = text;
		this.spans = spans;
	}

	public Kind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return the embedded expressions, in text order and never overlapping
	 */
	public List<ProseSpan> getSpans() {
		return spans;
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text, spans);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Paragraph other = (Paragraph) obj;
		return kind == other.kind && Objects.equals(text, other.text) && Objects.equals(spans, other.spans);
	}
}
