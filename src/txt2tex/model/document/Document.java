package txt2tex.model.document;

import txt2tex.Unreachable;
import txt2tex.formatters.DocumentFormattingVisitor;
import txt2tex.formatters.IndentingWriter;
import txt2tex.model.Node;
import txt2tex.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The root of a parsed input: its items in source order, and the TITLE:/AUTHOR:/... metadata in the order
 * it was given.
 */
public class Document extends Node {

	private final List<DocumentItem> items;
	private final Map<String, String> metadata;

	public Document(SourceLocation location, List<DocumentItem> items, Map<String, String> metadata) {
		super(location);
		this.items = items;
		this.metadata = metadata;
	}

	public List<DocumentItem> getItems() {
		return items;
	}

	public Map<String, String> getMetadata() {
		return metadata;
	}

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			new DocumentFormattingVisitor(new IndentingWriter(out)).writeDocument(this);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return out.toString();
	}

	@Override
	public int hashCode() {
		return Objects.hash(items, metadata);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Document other = (Document) obj;
		return Objects.equals(items, other.items) && Objects.equals(metadata, other.metadata);
	}
}
