package txt2tex.model.document;

import txt2tex.Unreachable;
import txt2tex.formatters.DocumentFormattingVisitor;
import txt2tex.formatters.IndentingWriter;
import txt2tex.model.Node;
import txt2tex.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Anything that can appear at the top level of a document or inside a section, solution or part.
 */
public abstract class DocumentItem extends Node {

	public DocumentItem(SourceLocation location) {
		super(location);
	}

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new DocumentFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E;

}
