package txt2tex.model.z;

import txt2tex.Unreachable;
import txt2tex.formatters.IndentingWriter;
import txt2tex.formatters.ZNodeFormattingVisitor;
import txt2tex.model.Node;
import txt2tex.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 *
 * The base class for any Z AST node: expressions, paragraphs and the pieces they are built from
 * (bindings, declarations, free type branches).
 *
 */
public abstract class ZNode extends Node {

	public ZNode(SourceLocation location) {
		super(location);
	}

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new ZNodeFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(ZNodeVisitor<T, E> v) throws E;

}
