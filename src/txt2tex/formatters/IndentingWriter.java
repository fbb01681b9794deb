package txt2tex.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that indents every line it starts by the current indent. Lines always end in '\n', whatever the
 * platform, so that formatted trees compare equal across systems.
 */
public class IndentingWriter extends Writer {

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean shouldIndent = false;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public IndentingWriter(Writer out) {
		this(out, 4);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	public void unindent(int spaces) {
		if(spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public void newLine() throws IOException {
		write("\n");
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		for(int i = offset; i < offset + len; ++i) {
			char c = chars[i];
			if(shouldIndent && c != '\n') {
				for(int j = 0; j < indent; ++j) {
					out.write(' ');
				}
				shouldIndent = false;
			}
			out.write(c);
			if(c == '\n') {
				shouldIndent = true;
			}
		}
	}

}
