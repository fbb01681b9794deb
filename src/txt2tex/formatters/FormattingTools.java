package txt2tex.formatters;

import java.io.IOException;
import java.util.List;

public class FormattingTools {

	private FormattingTools() {}

	@FunctionalInterface
	public interface WriteAction<T> {
		void write(T item) throws IOException;
	}

	/**
	 * Writes each item with the given action, separated by sep.
	 */
	public static <T> void writeSeparated(IndentingWriter out, String sep, List<T> items,
	                                           WriteAction<T> action) throws IOException {
		boolean first = true;
		for(T item : items) {
			if(first) {
				first = false;
			} else {
				out.write(sep);
			}
			action.write(item);
		}
	}
}
