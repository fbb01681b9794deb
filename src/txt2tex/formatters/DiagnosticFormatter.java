package txt2tex.formatters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import txt2tex.Txt2TexException;

/**
 * Renders a lexer or parser failure for a person: the message, the offending line between its neighbours
 * with a line-number gutter and a caret under the column, and a hint when one is known.
 *
 * <pre>
 * Error: expected ')', found end of line
 *
 * 1 | x = (a + b
 *   |           ^
 *
 * Hint: make sure all brackets, braces and parentheses are balanced
 * </pre>
 */
public class DiagnosticFormatter {

	// consulted in order when the failure carries no hint of its own
	private static final Map<Pattern, String> HINTS = new LinkedHashMap<>();

	static {
		hint("'end' to close", "did you forget 'end' before starting a new block?");
		hint("expected '\\|', '\\.' or '\\}'", "a set comprehension reads { x : T | predicate . expression }");
		hint("unexpected character", "this character is not valid in txt2tex notation");
		hint("unclosed|to close|expected '\\)'|expected ',' or '\\)'",
				"make sure all brackets, braces and parentheses are balanced");
		hint("expected a name|expected the .*name|expected a constructor name",
				"a variable or type name is required here");
		hint("expected ':'", "declarations need a colon between the names and the type");
		hint("expected the end of|expected end of line after",
				"check for missing operators or extra characters");
	}

	private static void hint(String pattern, String hint) {
		HINTS.put(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE), hint);
	}

	private final int contextLines;
	private final boolean showHints;

	public DiagnosticFormatter() {
		this(1, true);
	}

	public DiagnosticFormatter(int contextLines, boolean showHints) {
		if(contextLines < 0) {
			throw new IllegalArgumentException("contextLines must not be negative");
		}
		this.contextLines = contextLines;
		this.showHints = showHints;
	}

	/**
	 * @param source the complete text the failing lexer or parser was given
	 */
	public String format(Txt2TexException e, String source) {
		List<String> out = new ArrayList<>();
		out.add("Error: " + e.getMsg());
		if(!e.getLocation().isUnknown()) {
			out.add("");
			writeContext(out, source.split("\r?\n", -1), e.getLine(), e.getColumn());
		}
		String hint = showHints ? hintFor(e) : null;
		if(hint != null) {
			out.add("");
			out.add("Hint: " + hint);
		}
		return String.join("\n", out);
	}

	private void writeContext(List<String> out, String[] lines, int line, int column) {
		int errorIndex = line - 1;
		int first = Math.max(0, errorIndex - contextLines);
		int last = Math.min(lines.length, errorIndex + contextLines + 1);
		int width = Integer.toString(last).length();
		for(int i = first; i < last; ++i) {
			out.add(pad(Integer.toString(i + 1), width) + " | " + lines[i]);
			if(i == errorIndex) {
				out.add(pad("", width) + " | " + String.join("", Collections.nCopies(Math.max(0, column - 1), " "))
						+ "^");
			}
		}
	}

	private static String pad(String s, int width) {
		StringBuilder b = new StringBuilder();
		for(int i = s.length(); i < width; ++i) {
			b.append(' ');
		}
		return b.append(s).toString();
	}

	/**
	 * @return the failure's own hint, or the first table entry whose pattern occurs in its message, or null
	 */
	public static String hintFor(Txt2TexException e) {
		if(e.getHint() != null) {
			return e.getHint();
		}
		for(Map.Entry<Pattern, String> entry : HINTS.entrySet()) {
			if(entry.getKey().matcher(e.getMsg()).find()) {
				return entry.getValue();
			}
		}
		return null;
	}
}
