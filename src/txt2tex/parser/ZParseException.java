package txt2tex.parser;

import txt2tex.Txt2TexException;
import txt2tex.lexer.ZToken;
import txt2tex.util.SourceLocation;

/**
 * The first point at which the token stream stopped making sense. Parsing does not continue past one.
 */
public class ZParseException extends Txt2TexException {

	private final String expected;
	private final ZToken found;

	public ZParseException(SourceLocation location, String msg) {
		this(location, msg, null, null, null);
	}

	public ZParseException(SourceLocation location, String msg, String hint) {
		this(location, msg, null, null, hint);
	}

	/**
	 * @param expected a description of what would have been accepted here, or null
	 * @param found the offending token, or null when the failure is not about a single token
	 */
	public ZParseException(SourceLocation location, String msg, String expected, ZToken found, String hint) {
		super("Parse error", msg, location, hint);
		this.expected = expected;
		this.found = found;
	}

	public static ZParseException unexpected(ZToken found, String expected) {
		return unexpected(found, expected, null);
	}

	public static ZParseException unexpected(ZToken found, String expected, String hint) {
		return new ZParseException(found.getLocation(),
				"expected " + expected + ", found " + describe(found), expected, found, hint);
	}

	static String describe(ZToken token) {
		switch(token.getType()) {
			case EOF:
				return "end of input";
			case NEWLINE:
				return "end of line";
			default:
				return "'" + token.getValue() + "'";
		}
	}

	public String getExpected() {
		return expected;
	}

	public ZToken getFound() {
		return found;
	}
}
