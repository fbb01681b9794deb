package txt2tex;

import txt2tex.util.SourceLocation;

/**
 * A txt2tex failure consisting of a prefix (the stage that failed), a message and the source location at
 * which it was detected. Lexing and parsing stop at the first one; no partial document is produced.
 *
 */
public abstract class Txt2TexException extends Exception {
	private final String prefix;
	private final String msg;
	private final String hint;
	private final SourceLocation location;

	public Txt2TexException(String prefix, String msg, SourceLocation location, String hint) {
		super(prefix + ": " + msg + (location.isUnknown() ? "" : " " + location.prettyString()));
		this.prefix = prefix;
		this.msg = msg;
		this.location = location;
		this.hint = hint;
	}

	public String getPrefix() {
		return prefix;
	}

	public String getMsg() {
		return msg;
	}

	/**
	 * @return a short suggestion for fixing the input, or null if there is none
	 */
	public String getHint() {
		return hint;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public int getLine() {
		return location.getStartLine();
	}

	public int getColumn() {
		return location.getStartColumn();
	}
}
