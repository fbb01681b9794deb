package txt2tex.lexer;

import txt2tex.Txt2TexException;
import txt2tex.util.SourceLocation;

public class ZLexerException extends Txt2TexException {

	public ZLexerException(SourceLocation location, String msg) {
		this(location, msg, null);
	}

	public ZLexerException(SourceLocation location, String msg, String hint) {
		super("Lexer error", msg, location, hint);
	}

}
