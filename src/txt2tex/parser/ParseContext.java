package txt2tex.parser;

import java.util.List;

import txt2tex.lexer.ZToken;
import txt2tex.lexer.ZTokenType;
import txt2tex.scope.ZScope;
import txt2tex.util.SourceLocation;

/**
 * The state shared by the parsers of one document: the token list and read position, the symbol tables,
 * the separator frames, and the flags that change how a few tokens are read in declaration contexts.
 */
public class ParseContext {

	private final List<ZToken> tokens;
	private final ZScope scope;
	private final SeparatorFrames frames = new SeparatorFrames();
	private final boolean proseDetection;
	private int pos = 0;
	// inside declarations ';' separates entries instead of composing relations
	private boolean semicolonSeparates = false;

	public ParseContext(List<ZToken> tokens, ZScope scope, boolean proseDetection) {
		if(tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != ZTokenType.EOF) {
			throw new IllegalArgumentException("token list must end with EOF");
		}
		this.tokens = tokens;
		this.scope = scope;
		this.proseDetection = proseDetection;
	}

	public ZScope getScope() {
		return scope;
	}

	public SeparatorFrames getFrames() {
		return frames;
	}

	public boolean isProseDetection() {
		return proseDetection;
	}

	public boolean semicolonSeparates() {
		return semicolonSeparates;
	}

	/**
	 * @return the previous value, to be restored by the caller
	 */
	public boolean setSemicolonSeparates(boolean value) {
		boolean old = semicolonSeparates;
		semicolonSeparates = value;
		return old;
	}

	public ZToken peek() {
		return tokens.get(pos);
	}

	public ZToken peek(int ahead) {
		return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
	}

	public boolean at(ZTokenType type) {
		return peek().getType() == type;
	}

	public boolean at(ZTokenType... types) {
		ZTokenType t = peek().getType();
		for(ZTokenType type : types) {
			if(t == type) {
				return true;
			}
		}
		return false;
	}

	public ZToken next() {
		ZToken t = tokens.get(pos);
		if(t.getType() != ZTokenType.EOF) {
			++pos;
		}
		return t;
	}

	public ZToken previous() {
		return tokens.get(Math.max(pos - 1, 0));
	}

	/**
	 * @return the next token if it has the given type, consuming it, or null otherwise
	 */
	public ZToken accept(ZTokenType type) {
		if(at(type)) {
			return next();
		}
		return null;
	}

	public ZToken expect(ZTokenType type, String what) throws ZParseException {
		if(at(type)) {
			return next();
		}
		throw unexpected(what);
	}

	/**
	 * Builds the failure for finding the current token where something else was expected. A stray
	 * separator gets a message of its own, since that is the usual mistake behind it.
	 */
	public ZParseException unexpected(String expected) {
		ZToken found = peek();
		if(found.getType() == ZTokenType.BULLET && frames.owner() == null) {
			return new ZParseException(found.getLocation(),
					"separator '" + found.getValue() + "' does not belong to any open quantifier or comprehension",
					expected, found, "a '.' separator needs a quantifier, lambda, mu or set comprehension before it");
		}
		return ZParseException.unexpected(found, expected);
	}

	public boolean atLineEnd() {
		return at(ZTokenType.NEWLINE, ZTokenType.EOF);
	}

	public void expectLineEnd(String what) throws ZParseException {
		if(!atLineEnd()) {
			throw unexpected("end of line after " + what);
		}
		accept(ZTokenType.NEWLINE);
	}

	public void skipNewlines() {
		while(at(ZTokenType.NEWLINE)) {
			next();
		}
	}

	/**
	 * @return true if the current token starts a new line, so that the one before it was a NEWLINE
	 */
	public boolean atBlankLine() {
		return at(ZTokenType.NEWLINE) && pos > 0 && previous().getType() == ZTokenType.NEWLINE;
	}

	public int position() {
		return pos;
	}

	public void reset(int position) {
		pos = position;
	}

	/**
	 * @return the span from the start token through the last token consumed
	 */
	public SourceLocation locationFrom(ZToken start) {
		return start.getLocation().combine(previous().getLocation());
	}
}
