package txt2tex.lexer;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import txt2tex.util.SourceLocation;

/**
 * Lexer for plain-text discrete mathematics and Z notation.
 *
 * Works a line at a time. Structural markers (section headers, TEXT: lines, PROOF: and so on) are only
 * recognised at the start of a line; everything else is scanned with longest-match against the OPERATORS
 * table, the KEYWORDS table and the UNICODE table, plus a handful of context rules for the characters whose
 * meaning depends on their neighbours: '^', '<', '>', '.', '[', '_' and a trailing '\'.
 *
 * To add a plain operator it is enough to add it to OPERATORS (or UNICODE / KEYWORDS).
 */
public class ZLexer {

	static final class Spelling {
		final String text;
		final ZTokenType type;

		Spelling(String text, ZTokenType type) {
			this.text = text;
			this.type = type;
		}
	}

	// kept sorted by decreasing length, see static initialiser
	static final List<Spelling> OPERATORS = new ArrayList<>(Arrays.asList(
		new Spelling("-->>", ZTokenType.TSURJ),
		new Spelling("+->>", ZTokenType.PSURJ),
		new Spelling(">->>", ZTokenType.BIJ),
		new Spelling("77->", ZTokenType.FFUN),
		new Spelling("<=>", ZTokenType.IFF),
		new Spelling("<->", ZTokenType.RELATION),
		new Spelling("|->", ZTokenType.MAPLET),
		new Spelling("+->", ZTokenType.PFUN),
		new Spelling(">->", ZTokenType.TINJ),
		new Spelling(">+>", ZTokenType.PINJ),
		new Spelling("<<|", ZTokenType.NDRES),
		new Spelling("|>>", ZTokenType.NRRES),
		new Spelling("::=", ZTokenType.DEFINE_FREE_TYPE),
		new Spelling("=>", ZTokenType.IMPLIES),
		new Spelling("->", ZTokenType.TFUN),
		new Spelling("<|", ZTokenType.DRES),
		new Spelling("|>", ZTokenType.RRES),
		new Spelling("<=", ZTokenType.LESS_EQUAL),
		new Spelling(">=", ZTokenType.GREATER_EQUAL),
		new Spelling("!=", ZTokenType.NOT_EQUAL),
		new Spelling("/=", ZTokenType.NOT_EQUAL),
		new Spelling("++", ZTokenType.OVERRIDE),
		new Spelling("..", ZTokenType.RANGE),
		new Spelling("==", ZTokenType.DEFINE_ABBREVIATION),
		new Spelling("::", ZTokenType.DOUBLE_COLON),
		new Spelling("(|", ZTokenType.LIMAGE),
		new Spelling("|)", ZTokenType.RIMAGE),
		new Spelling("(", ZTokenType.LPAREN),
		new Spelling(")", ZTokenType.RPAREN),
		new Spelling("]", ZTokenType.RBRACKET),
		new Spelling("{", ZTokenType.LBRACE),
		new Spelling("}", ZTokenType.RBRACE),
		new Spelling("|", ZTokenType.PIPE),
		new Spelling(";", ZTokenType.SEMICOLON),
		new Spelling(",", ZTokenType.COMMA),
		new Spelling(":", ZTokenType.COLON),
		new Spelling("#", ZTokenType.HASH),
		new Spelling("+", ZTokenType.PLUS),
		new Spelling("-", ZTokenType.MINUS),
		new Spelling("*", ZTokenType.STAR),
		new Spelling("=", ZTokenType.EQUALS),
		new Spelling("~", ZTokenType.TILDE),
		new Spelling("@", ZTokenType.BULLET),
		new Spelling("\\", ZTokenType.SETMINUS),
		new Spelling(">", ZTokenType.GREATER)
	));

	static {
		// stable sort, so equal-length entries keep their listed order
		OPERATORS.sort(Comparator.comparingInt((Spelling s) -> s.text.length()).reversed());
	}

	static final Map<String, ZTokenType> KEYWORDS = new HashMap<>();

	static {
		KEYWORDS.put("and", ZTokenType.AND);
		KEYWORDS.put("land", ZTokenType.AND);
		KEYWORDS.put("or", ZTokenType.OR);
		KEYWORDS.put("lor", ZTokenType.OR);
		KEYWORDS.put("not", ZTokenType.NOT);
		KEYWORDS.put("lnot", ZTokenType.NOT);
		KEYWORDS.put("implies", ZTokenType.IMPLIES);
		KEYWORDS.put("iff", ZTokenType.IFF);
		KEYWORDS.put("true", ZTokenType.TRUE);
		KEYWORDS.put("false", ZTokenType.FALSE);
		KEYWORDS.put("shows", ZTokenType.SHOWS);
		KEYWORDS.put("forall", ZTokenType.FORALL);
		KEYWORDS.put("exists", ZTokenType.EXISTS);
		KEYWORDS.put("exists1", ZTokenType.EXISTS1);
		KEYWORDS.put("mu", ZTokenType.MU);
		KEYWORDS.put("lambda", ZTokenType.LAMBDA);
		KEYWORDS.put("if", ZTokenType.IF);
		KEYWORDS.put("then", ZTokenType.THEN);
		KEYWORDS.put("else", ZTokenType.ELSE);
		KEYWORDS.put("elem", ZTokenType.ELEM);
		KEYWORDS.put("in", ZTokenType.ELEM);
		KEYWORDS.put("notin", ZTokenType.NOTIN);
		KEYWORDS.put("subset", ZTokenType.SUBSET);
		KEYWORDS.put("subseteq", ZTokenType.SUBSET);
		KEYWORDS.put("psubset", ZTokenType.PSUBSET);
		KEYWORDS.put("union", ZTokenType.UNION);
		KEYWORDS.put("intersect", ZTokenType.INTERSECT);
		KEYWORDS.put("cross", ZTokenType.CROSS);
		KEYWORDS.put("bigcup", ZTokenType.BIGCUP);
		KEYWORDS.put("bigcap", ZTokenType.BIGCAP);
		KEYWORDS.put("emptyset", ZTokenType.EMPTYSET);
		KEYWORDS.put("dom", ZTokenType.DOM);
		KEYWORDS.put("ran", ZTokenType.RAN);
		KEYWORDS.put("inv", ZTokenType.INV);
		KEYWORDS.put("id", ZTokenType.ID);
		KEYWORDS.put("o9", ZTokenType.COMP);
		KEYWORDS.put("comp", ZTokenType.COMP);
		KEYWORDS.put("div", ZTokenType.DIV);
		KEYWORDS.put("mod", ZTokenType.MOD);
		KEYWORDS.put("filter", ZTokenType.FILTER);
		KEYWORDS.put("bag_union", ZTokenType.BAG_UNION);
		KEYWORDS.put("given", ZTokenType.GIVEN);
		KEYWORDS.put("axdef", ZTokenType.AXDEF);
		KEYWORDS.put("gendef", ZTokenType.GENDEF);
		KEYWORDS.put("schema", ZTokenType.SCHEMA);
		KEYWORDS.put("zed", ZTokenType.ZED);
		KEYWORDS.put("where", ZTokenType.WHERE);
		KEYWORDS.put("end", ZTokenType.END);
		KEYWORDS.put("Delta", ZTokenType.DELTA);
		KEYWORDS.put("Xi", ZTokenType.XI);
	}

	static final Map<Character, ZTokenType> UNICODE = new HashMap<>();

	static {
		UNICODE.put('∧', ZTokenType.AND);
		UNICODE.put('∨', ZTokenType.OR);
		UNICODE.put('¬', ZTokenType.NOT);
		UNICODE.put('⇒', ZTokenType.IMPLIES);
		UNICODE.put('⇔', ZTokenType.IFF);
		UNICODE.put('⊢', ZTokenType.SHOWS);
		UNICODE.put('∀', ZTokenType.FORALL);
		UNICODE.put('∃', ZTokenType.EXISTS);
		UNICODE.put('μ', ZTokenType.MU);
		UNICODE.put('λ', ZTokenType.LAMBDA);
		UNICODE.put('∈', ZTokenType.ELEM);
		UNICODE.put('∉', ZTokenType.NOTIN);
		UNICODE.put('⊆', ZTokenType.SUBSET);
		UNICODE.put('⊂', ZTokenType.PSUBSET);
		UNICODE.put('∪', ZTokenType.UNION);
		UNICODE.put('∩', ZTokenType.INTERSECT);
		UNICODE.put('∖', ZTokenType.SETMINUS);
		UNICODE.put('×', ZTokenType.CROSS);
		UNICODE.put('⋃', ZTokenType.BIGCUP);
		UNICODE.put('⋂', ZTokenType.BIGCAP);
		UNICODE.put('∅', ZTokenType.EMPTYSET);
		UNICODE.put('↔', ZTokenType.RELATION);
		UNICODE.put('↦', ZTokenType.MAPLET);
		UNICODE.put('◁', ZTokenType.DRES);
		UNICODE.put('▷', ZTokenType.RRES);
		UNICODE.put('⩤', ZTokenType.NDRES);
		UNICODE.put('⩥', ZTokenType.NRRES);
		UNICODE.put('∘', ZTokenType.COMP);
		UNICODE.put('⨾', ZTokenType.COMP);
		UNICODE.put('⊕', ZTokenType.OVERRIDE);
		UNICODE.put('→', ZTokenType.TFUN);
		UNICODE.put('⇸', ZTokenType.PFUN);
		UNICODE.put('↣', ZTokenType.TINJ);
		UNICODE.put('⤔', ZTokenType.PINJ);
		UNICODE.put('↠', ZTokenType.TSURJ);
		UNICODE.put('⤀', ZTokenType.PSURJ);
		UNICODE.put('⤖', ZTokenType.BIJ);
		UNICODE.put('⇻', ZTokenType.FFUN);
		UNICODE.put('≠', ZTokenType.NOT_EQUAL);
		UNICODE.put('≤', ZTokenType.LESS_EQUAL);
		UNICODE.put('≥', ZTokenType.GREATER_EQUAL);
		UNICODE.put('⟨', ZTokenType.LANGLE);
		UNICODE.put('⟩', ZTokenType.RANGLE);
		UNICODE.put('⟦', ZTokenType.LBAG);
		UNICODE.put('⟧', ZTokenType.RBAG);
		UNICODE.put('⦇', ZTokenType.LIMAGE);
		UNICODE.put('⦈', ZTokenType.RIMAGE);
		UNICODE.put('↾', ZTokenType.FILTER);
		UNICODE.put('⊎', ZTokenType.BAG_UNION);
		UNICODE.put('⁀', ZTokenType.CONCAT);
		UNICODE.put('⌢', ZTokenType.CONCAT);
		UNICODE.put('•', ZTokenType.BULLET);
		UNICODE.put('Δ', ZTokenType.DELTA);
		UNICODE.put('Ξ', ZTokenType.XI);
	}

	// structural markers; matched against the whole line
	static final Pattern SECTION = Pattern.compile("\\s*===\\s*(.*?)\\s*===\\s*");
	static final Pattern SOLUTION = Pattern.compile("\\s*\\*\\*\\s*(.+?)\\s*\\*\\*\\s*");
	static final Pattern PROSE = Pattern.compile("\\s*(TEXT|PURETEXT|LATEX):.*");
	static final Pattern PAGEBREAK = Pattern.compile("\\s*PAGEBREAK:?\\s*");
	static final Pattern METADATA = Pattern.compile("\\s*(TITLE|SUBTITLE|AUTHOR|DATE|INSTITUTION):.*");
	static final Pattern RULE_LINE = Pattern.compile("\\s*-{3,}\\s*");
	// markers which may be followed by more tokens on the same line
	static final Pattern BLOCK_MARKER = Pattern.compile("\\s*(TRUTH TABLE:|EQUIV:|ARGUE:|PROOF:|INFRULE:)");
	static final Pattern PART_LABEL = Pattern.compile("\\s*\\(([a-j])\\)(?=\\s|$)");

	static final Pattern WHITESPACE = Pattern.compile("\\s+");
	static final Pattern NUMBER = Pattern.compile("[0-9]+");
	static final Pattern DECIMAL = Pattern.compile("[0-9]+\\.[0-9]+");
	// a name which starts with digits, as in 479_courses
	static final Pattern DIGIT_IDENT = Pattern.compile("[0-9]+_\\p{L}[\\p{L}0-9_]*");
	// identifier body; decorations and subscripts are handled separately
	static final Pattern IDENT = Pattern.compile("\\p{L}[\\p{L}0-9_]*");

	// glyphs the sequence-bracket scan must step over instead of reading '<' or '>' out of them
	static final String[] ANGLE_GLYPHS = {
		"-->>", "+->>", ">->>", "77->", "<=>", "<->", "|->", "+->", ">->", ">+>", "<<|", "|>>", "=>", "->", "<|", "|>",
	};

	private final Path file;
	private final String source;
	private final int firstLine;
	private final int firstColumn;
	private final int firstOffset;
	private final boolean markers;

	private final List<ZToken> tokens = new ArrayList<>();
	// open brackets, innermost last
	private final Deque<ZToken> brackets = new ArrayDeque<>();
	// absolute offsets of '>' characters already paired with an opening '<'
	private final Set<Integer> sequenceCloses = new HashSet<>();

	private String line;
	private int lineNum;
	private int lineOffset;
	private int columnBase;
	private boolean spaceBefore;

	public ZLexer(Path file, String source) {
		this(file, source, 1, 1, 0, true);
	}

	/**
	 * A lexer for a fragment of a larger buffer, such as a span of a TEXT: line. Positions of the produced
	 * tokens are reported relative to the larger buffer.
	 *
	 * @param firstLine the line the fragment starts on
	 * @param firstColumn the column of the fragment's first character
	 * @param firstOffset the offset of the fragment's first character
	 * @param markers whether a line may start with a structural marker; false for fragments of prose, where
	 *                "(a)" or "TEXT:" is ordinary input
	 */
	public ZLexer(Path file, String source, int firstLine, int firstColumn, int firstOffset, boolean markers) {
		this.file = file;
		this.source = source;
		this.firstLine = firstLine;
		this.firstColumn = firstColumn;
		this.firstOffset = firstOffset;
		this.markers = markers;
	}

	public static List<ZToken> tokenize(String source) throws ZLexerException {
		return new ZLexer(null, source).readTokens();
	}

	private SourceLocation location(int start, int end) {
		return new SourceLocation(file, lineOffset + start, lineOffset + end, lineNum, lineNum,
				columnBase + start, columnBase + end);
	}

	private ZToken addToken(String value, ZTokenType type, int column) {
		ZToken tok = new ZToken(value, type, location(column, column + value.length()), spaceBefore);
		tokens.add(tok);
		spaceBefore = false;
		return tok;
	}

	private ZToken previous() {
		return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
	}

	private boolean previousIs(ZTokenType type) {
		ZToken prev = previous();
		return prev != null && prev.getType() == type;
	}

	/**
	 * @return a list of tokens scanned from the buffer the lexer was given, ending with an EOF token
	 * @throws ZLexerException at the first piece of input the lexer cannot understand
	 */
	public List<ZToken> readTokens() throws ZLexerException {
		String[] lines = source.split("\n", -1);
		lineOffset = firstOffset;
		lineNum = firstLine;
		columnBase = firstColumn;
		boolean continued = false;
		for(int i = 0; i < lines.length; ++i) {
			line = lines[i];
			if(line.endsWith("\r")) {
				line = line.substring(0, line.length() - 1);
			}
			spaceBefore = true;
			boolean atLineStart = markers && brackets.isEmpty() && !continued;
			continued = readLine(atLineStart);
			// the split leaves one empty string after a trailing newline; it is not a line of its own
			boolean lastLine = i == lines.length - 1;
			if(!lastLine && brackets.isEmpty() && !continued) {
				addToken("", ZTokenType.NEWLINE, line.length());
			}
			lineOffset += lines[i].length() + 1;
			++lineNum;
			columnBase = 1;
		}
		if(!brackets.isEmpty()) {
			ZToken open = brackets.peekLast();
			throw new ZLexerException(open.getLocation(), "unclosed '" + open.getValue() + "'",
					"every '" + open.getValue() + "' needs a matching '" + closerFor(open.getType()) + "'");
		}
		// report EOF just past the last character read
		--lineNum;
		lineOffset -= lines[lines.length - 1].length() + 1;
		line = lines[lines.length - 1];
		if(lines.length == 1) {
			columnBase = firstColumn;
		}
		spaceBefore = true;
		addToken("", ZTokenType.EOF, line.length());
		return Collections.unmodifiableList(tokens);
	}

	private static String closerFor(ZTokenType open) {
		switch(open) {
			case LPAREN:
				return ")";
			case LBRACKET:
			case INDEX_OPEN:
				return "]";
			case LBRACE:
				return "}";
			case LANGLE:
				return ">";
			case LBAG:
				return "]]";
			case LIMAGE:
				return "|)";
			default:
				return "?";
		}
	}

	/**
	 * @return true if the line ends in a continuation backslash
	 */
	private boolean readLine(boolean atLineStart) throws ZLexerException {
		int column = 0;
		if(atLineStart) {
			if(matchWholeLine(SECTION, ZTokenType.SECTION_HEADER)
					|| matchWholeLine(SOLUTION, ZTokenType.SOLUTION_HEADER)
					|| matchWholeLine(PROSE, ZTokenType.TEXT)
					|| matchWholeLine(PAGEBREAK, ZTokenType.PAGEBREAK)
					|| matchWholeLine(METADATA, ZTokenType.METADATA)
					|| matchWholeLine(RULE_LINE, ZTokenType.RULE_LINE)) {
				return false;
			}
			Matcher m = BLOCK_MARKER.matcher(line);
			if(m.lookingAt()) {
				ZTokenType type;
				switch(m.group(1)) {
					case "TRUTH TABLE:":
						type = ZTokenType.TRUTH_TABLE;
						break;
					case "EQUIV:":
						type = ZTokenType.EQUIV;
						break;
					case "ARGUE:":
						type = ZTokenType.ARGUE;
						break;
					case "PROOF:":
						type = ZTokenType.PROOF;
						break;
					default:
						type = ZTokenType.INFRULE;
				}
				addToken(m.group(1), type, m.start(1));
				column = m.end();
			} else {
				m = PART_LABEL.matcher(line);
				if(m.lookingAt()) {
					addToken(line.substring(m.start(1) - 1, m.end()), ZTokenType.PART_LABEL, m.start(1) - 1);
					column = m.end();
				}
			}
		}
		int oldColumn = -1;
		while(column < line.length()) {
			if(column == oldColumn) {
				throw new ZLexerException(location(column, column + 1), "lexer got stuck at column " + (columnBase + column));
			}
			oldColumn = column;

			Matcher m = WHITESPACE.matcher(line);
			m.region(column, line.length());
			if(m.lookingAt()) {
				column = m.end();
				spaceBefore = true;
				continue;
			}

			char c = line.charAt(column);
			if(c == '\\' && line.substring(column + 1).trim().isEmpty()) {
				return true;
			}
			if(c == '^') {
				column = readCaret(column);
				continue;
			}
			if(c == '<') {
				column = readLess(column);
				continue;
			}
			if(c == '>' && sequenceCloses.remove(lineOffset + column)) {
				closeBracket(addToken(">", ZTokenType.RANGLE, column));
				++column;
				continue;
			}
			if(c == '.') {
				column = readDot(column);
				continue;
			}
			if(c == '[') {
				column = readOpenBracket(column);
				continue;
			}
			if(c == ']') {
				if(line.startsWith("]]", column) && !brackets.isEmpty()
						&& brackets.peekLast().getType() == ZTokenType.LBAG) {
					closeBracket(addToken("]]", ZTokenType.RBAG, column));
					column += 2;
				} else {
					closeBracket(addToken("]", ZTokenType.RBRACKET, column));
					++column;
				}
				continue;
			}
			if(c == '_') {
				column = readSubscript(column);
				continue;
			}
			if(c == '∃' && line.startsWith("₁", column + 1)) {
				addToken(line.substring(column, column + 2), ZTokenType.EXISTS1, column);
				column += 2;
				continue;
			}
			ZTokenType unicode = UNICODE.get(c);
			if(unicode != null) {
				ZToken tok = addToken(String.valueOf(c), unicode, column);
				trackBracket(tok);
				++column;
				continue;
			}
			if(line.startsWith("77->", column)) {
				addToken("77->", ZTokenType.FFUN, column);
				column += 4;
				continue;
			}
			if(Character.isDigit(c)) {
				column = readNumber(column);
				continue;
			}
			m = IDENT.matcher(line);
			m.region(column, line.length());
			if(m.lookingAt()) {
				column = readWord(m.group(), column);
				continue;
			}
			Spelling op = matchOperator(column);
			if(op != null) {
				ZToken tok = addToken(op.text, op.type, column);
				trackBracket(tok);
				column += op.text.length();
				continue;
			}
			String hint = null;
			if(c == '$') {
				hint = "'$' delimits mathematics inside TEXT: paragraphs only";
			}
			throw new ZLexerException(location(column, column + 1), "unexpected character '" + c + "'", hint);
		}
		return false;
	}

	private boolean matchWholeLine(Pattern p, ZTokenType type) {
		Matcher m = p.matcher(line);
		if(!m.matches()) {
			return false;
		}
		int start = 0;
		while(start < line.length() && Character.isWhitespace(line.charAt(start))) {
			++start;
		}
		int end = line.length();
		if(type != ZTokenType.TEXT && type != ZTokenType.METADATA) {
			while(end > start && Character.isWhitespace(line.charAt(end - 1))) {
				--end;
			}
		}
		if(type == ZTokenType.TEXT) {
			if(line.startsWith("PURETEXT:", start)) {
				type = ZTokenType.PURETEXT;
			} else if(line.startsWith("LATEX:", start)) {
				type = ZTokenType.LATEX;
			}
		}
		addToken(line.substring(start, end), type, start);
		return true;
	}

	private Spelling matchOperator(int column) {
		for(Spelling s : OPERATORS) {
			if(line.startsWith(s.text, column)) {
				return s;
			}
		}
		return null;
	}

	private void trackBracket(ZToken tok) throws ZLexerException {
		switch(tok.getType()) {
			case LPAREN:
			case LBRACE:
			case LANGLE:
			case LBAG:
			case LIMAGE:
				brackets.addLast(tok);
				break;
			case RPAREN:
			case RBRACE:
			case RANGLE:
			case RBAG:
			case RIMAGE:
				closeBracket(tok);
				break;
			default:
				break;
		}
	}

	private void closeBracket(ZToken tok) {
		// mismatches are left for the parser to report with its expected/found context
		if(!brackets.isEmpty()) {
			brackets.removeLast();
		}
	}

	private int readCaret(int column) throws ZLexerException {
		if(spaceBefore) {
			addToken("^", ZTokenType.CONCAT, column);
			return column + 1;
		}
		if(previousIs(ZTokenType.RANGLE)) {
			throw new ZLexerException(location(column, column + 1),
					"'^' directly after a sequence is read as exponentiation",
					"for sequence concatenation put a space before '^', as in '> ^ <'");
		}
		if(line.startsWith("^{", column)) {
			int end = matchBrace(column + 1);
			addToken(line.substring(column, end), ZTokenType.SUPERSCRIPT_GROUP, column);
			return end;
		}
		addToken("^", ZTokenType.POWER, column);
		return column + 1;
	}

	private int readSubscript(int column) throws ZLexerException {
		if(line.startsWith("_{", column)) {
			int end = matchBrace(column + 1);
			addToken(line.substring(column, end), ZTokenType.SUBSCRIPT_GROUP, column);
			return end;
		}
		if(column + 1 < line.length() && Character.isLetterOrDigit(line.charAt(column + 1))
				&& (column + 2 >= line.length() || !isIdentifierChar(line.charAt(column + 2)))) {
			addToken(line.substring(column, column + 2), ZTokenType.SUBSCRIPT, column);
			return column + 2;
		}
		throw new ZLexerException(location(column, column + 1), "unexpected character '_'",
				"write a subscript as x_i or x_{...}");
	}

	/**
	 * @param open the column of a '{'
	 * @return the column just past its matching '}'
	 */
	private int matchBrace(int open) throws ZLexerException {
		int depth = 0;
		for(int i = open; i < line.length(); ++i) {
			char c = line.charAt(i);
			if(c == '{') {
				++depth;
			} else if(c == '}') {
				--depth;
				if(depth == 0) {
					return i + 1;
				}
			}
		}
		throw new ZLexerException(location(open, open + 1), "unclosed '{'",
				"close the braces of a superscript or subscript on the same line");
	}

	private int readDot(int column) {
		if(line.startsWith("..", column)) {
			addToken("..", ZTokenType.RANGE, column);
			return column + 2;
		}
		boolean tight = !spaceBefore && column + 1 < line.length()
				&& Character.isLetterOrDigit(line.charAt(column + 1));
		addToken(".", tight ? ZTokenType.DOT : ZTokenType.BULLET, column);
		return column + 1;
	}

	private int readOpenBracket(int column) {
		ZToken prev = previous();
		boolean hugging = !spaceBefore && prev != null && isHuggable(prev.getType());
		if(!hugging && line.startsWith("[[", column)) {
			brackets.addLast(addToken("[[", ZTokenType.LBAG, column));
			return column + 2;
		}
		brackets.addLast(addToken("[", hugging ? ZTokenType.INDEX_OPEN : ZTokenType.LBRACKET, column));
		return column + 1;
	}

	private static boolean isHuggable(ZTokenType type) {
		switch(type) {
			case IDENTIFIER:
			case SUBSCRIPT:
			case SUBSCRIPT_GROUP:
			case RPAREN:
			case RBRACKET:
			case RANGLE:
			case RBRACE:
			case EMPTYSET:
				return true;
			default:
				return false;
		}
	}

	private int readLess(int column) {
		if(line.startsWith("<>", column)) {
			addToken("<", ZTokenType.LANGLE, column);
			addToken(">", ZTokenType.RANGLE, column + 1);
			return column + 2;
		}
		Spelling op = matchOperator(column);
		if(op != null && op.text.length() > 1) {
			addToken(op.text, op.type, column);
			return column + op.text.length();
		}
		int close = -1;
		if(column + 1 < line.length() && !Character.isWhitespace(line.charAt(column + 1))) {
			close = findSequenceClose(column);
		}
		if(close < 0) {
			addToken("<", ZTokenType.LESS, column);
			return column + 1;
		}
		sequenceCloses.add(lineOffset + close);
		brackets.addLast(addToken("<", ZTokenType.LANGLE, column));
		return column + 1;
	}

	/**
	 * Looks for the '>' closing a sequence opened by the '<' at open.
	 *
	 * @return the column of the closing '>', or -1 if the '<' has to be read as a comparison
	 */
	private int findSequenceClose(int open) {
		int depth = 0;
		int angles = 0;
		int i = open + 1;
		scan:
		while(i < line.length()) {
			// a connective ends the formula a sequence could belong to
			if(line.startsWith("=>", i) || line.startsWith("<=>", i) || startsWord("and", i) || startsWord("or", i)) {
				return -1;
			}
			for(String glyph : ANGLE_GLYPHS) {
				if(line.startsWith(glyph, i)) {
					i += glyph.length();
					continue scan;
				}
			}
			if(line.startsWith("<=", i) || line.startsWith(">=", i)) {
				return -1;
			}
			char c = line.charAt(i);
			switch(c) {
				case '≤':
				case '≥':
				case '∧':
				case '∨':
				case '⇒':
				case '⇔':
					return -1;
				case '(':
				case '[':
				case '{':
					++depth;
					break;
				case ')':
				case ']':
				case '}':
					if(depth == 0) {
						return -1;
					}
					--depth;
					break;
				case '<':
					if(line.startsWith("<>", i)) {
						++i;
					} else if(i + 1 >= line.length() || Character.isWhitespace(line.charAt(i + 1))) {
						return -1;
					} else {
						++angles;
					}
					break;
				case '>':
					if(Character.isWhitespace(line.charAt(i - 1))) {
						return -1;
					}
					if(angles > 0) {
						--angles;
					} else if(depth == 0) {
						return i;
					}
					break;
				default:
					break;
			}
			++i;
		}
		return -1;
	}

	private boolean startsWord(String word, int at) {
		int end = at + word.length();
		return line.startsWith(word, at)
				&& (at == 0 || !isIdentifierChar(line.charAt(at - 1)))
				&& (end == line.length() || !isIdentifierChar(line.charAt(end)));
	}

	private int readNumber(int column) {
		Matcher m = DIGIT_IDENT.matcher(line);
		m.region(column, line.length());
		if(m.lookingAt()) {
			addToken(m.group(), ZTokenType.IDENTIFIER, column);
			return m.end();
		}
		m = DECIMAL.matcher(line);
		m.region(column, line.length());
		// a number right after a tight '.' is a positional projection, as in p.1.2
		if(!previousIs(ZTokenType.DOT) && m.lookingAt()) {
			addToken(m.group(), ZTokenType.NUMBER, column);
			return m.end();
		}
		m = NUMBER.matcher(line);
		m.region(column, line.length());
		m.lookingAt();
		addToken(m.group(), ZTokenType.NUMBER, column);
		return m.end();
	}

	private static boolean isIdentifierChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private int readWord(String word, int column) {
		ZTokenType keyword = KEYWORDS.get(word);
		if(keyword != null) {
			addToken(word, keyword, column);
			return column + word.length();
		}
		int end = column + word.length();
		// x_i: the single character after the last underscore becomes a subscript
		int underscore = word.lastIndexOf('_');
		if(underscore > 0 && underscore == word.length() - 2) {
			addToken(word.substring(0, underscore), ZTokenType.IDENTIFIER, column);
			addToken(word.substring(underscore), ZTokenType.SUBSCRIPT, column + underscore);
			return end;
		}
		// x_{...}: leave the underscore for readSubscript
		if(word.endsWith("_") && line.startsWith("{", end)) {
			addToken(word.substring(0, word.length() - 1), ZTokenType.IDENTIFIER, column);
			return end - 1;
		}
		// Z decorations
		while(end < line.length()) {
			char c = line.charAt(end);
			if(c == '\'' || ((c == '?' || c == '!') && !line.startsWith("=", end + 1))) {
				++end;
			} else {
				break;
			}
		}
		if(end < line.length() && "+*~".indexOf(line.charAt(end)) >= 0 && isCompoundName(end + 1)) {
			++end;
		}
		addToken(line.substring(column, end), ZTokenType.IDENTIFIER, column);
		return end;
	}

	/**
	 * Decides whether a postfix glyph hugging an identifier belongs to a name being declared, as in
	 * "schema R+" or "R+ == ...". The lexer runs before the parser, so this is decided from the text.
	 *
	 * @param after the column just past the glyph
	 */
	private boolean isCompoundName(int after) {
		if(previousIs(ZTokenType.SCHEMA)) {
			return true;
		}
		String rest = line.substring(after).trim();
		if(rest.startsWith("==") || rest.startsWith("::=")) {
			return true;
		}
		return rest.startsWith(":") && !rest.startsWith("::") && !rest.startsWith(":=");
	}

}
