package txt2tex.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

import txt2tex.lexer.ZLexer;
import txt2tex.lexer.ZLexerException;
import txt2tex.lexer.ZToken;
import txt2tex.lexer.ZTokenType;
import txt2tex.model.document.Paragraph;
import txt2tex.model.document.ProseSpan;
import txt2tex.model.z.ZExpression;
import txt2tex.scope.ZScope;
import txt2tex.util.SourceLocation;

/**
 * Finds expressions embedded in the text of a TEXT: paragraph.
 *
 * Explicit spans are written between dollar signs and must parse. With detection enabled, brace groups and
 * phrases that open with a quantifier, lambda or mu are also tried; a phrase runs up to the first common
 * English word after it. Candidates that fail to parse are left as prose.
 */
public class ProseScanner {

	private static final Logger logger = Logger.getLogger("Txt2Tex Parser");

	static final Set<String> PROSE_WORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"a", "an", "the",
			"be", "been", "is", "are", "was", "were",
			"can", "could", "do", "does", "did", "had", "has", "have", "may", "might", "must", "should", "will",
			"would",
			"false", "true",
			"that", "these", "this", "those",
			"it", "its", "them", "they", "whatever", "whoever",
			"as", "at", "by", "for", "from", "in", "of", "on", "to", "with",
			"here", "syntax", "there", "valid")));

	private static final Set<String> BINDER_WORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"forall", "exists", "exists1", "mu", "lambda")));

	private static final String BINDER_GLYPHS = "∀∃μλ";

	private final ZScope scope;
	private final boolean detect;

	public ProseScanner(ZScope scope, boolean detect) {
		this.scope = scope;
		this.detect = detect;
	}

	/**
	 * @param token a TEXT, PURETEXT or LATEX token; its value starts with the marker
	 */
	public Paragraph scan(ZToken token) throws ZParseException {
		Paragraph.Kind kind;
		switch(token.getType()) {
			case TEXT:
				kind = Paragraph.Kind.TEXT;
				break;
			case PURETEXT:
				kind = Paragraph.Kind.PURETEXT;
				break;
			case LATEX:
				kind = Paragraph.Kind.LATEX;
				break;
			default:
				throw ZParseException.unexpected(token, "a prose paragraph");
		}
		String value = token.getValue();
		int textStart = value.indexOf(':') + 1;
		while(textStart < value.length() && Character.isWhitespace(value.charAt(textStart))) {
			++textStart;
		}
		String text = value.substring(textStart);
		if(kind != Paragraph.Kind.TEXT) {
			return new Paragraph(token.getLocation(), kind, text, Collections.emptyList());
		}
		return new Paragraph(token.getLocation(), kind, text, findSpans(token.getLocation(), textStart, text));
	}

	private List<ProseSpan> findSpans(SourceLocation line, int textStart, String text) throws ZParseException {
		List<ProseSpan> spans = new ArrayList<>();
		int i = 0;
		while(i < text.length()) {
			char c = text.charAt(i);
			if(c == '$') {
				int close = text.indexOf('$', i + 1);
				if(close < 0) {
					throw new ZParseException(at(line, textStart + i, textStart + i + 1), "unclosed '$'",
							"an inline expression is written between two dollar signs, as in $x > 0$");
				}
				ZExpression e = parseFragment(line, textStart + i + 1, text.substring(i + 1, close));
				spans.add(new ProseSpan(at(line, textStart + i, textStart + close + 1), i, close + 1, true, e));
				i = close + 1;
				continue;
			}
			if(detect && startsWord(text, i)) {
				int end = candidateEnd(text, i);
				if(end > i) {
					ProseSpan span = tryCandidate(line, textStart, text, i, end);
					if(span != null) {
						spans.add(span);
						i = end;
						continue;
					}
				}
			}
			++i;
		}
		return spans;
	}

	private static boolean startsWord(String text, int i) {
		return i == 0 || !Character.isLetterOrDigit(text.charAt(i - 1));
	}

	/**
	 * @return the end of the candidate expression starting at i, or i if none starts there
	 */
	private static int candidateEnd(String text, int i) {
		char c = text.charAt(i);
		if(c == '{') {
			int depth = 0;
			for(int j = i; j < text.length(); ++j) {
				if(text.charAt(j) == '{') {
					++depth;
				} else if(text.charAt(j) == '}' && --depth == 0) {
					return j + 1;
				}
			}
			return i;
		}
		int wordEnd = i;
		while(wordEnd < text.length() && Character.isLetterOrDigit(text.charAt(wordEnd))) {
			++wordEnd;
		}
		boolean binder = BINDER_WORDS.contains(text.substring(i, wordEnd))
				|| (BINDER_GLYPHS.indexOf(c) >= 0 && wordEnd <= i + 1);
		if(!binder) {
			return i;
		}
		int end = Math.max(wordEnd, i + 1);
		int j = end;
		while(j < text.length()) {
			if(Character.isLetter(text.charAt(j)) && startsWord(text, j)) {
				int k = j;
				while(k < text.length() && Character.isLetterOrDigit(text.charAt(k))) {
					++k;
				}
				if(PROSE_WORDS.contains(text.substring(j, k).toLowerCase(Locale.ROOT))) {
					return trimTail(text, i, j);
				}
				j = k;
			} else {
				++j;
			}
		}
		return trimTail(text, i, text.length());
	}

	// drops trailing blanks and sentence punctuation
	private static int trimTail(String text, int start, int end) {
		while(end > start && (Character.isWhitespace(text.charAt(end - 1)) || ",;:".indexOf(text.charAt(end - 1)) >= 0)) {
			--end;
		}
		if(end > start && text.charAt(end - 1) == '.') {
			--end;
		}
		return end;
	}

	private ProseSpan tryCandidate(SourceLocation line, int textStart, String text, int start, int end) {
		String fragment = text.substring(start, end);
		try {
			ZExpression e = parseFragment(line, textStart + start, fragment);
			return new ProseSpan(at(line, textStart + start, textStart + end), start, end, false, e);
		} catch(ZParseException e) {
			logger.fine("kept as prose: \"" + fragment + "\" (" + e.getMsg() + ")");
			return null;
		}
	}

	private ZExpression parseFragment(SourceLocation line, int offsetInLine, String fragment)
			throws ZParseException {
		List<ZToken> tokens;
		try {
			tokens = new ZLexer(line.getFile(), fragment, line.getStartLine(),
					line.getStartColumn() + offsetInLine, line.getStartOffset() + offsetInLine, false).readTokens();
		} catch(ZLexerException e) {
			throw new ZParseException(e.getLocation(), e.getMsg(), e.getHint());
		}
		ParseContext sub = new ParseContext(tokens, scope, false);
		ZExpression e = new ZExpressionParser(sub).parseExpression();
		if(!sub.at(ZTokenType.EOF)) {
			throw sub.unexpected("the end of the inline expression");
		}
		return e;
	}

	private static SourceLocation at(SourceLocation line, int start, int end) {
		return new SourceLocation(line.getFile(), line.getStartOffset() + start, line.getStartOffset() + end,
				line.getStartLine(), line.getStartLine(), line.getStartColumn() + start, line.getStartColumn() + end);
	}
}
