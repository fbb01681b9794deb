package txt2tex.lexer;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.List;

import org.junit.Test;

public class ZLexerBehaviourTest {

	private static ZLexerException failure(String source) {
		try {
			ZLexer.tokenize(source);
		} catch(ZLexerException e) {
			return e;
		}
		fail("lexing \"" + source + "\" should have failed");
		return null;
	}

	@Test
	public void everyMultiCharacterOperatorIsOneToken() throws ZLexerException {
		for(ZLexer.Spelling s : ZLexer.OPERATORS) {
			if(s.text.length() < 2 || s.text.equals("(|") || s.text.equals("|)")) {
				continue;
			}
			List<ZToken> tokens = ZLexer.tokenize("a " + s.text + " b");
			assertThat(s.text, tokens.size(), is(4));
			assertThat(s.text, tokens.get(1).getType(), is(s.type));
			assertThat(tokens.get(1).getValue(), is(s.text));
		}
	}

	@Test
	public void keywordsAreNotIdentifiers() throws ZLexerException {
		for(String word : ZLexer.KEYWORDS.keySet()) {
			List<ZToken> tokens = ZLexer.tokenize("x " + word + " y");
			assertThat(word, tokens.get(1).getType(), is(ZLexer.KEYWORDS.get(word)));
		}
	}

	@Test
	public void positions() throws ZLexerException {
		List<ZToken> tokens = ZLexer.tokenize("a\n  bc");
		ZToken bc = tokens.get(2);
		assertThat(bc.getValue(), is("bc"));
		assertThat(bc.getLine(), is(2));
		assertThat(bc.getColumn(), is(3));
		assertThat(bc.getLocation().getStartOffset(), is(4));
		assertThat(bc.getLocation().getEndOffset(), is(6));
		assertTrue(bc.isPrecededBySpace());
	}

	@Test
	public void spacing() throws ZLexerException {
		List<ZToken> tokens = ZLexer.tokenize("f(x) + (y)");
		assertFalse(tokens.get(1).isPrecededBySpace());
		assertTrue(tokens.get(4).isPrecededBySpace());
		assertTrue(tokens.get(0).isPrecededBySpace());
	}

	@Test
	public void fragmentPositionsAreRelativeToTheEnclosingBuffer() throws ZLexerException {
		List<ZToken> tokens = new ZLexer(null, "x > 0", 3, 12, 40, true).readTokens();
		assertThat(tokens.get(0).getLine(), is(3));
		assertThat(tokens.get(0).getColumn(), is(12));
		assertThat(tokens.get(2).getColumn(), is(16));
		assertThat(tokens.get(2).getLocation().getStartOffset(), is(44));
	}

	@Test
	public void fragmentsWithoutMarkersReadLineStartTextAsInput() throws ZLexerException {
		List<ZToken> plain = new ZLexer(null, "(a) and b", 1, 1, 0, false).readTokens();
		assertThat(plain.get(0).getType(), is(ZTokenType.LPAREN));
		assertThat(plain.get(3).getType(), is(ZTokenType.AND));
		List<ZToken> marked = new ZLexer(null, "(a) and b", 1, 1, 0, true).readTokens();
		assertThat(marked.get(0).getType(), is(ZTokenType.PART_LABEL));
	}

	@Test
	public void eofIsAlwaysLast() throws ZLexerException {
		List<ZToken> tokens = ZLexer.tokenize("");
		assertThat(tokens.size(), is(1));
		assertThat(tokens.get(0).getType(), is(ZTokenType.EOF));
	}

	@Test
	public void proseLineKeepsItsText() throws ZLexerException {
		List<ZToken> tokens = ZLexer.tokenize("  TEXT: x < y and (so on");
		assertThat(tokens.get(0).getType(), is(ZTokenType.TEXT));
		assertThat(tokens.get(0).getValue(), is("TEXT: x < y and (so on"));
		assertThat(tokens.get(0).getColumn(), is(3));
	}

	@Test
	public void structuralMarkersOnlyAtLineStart() throws ZLexerException {
		List<ZToken> tokens = ZLexer.tokenize("(a\nTEXT)");
		assertThat(tokens.get(2).getType(), is(ZTokenType.IDENTIFIER));
		assertThat(tokens.get(2).getValue(), is("TEXT"));
	}

	@Test
	public void unexpectedCharacter() {
		ZLexerException e = failure("x $ y");
		assertThat(e.getMsg(), is("unexpected character '$'"));
		assertThat(e.getLine(), is(1));
		assertThat(e.getColumn(), is(3));
		assertThat(e.getHint(), notNullValue());
	}

	@Test
	public void caretAfterSequence() {
		ZLexerException e = failure("<a>^<b>");
		assertThat(e.getColumn(), is(4));
		assertThat(e.getHint(), containsString("space"));
	}

	@Test
	public void unclosedParenthesis() {
		ZLexerException e = failure("x = (a + b");
		assertThat(e.getMsg(), is("unclosed '('"));
		assertThat(e.getColumn(), is(5));
	}

	@Test
	public void unclosedSuperscript() {
		ZLexerException e = failure("x^{n + 1");
		assertThat(e.getMsg(), is("unclosed '{'"));
	}

	@Test
	public void strayUnderscore() {
		ZLexerException e = failure("x _ y");
		assertThat(e.getMsg(), is("unexpected character '_'"));
	}
}
