package txt2tex.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static txt2tex.model.z.ZBuilder.*;

import org.junit.Test;

import txt2tex.lexer.ZLexer;
import txt2tex.lexer.ZLexerException;
import txt2tex.model.document.Paragraph;
import txt2tex.model.document.ProseSpan;
import txt2tex.model.z.ZOperator;

public class ProseScannerTest {

	private static Paragraph paragraph(String line, boolean detect) throws ZLexerException, ZParseException {
		return (Paragraph) ZParser.readDocument(ZLexer.tokenize(line), detect).getItems().get(0);
	}

	private static Paragraph paragraph(String line) throws ZLexerException, ZParseException {
		return paragraph(line, true);
	}

	@Test
	public void braceGroupIsDetected() throws Exception {
		Paragraph p = paragraph("TEXT: the set {1, 2} is finite");
		assertThat(p.getKind(), is(Paragraph.Kind.TEXT));
		assertThat(p.getText(), is("the set {1, 2} is finite"));
		assertThat(p.getSpans().size(), is(1));
		ProseSpan span = p.getSpans().get(0);
		assertThat(span.getStart(), is(8));
		assertThat(span.getEnd(), is(14));
		assertFalse(span.isExplicit());
		assertThat(span.getExpression(), is(set(num(1), num(2))));
		assertThat(span.getLocation().getStartColumn(), is(15));
	}

	@Test
	public void explicitSpan() throws Exception {
		Paragraph p = paragraph("TEXT: so $x > 0$ holds");
		assertThat(p.getSpans().size(), is(1));
		ProseSpan span = p.getSpans().get(0);
		assertTrue(span.isExplicit());
		assertThat(span.getStart(), is(3));
		assertThat(span.getEnd(), is(10));
		assertThat(span.getExpression(), is(binop(ZOperator.GREATER, id("x"), num(0))));
		assertThat(span.getExpression().getLocation().getStartColumn(), is(11));
	}

	@Test
	public void explicitSpanMayOpenWithAParenthesisedLetter() throws Exception {
		Paragraph p = paragraph("TEXT: we have $(a) and b$ here");
		assertThat(p.getSpans().size(), is(1));
		ProseSpan span = p.getSpans().get(0);
		assertThat(span.getStart(), is(8));
		assertThat(span.getEnd(), is(19));
		assertThat(span.getExpression(), is(binop(ZOperator.AND, id("a"), id("b"))));
		assertThat(span.getExpression().getLocation().getStartColumn(), is(16));
	}

	@Test
	public void binderPhraseEndsAtAnEnglishWord() throws Exception {
		Paragraph p = paragraph("TEXT: forall x : N . x >= 0 is true");
		assertThat(p.getSpans().size(), is(1));
		ProseSpan span = p.getSpans().get(0);
		assertThat(span.getStart(), is(0));
		assertThat(span.getEnd(), is(21));
		assertThat(span.getExpression(), is(forall(bindings(binding("x", id("N"))), null,
				binop(ZOperator.GREATER_EQUAL, id("x"), num(0)))));
	}

	@Test
	public void binderPhraseDropsSentencePunctuation() throws Exception {
		Paragraph p = paragraph("TEXT: exists n : N . n > 0.");
		assertThat(p.getSpans().size(), is(1));
		assertThat(p.getSpans().get(0).getEnd(), is(20));
	}

	@Test
	public void plainWordsAreNotExpressions() throws Exception {
		assertThat(paragraph("TEXT: for all x in the set").getSpans().size(), is(0));
	}

	@Test
	public void failedCandidatesStayProse() throws Exception {
		assertThat(paragraph("TEXT: the pair {1, } is odd").getSpans().size(), is(0));
		assertThat(paragraph("TEXT: {unbalanced").getSpans().size(), is(0));
		assertThat(paragraph("TEXT: ∀ x : N • x ≥ 0 holds").getSpans().size(), is(0));
	}

	@Test
	public void detectionCanBeSwitchedOff() throws Exception {
		Paragraph p = paragraph("TEXT: the set {1, 2} and $x$", false);
		assertThat(p.getSpans().size(), is(1));
		assertTrue(p.getSpans().get(0).isExplicit());
	}

	@Test
	public void pureTextIsLeftAlone() throws Exception {
		Paragraph p = paragraph("PURETEXT: costs $5 {maybe}");
		assertThat(p.getKind(), is(Paragraph.Kind.PURETEXT));
		assertThat(p.getText(), is("costs $5 {maybe}"));
		assertThat(p.getSpans().size(), is(0));
	}

	@Test
	public void latexIsLeftAlone() throws Exception {
		Paragraph p = paragraph("LATEX: \\vspace{1em}");
		assertThat(p.getKind(), is(Paragraph.Kind.LATEX));
		assertThat(p.getText(), is("\\vspace{1em}"));
	}

	@Test
	public void unclosedDollar() throws Exception {
		try {
			paragraph("TEXT: cost $5");
			fail();
		} catch(ZParseException e) {
			assertThat(e.getMsg(), is("unclosed '$'"));
			assertThat(e.getColumn(), is(12));
		}
	}

	@Test
	public void badExplicitSpanIsAnError() throws Exception {
		try {
			paragraph("TEXT: see $x - $");
			fail();
		} catch(ZParseException e) {
			assertThat(e.getMsg(), is("expected an expression, found end of input"));
		}
	}

	@Test
	public void spansSeeTheDocumentScope() throws Exception {
		try {
			ZParser.readDocument(ZLexer.tokenize(String.join("\n",
					"schema S",
					"  k : N",
					"end",
					"TEXT: here $k > 0$")));
			fail();
		} catch(ZParseException e) {
			assertThat(e.getMsg(), is("'k' is not declared in this scope"));
			assertThat(e.getLine(), is(4));
			assertThat(e.getColumn(), is(13));
		}
	}
}
