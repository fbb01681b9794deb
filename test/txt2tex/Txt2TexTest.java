package txt2tex;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static txt2tex.model.z.ZBuilder.*;

import org.junit.Test;

import txt2tex.model.document.Document;
import txt2tex.model.document.Paragraph;
import txt2tex.model.z.ZOperator;

public class Txt2TexTest {

	@Test
	public void parsesADocument() throws Txt2TexException {
		Document d = new Txt2Tex().parse("given A\nx elem A");
		assertThat(d.getItems().size(), is(2));
	}

	@Test
	public void parsesAnExpression() throws Txt2TexException {
		assertThat(new Txt2Tex().parseExpression("a + b"), is(binop(ZOperator.PLUS, id("a"), id("b"))));
	}

	@Test
	public void proseDetectionFollowsTheOptions() throws Txt2TexException {
		Txt2TexOptions options = new Txt2TexOptions();
		options.proseDetection = false;
		Paragraph p = (Paragraph) new Txt2Tex(options).parse("TEXT: the set {1, 2}").getItems().get(0);
		assertThat(p.getSpans().size(), is(0));
		p = (Paragraph) new Txt2Tex().parse("TEXT: the set {1, 2}").getItems().get(0);
		assertThat(p.getSpans().size(), is(1));
	}

	@Test
	public void lexerAndParserFailuresShareOneType() {
		Txt2Tex txt2tex = new Txt2Tex();
		try {
			txt2tex.parse("x $ y");
			fail();
		} catch(Txt2TexException e) {
			assertThat(e.getPrefix(), is("Lexer error"));
		}
		try {
			txt2tex.parse("x = = y");
			fail();
		} catch(Txt2TexException e) {
			assertThat(e.getPrefix(), is("Parse error"));
			assertThat(e.getMessage(), is("Parse error: expected an expression, found '=' at 1:5"));
		}
	}

	@Test
	public void describesFailures() {
		Txt2TexOptions options = new Txt2TexOptions();
		options.contextLines = 0;
		options.hints = false;
		Txt2Tex txt2tex = new Txt2Tex(options);
		String source = "p\nx = = y\nq";
		try {
			txt2tex.parse(source);
			fail();
		} catch(Txt2TexException e) {
			assertThat(txt2tex.describe(e, source), is(String.join("\n",
					"Error: expected an expression, found '='",
					"",
					"2 | x = = y",
					"  |     ^")));
		}
	}
}
