package txt2tex.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import txt2tex.lexer.ZLexer;
import txt2tex.lexer.ZLexerException;
import txt2tex.parser.ZParseException;
import txt2tex.parser.ZParser;

@RunWith(Parameterized.class)
public class ZExpressionFormattingTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"p and q or r", "((p and q) or r)"},
				{"x + y * z", "(x + (y * z))"},
				{"a /= b", "(a != b)"},
				{"x < y <= z", "(x < y <= z)"},
				{"-x", "(-x)"},
				{"#s", "(#s)"},
				{"dom R", "(dom R)"},
				{"R~", "(R~)"},
				{"x^2", "x^{2}"},
				{"x_1", "x_{1}"},
				{"f(x, y)", "f(x, y)"},
				{"f x", "f(x)"},
				{"R(| S |)", "R(| S |)"},
				{"s[i]", "s[i]"},
				{"p.1", "p.1"},
				{"<a, b>", "<a, b>"},
				{"[[a]]", "[[a]]"},
				{"{}", "{}"},
				{"∅", "emptyset"},
				{"(a, b)", "(a, b)"},
				{"if p then q else r", "(if p then q else r)"},
				{"forall x : N . x >= 0", "(forall x : N | (x >= 0))"},
				{"forall (x, y) : T | x > y", "(forall (x, y) : T | (x > y))"},
				{"emptyset[N]", "emptyset[N]"},
				{"exists x, y : N; z : Z | x < z . y < z", "(exists x, y : N; z : Z | (x < z) . (y < z))"},
				{"lambda x : N . x + 1", "(lambda x : N . (x + 1))"},
				{"mu x : N | x > 0 . x", "(mu x : N | (x > 0) . x)"},
				{"{ x : N | x > 0 . x * x }", "{x : N | (x > 0) . (x * x)}"},
		});
	}

	String source;
	String expected;

	public ZExpressionFormattingTest(String source, String expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() throws ZLexerException, ZParseException {
		assertThat(ZParser.readExpression(ZLexer.tokenize(source)).toString(), is(expected));
	}
}
