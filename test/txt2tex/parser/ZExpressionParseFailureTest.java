package txt2tex.parser;

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

@RunWith(Parameterized.class)
public class ZExpressionParseFailureTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"p and forall x : N . q", "'forall' must be parenthesised here", 7},
				{"p or exists x : N . q", "'exists' must be parenthesised here", 6},
				{"x . y", "separator '.' does not belong to any open quantifier or comprehension", 3},
				{"{ x : N | (x > 0 . x) }", "separator '.' does not belong to any open quantifier or comprehension", 18},
				{"f(a, )", "expected an expression, found ')'", 6},
				{"lambda x : N | x > 0", "expected '.' and the body of the lambda, found end of input", 21},
				{"forall x : N", "expected '|' or '.' after the bound variables of 'forall', found end of input", 13},
				{"()", "empty parentheses", 2},
				{"x - ", "expected an expression, found end of input", 5},
				{"if p then q", "expected 'else', found end of input", 12},
				{"s[]", "expected an expression, found ']'", 3},
				{"a b ]", "expected the end of the expression, found ']'", 5},
				{"forall () : T | P", "empty tuple pattern", 9},
				{"forall (x, 2) : T | P", "a tuple pattern in a binder may contain only names", 12},
		});
	}

	String source;
	String message;
	int column;

	public ZExpressionParseFailureTest(String source, String message, int column) {
		this.source = source;
		this.message = message;
		this.column = column;
	}

	@Test
	public void test() throws ZLexerException {
		try {
			ZParser.readExpression(ZLexer.tokenize(source));
			fail("parsing \"" + source + "\" should have failed");
		} catch(ZParseException e) {
			assertThat(e.getMsg(), is(message));
			assertThat(e.getLine(), is(1));
			assertThat(e.getColumn(), is(column));
		}
	}
}
