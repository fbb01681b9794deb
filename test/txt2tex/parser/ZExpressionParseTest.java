package txt2tex.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static txt2tex.model.z.ZBuilder.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import txt2tex.lexer.ZLexer;
import txt2tex.lexer.ZLexerException;
import txt2tex.model.z.ZExpression;
import txt2tex.model.z.ZOperator;

@RunWith(Parameterized.class)
public class ZExpressionParseTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				// logic
				{"p and q or r", binop(ZOperator.OR, binop(ZOperator.AND, id("p"), id("q")), id("r"))},
				{"p => q => r", binop(ZOperator.IMPLIES, id("p"), binop(ZOperator.IMPLIES, id("q"), id("r")))},
				{"p <=> q <=> r", binop(ZOperator.IFF, binop(ZOperator.IFF, id("p"), id("q")), id("r"))},
				{"not p and q", binop(ZOperator.AND, unary(ZOperator.NOT, id("p")), id("q"))},
				{"not not p", unary(ZOperator.NOT, unary(ZOperator.NOT, id("p")))},
				{"p shows q", binop(ZOperator.SHOWS, id("p"), id("q"))},
				{"x > 0 => y > 0", binop(ZOperator.IMPLIES,
						binop(ZOperator.GREATER, id("x"), num(0)),
						binop(ZOperator.GREATER, id("y"), num(0)))},
				{"x ∈ S ∧ y ∉ T", binop(ZOperator.AND,
						binop(ZOperator.ELEM, id("x"), id("S")),
						binop(ZOperator.NOTIN, id("y"), id("T")))},
				{"true or false", binop(ZOperator.OR, TRUE(), FALSE())},

				// arithmetic
				{"x + y * z", binop(ZOperator.PLUS, id("x"), binop(ZOperator.TIMES, id("y"), id("z")))},
				{"a - b - c", binop(ZOperator.MINUS, binop(ZOperator.MINUS, id("a"), id("b")), id("c"))},
				{"a div b mod c", binop(ZOperator.MOD, binop(ZOperator.DIV, id("a"), id("b")), id("c"))},
				{"-x", unary(ZOperator.NEGATE, id("x"))},
				{"-x^2", unary(ZOperator.NEGATE, superscript(id("x"), num(2)))},
				{"#s + 1", binop(ZOperator.PLUS, unary(ZOperator.CARDINALITY, id("s")), num(1))},
				{"1..n", binop(ZOperator.RANGE, num(1), id("n"))},
				{"3.14", num("3.14")},
				{"x' = x + 1", binop(ZOperator.EQUALS, id("x'"), binop(ZOperator.PLUS, id("x"), num(1)))},

				// comparisons
				{"x = y", binop(ZOperator.EQUALS, id("x"), id("y"))},
				{"x < y <= z", chain(exprs(id("x"), id("y"), id("z")), ZOperator.LESS, ZOperator.LESS_EQUAL)},
				{"0 <= i < #s", chain(exprs(num(0), id("i"), unary(ZOperator.CARDINALITY, id("s"))),
						ZOperator.LESS_EQUAL, ZOperator.LESS)},
				{"A subset B", binop(ZOperator.SUBSET, id("A"), id("B"))},

				// sets and relations
				{"A union B intersect C", binop(ZOperator.UNION, id("A"),
						binop(ZOperator.INTERSECT, id("B"), id("C")))},
				{"A \\ B", binop(ZOperator.SETMINUS, id("A"), id("B"))},
				{"(A union B) = C", binop(ZOperator.EQUALS, grouped(ZOperator.UNION, id("A"), id("B")), id("C"))},
				{"A cross B", binop(ZOperator.CROSS, id("A"), id("B"))},
				{"a |-> b", binop(ZOperator.MAPLET, id("a"), id("b"))},
				{"A -> B -> C", binop(ZOperator.TFUN, binop(ZOperator.TFUN, id("A"), id("B")), id("C"))},
				{"A +-> B", binop(ZOperator.PFUN, id("A"), id("B"))},
				{"S <| R", binop(ZOperator.DRES, id("S"), id("R"))},
				{"R o9 S", binop(ZOperator.COMP, id("R"), id("S"))},
				{"R ; S", binop(ZOperator.SEQUENTIAL, id("R"), id("S"))},
				{"R ++ {a |-> b}", binop(ZOperator.OVERRIDE, id("R"),
						set(binop(ZOperator.MAPLET, id("a"), id("b"))))},
				{"dom R", unary(ZOperator.DOM, id("R"))},
				{"ran R ∩ S", binop(ZOperator.INTERSECT, unary(ZOperator.RAN, id("R")), id("S"))},
				{"bigcup S", unary(ZOperator.BIGCUP, id("S"))},
				{"R~", unary(ZOperator.INVERSE, id("R"))},
				{"R+", unary(ZOperator.CLOSURE, id("R"))},
				{"R* = R", binop(ZOperator.EQUALS, unary(ZOperator.REFLEXIVE_CLOSURE, id("R")), id("R"))},
				{"R(| S |)", image(id("R"), id("S"))},
				{"s ^ t", binop(ZOperator.CONCAT, id("s"), id("t"))},

				// superscripts and subscripts
				{"x^2", superscript(id("x"), num(2))},
				{"x^{n+1}", superscript(id("x"), raw("n+1"))},
				{"2^-1", superscript(num(2), unary(ZOperator.NEGATE, num(1)))},
				{"x_1", subscript(id("x"), num(1))},
				{"x_i", subscript(id("x"), id("i"))},
				{"a_{i+1}", subscript(id("a"), raw("i+1"))},
				{"x_1 + x_2", binop(ZOperator.PLUS, subscript(id("x"), num(1)), subscript(id("x"), num(2)))},

				// application
				{"f(x, y)", apply("f", id("x"), id("y"))},
				{"f(x)(y)", apply(apply("f", id("x")), id("y"))},
				{"f x", apply("f", id("x"))},
				{"seq N", apply("seq", id("N"))},
				{"P P X", apply("P", apply("P", id("X")))},
				{"f x + 1", binop(ZOperator.PLUS, apply("f", id("x")), num(1))},
				{"(f o9 g)(x)", apply(grouped(ZOperator.COMP, id("f"), id("g")), id("x"))},
				{"s[i]", instantiate(id("s"), id("i"))},
				{"emptyset[N]", instantiate(emptyset(), id("N"))},
				{"479_courses + 1", binop(ZOperator.PLUS, id("479_courses"), num(1))},
				{"x<y and y>z", binop(ZOperator.AND,
						binop(ZOperator.LESS, id("x"), id("y")), binop(ZOperator.GREATER, id("y"), id("z")))},
				{"p.1", project(id("p"), "1")},
				{"r.field.x", project(project(id("r"), "field"), "x")},
				{"f(x).y", project(apply("f", id("x")), "y")},

				// displays
				{"{1, 2, 3}", set(num(1), num(2), num(3))},
				{"{}", set()},
				{"emptyset", emptyset()},
				{"∅", emptyset()},
				{"<a, b>", seq(id("a"), id("b"))},
				{"<>", seq()},
				{"[[a, a]]", bag(id("a"), id("a"))},
				{"(a, b)", tuple(id("a"), id("b"))},
				{"{(a, b)}", set(tuple(id("a"), id("b")))},
				{"(x)", id("x")},
				{"(p and q)", grouped(ZOperator.AND, id("p"), id("q"))},

				// comprehensions
				{"{ x : N | x > 0 }", setComprehension(bindings(binding("x", id("N"))),
						binop(ZOperator.GREATER, id("x"), num(0)), null)},
				{"{ x : N | x > 0 . x * x }", setComprehension(bindings(binding("x", id("N"))),
						binop(ZOperator.GREATER, id("x"), num(0)), binop(ZOperator.TIMES, id("x"), id("x")))},
				{"{ x : N . x + 1 }", setComprehension(bindings(binding("x", id("N"))),
						null, binop(ZOperator.PLUS, id("x"), num(1)))},
				{"{ x, y : N | x < y }", setComprehension(bindings(binding(ids("x", "y"), id("N"))),
						binop(ZOperator.LESS, id("x"), id("y")), null)},

				// binders
				{"forall x : N . x >= 0", forall(bindings(binding("x", id("N"))), null,
						binop(ZOperator.GREATER_EQUAL, id("x"), num(0)))},
				{"forall x : N | x > 0 . x >= 1", forall(bindings(binding("x", id("N"))),
						binop(ZOperator.GREATER, id("x"), num(0)), binop(ZOperator.GREATER_EQUAL, id("x"), num(1)))},
				{"∀ x : N • x ≥ 0", forall(bindings(binding("x", id("N"))), null,
						binop(ZOperator.GREATER_EQUAL, id("x"), num(0)))},
				{"exists x : N | x > 0", exists(bindings(binding("x", id("N"))), null,
						binop(ZOperator.GREATER, id("x"), num(0)))},
				{"exists1 x : N . x = 0", exists1(bindings(binding("x", id("N"))), null,
						binop(ZOperator.EQUALS, id("x"), num(0)))},
				{"forall (x, y) : T | x > y", forall(bindings(tuplePattern(ids("x", "y"), id("T"))), null,
						binop(ZOperator.GREATER, id("x"), id("y")))},
				{"exists (a, b, c) : T | a > 0", exists(bindings(tuplePattern(ids("a", "b", "c"), id("T"))), null,
						binop(ZOperator.GREATER, id("a"), num(0)))},
				{"exists1 (x, y) : T | x = y", exists1(bindings(tuplePattern(ids("x", "y"), id("T"))), null,
						binop(ZOperator.EQUALS, id("x"), id("y")))},
				{"forall x : N; y : Z . x < y", forall(bindings(binding("x", id("N")), binding("y", id("Z"))), null,
						binop(ZOperator.LESS, id("x"), id("y")))},
				{"forall x : N . exists y : N . y > x", forall(bindings(binding("x", id("N"))), null,
						exists(bindings(binding("y", id("N"))), null, binop(ZOperator.GREATER, id("y"), id("x"))))},
				{"forall x : N . p and q", forall(bindings(binding("x", id("N"))), null,
						binop(ZOperator.AND, id("p"), id("q")))},
				{"(forall x : N . p) and q", binop(ZOperator.AND,
						forall(bindings(binding("x", id("N"))), null, id("p")), id("q"))},
				{"not forall x : N . p", unary(ZOperator.NOT, forall(bindings(binding("x", id("N"))), null, id("p")))},
				{"lambda x : N . x + 1", lambda(bindings(binding("x", id("N"))), null,
						binop(ZOperator.PLUS, id("x"), num(1)))},
				{"mu x : N | x * x = 4", mu(bindings(binding("x", id("N"))),
						binop(ZOperator.EQUALS, binop(ZOperator.TIMES, id("x"), id("x")), num(4)), null)},
				{"mu x : N | x > 0 . x + 1", mu(bindings(binding("x", id("N"))),
						binop(ZOperator.GREATER, id("x"), num(0)), binop(ZOperator.PLUS, id("x"), num(1)))},
				{"{ x : N | (forall y : N . y <= x) }", setComprehension(bindings(binding("x", id("N"))),
						forall(bindings(binding("y", id("N"))), null, binop(ZOperator.LESS_EQUAL, id("y"), id("x"))),
						null)},

				// conditionals
				{"if x > 0 then x else -x", cond(binop(ZOperator.GREATER, id("x"), num(0)), id("x"),
						unary(ZOperator.NEGATE, id("x")))},
		});
	}

	String source;
	ZExpression expected;

	public ZExpressionParseTest(String source, ZExpression expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() throws ZLexerException, ZParseException {
		ZExpression actual = ZParser.readExpression(ZLexer.tokenize(source));
		assertThat(actual, is(expected));
	}
}
