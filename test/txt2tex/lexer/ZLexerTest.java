package txt2tex.lexer;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import static txt2tex.lexer.ZTokenType.*;

@RunWith(Parameterized.class)
public class ZLexerTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"p and q or not r", Arrays.asList(IDENTIFIER, AND, IDENTIFIER, OR, NOT, IDENTIFIER)},
				{"a |-> b", Arrays.asList(IDENTIFIER, MAPLET, IDENTIFIER)},
				{"A -->> B", Arrays.asList(IDENTIFIER, TSURJ, IDENTIFIER)},
				{"A +->> B", Arrays.asList(IDENTIFIER, PSURJ, IDENTIFIER)},
				{"A >->> B", Arrays.asList(IDENTIFIER, BIJ, IDENTIFIER)},
				{"A 77-> B", Arrays.asList(IDENTIFIER, FFUN, IDENTIFIER)},
				{"R <-> S", Arrays.asList(IDENTIFIER, RELATION, IDENTIFIER)},
				{"p <=> q", Arrays.asList(IDENTIFIER, IFF, IDENTIFIER)},
				{"S <<| R |>> T", Arrays.asList(IDENTIFIER, NDRES, IDENTIFIER, NRRES, IDENTIFIER)},
				{"x <= y", Arrays.asList(IDENTIFIER, LESS_EQUAL, IDENTIFIER)},
				{"x < y", Arrays.asList(IDENTIFIER, LESS, IDENTIFIER)},
				{"x > y", Arrays.asList(IDENTIFIER, GREATER, IDENTIFIER)},
				{"a /= b", Arrays.asList(IDENTIFIER, NOT_EQUAL, IDENTIFIER)},

				// sequences
				{"<>", Arrays.asList(LANGLE, RANGLE)},
				{"<a, b>", Arrays.asList(LANGLE, IDENTIFIER, COMMA, IDENTIFIER, RANGLE)},
				{"<a> ^ <b>", Arrays.asList(LANGLE, IDENTIFIER, RANGLE, CONCAT, LANGLE, IDENTIFIER, RANGLE)},
				{"<a |-> b>", Arrays.asList(LANGLE, IDENTIFIER, MAPLET, IDENTIFIER, RANGLE)},
				{"#<a>", Arrays.asList(HASH, LANGLE, IDENTIFIER, RANGLE)},

				// carets
				{"x^2", Arrays.asList(IDENTIFIER, POWER, NUMBER)},
				{"x^{n+1}", Arrays.asList(IDENTIFIER, SUPERSCRIPT_GROUP)},
				{"s ^ t", Arrays.asList(IDENTIFIER, CONCAT, IDENTIFIER)},

				// dots
				{"1..n", Arrays.asList(NUMBER, RANGE, IDENTIFIER)},
				{"3.14", Arrays.asList(NUMBER)},
				{"p.1.2", Arrays.asList(IDENTIFIER, DOT, NUMBER, DOT, NUMBER)},
				{"r.field", Arrays.asList(IDENTIFIER, DOT, IDENTIFIER)},
				{"forall x : N . x > 0",
						Arrays.asList(FORALL, IDENTIFIER, COLON, IDENTIFIER, BULLET, IDENTIFIER, GREATER, NUMBER)},
				{"exists x : N @ p", Arrays.asList(EXISTS, IDENTIFIER, COLON, IDENTIFIER, BULLET, IDENTIFIER)},

				// brackets
				{"s[i]", Arrays.asList(IDENTIFIER, INDEX_OPEN, IDENTIFIER, RBRACKET)},
				{"p [and elim]", Arrays.asList(IDENTIFIER, LBRACKET, AND, IDENTIFIER, RBRACKET)},
				{"[[a, a]]", Arrays.asList(LBAG, IDENTIFIER, COMMA, IDENTIFIER, RBAG)},
				{"R(| S |)", Arrays.asList(IDENTIFIER, LIMAGE, IDENTIFIER, RIMAGE)},

				// names
				{"x_1", Arrays.asList(IDENTIFIER, SUBSCRIPT)},
				{"x_{i+1}", Arrays.asList(IDENTIFIER, SUBSCRIPT_GROUP)},
				{"x_12", Arrays.asList(IDENTIFIER)},
				{"x' = x + 1", Arrays.asList(IDENTIFIER, EQUALS, IDENTIFIER, PLUS, NUMBER)},
				{"x? elem S", Arrays.asList(IDENTIFIER, ELEM, IDENTIFIER)},
				{"R+ == R o9 R", Arrays.asList(IDENTIFIER, DEFINE_ABBREVIATION, IDENTIFIER, COMP, IDENTIFIER)},
				{"R+", Arrays.asList(IDENTIFIER, PLUS)},
				{"schema R~", Arrays.asList(SCHEMA, IDENTIFIER)},
				{"479_courses + 1", Arrays.asList(IDENTIFIER, PLUS, NUMBER)},
				{"123_abc_456", Arrays.asList(IDENTIFIER)},
				{"479", Arrays.asList(NUMBER)},
				{"emptyset[N]", Arrays.asList(EMPTYSET, INDEX_OPEN, IDENTIFIER, RBRACKET)},
				{"x<y and y>z", Arrays.asList(IDENTIFIER, LESS, IDENTIFIER, AND, IDENTIFIER, GREATER, IDENTIFIER)},
				{"x<y or y>z", Arrays.asList(IDENTIFIER, LESS, IDENTIFIER, OR, IDENTIFIER, GREATER, IDENTIFIER)},
				{"x<y => y>z", Arrays.asList(IDENTIFIER, LESS, IDENTIFIER, IMPLIES, IDENTIFIER, GREATER, IDENTIFIER)},
				{"x<y ∧ y>z", Arrays.asList(IDENTIFIER, LESS, IDENTIFIER, AND, IDENTIFIER, GREATER, IDENTIFIER)},
				{"T ::= a | b", Arrays.asList(IDENTIFIER, DEFINE_FREE_TYPE, IDENTIFIER, PIPE, IDENTIFIER)},
				{"Delta S", Arrays.asList(DELTA, IDENTIFIER)},

				// unicode
				{"∀ x ∈ S • x ≥ 0",
						Arrays.asList(FORALL, IDENTIFIER, ELEM, IDENTIFIER, BULLET, IDENTIFIER, GREATER_EQUAL, NUMBER)},
				{"∃₁ x : N • p", Arrays.asList(EXISTS1, IDENTIFIER, COLON, IDENTIFIER, BULLET, IDENTIFIER)},
				{"A ∪ B ∩ ∅", Arrays.asList(IDENTIFIER, UNION, IDENTIFIER, INTERSECT, EMPTYSET)},
				{"p ⇒ q ⇔ r", Arrays.asList(IDENTIFIER, IMPLIES, IDENTIFIER, IFF, IDENTIFIER)},

				// structure
				{"=== Introduction ===", Arrays.asList(SECTION_HEADER)},
				{"** Solution 3 **", Arrays.asList(SOLUTION_HEADER)},
				{"TEXT: the set {1, 2} is finite", Arrays.asList(TEXT)},
				{"PURETEXT: $5", Arrays.asList(PURETEXT)},
				{"LATEX: \\newpage", Arrays.asList(LATEX)},
				{"TITLE: Homework 1", Arrays.asList(METADATA)},
				{"PAGEBREAK", Arrays.asList(PAGEBREAK)},
				{"------", Arrays.asList(RULE_LINE)},
				{"TRUTH TABLE:", Arrays.asList(TRUTH_TABLE)},
				{"(b) p or q", Arrays.asList(PART_LABEL, IDENTIFIER, OR, IDENTIFIER)},

				// lines
				{"a\nb", Arrays.asList(IDENTIFIER, NEWLINE, IDENTIFIER)},
				{"a\n\nb", Arrays.asList(IDENTIFIER, NEWLINE, NEWLINE, IDENTIFIER)},
				{"(a\n + b)", Arrays.asList(LPAREN, IDENTIFIER, PLUS, IDENTIFIER, RPAREN)},
				{"p and \\\n q", Arrays.asList(IDENTIFIER, AND, IDENTIFIER)},
		});
	}

	String input;
	List<ZTokenType> expected;

	public ZLexerTest(String input, List<ZTokenType> expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() throws ZLexerException {
		List<ZToken> tokens = ZLexer.tokenize(input);
		List<ZTokenType> types = new ArrayList<>();
		for(ZToken t : tokens) {
			types.add(t.getType());
		}
		assertThat(types.get(types.size() - 1), is(EOF));
		assertThat(types.subList(0, types.size() - 1), is(expected));
	}
}
