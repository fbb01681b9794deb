package txt2tex.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static txt2tex.model.z.ZBuilder.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import txt2tex.lexer.ZLexer;
import txt2tex.lexer.ZLexerException;
import txt2tex.model.document.*;
import txt2tex.model.z.ZOperator;

public class ZDocumentParseTest {

	private static Document parse(String... lines) throws ZLexerException, ZParseException {
		return ZParser.readDocument(ZLexer.tokenize(String.join("\n", lines)));
	}

	private static ZParseException failure(String... lines) throws ZLexerException {
		try {
			parse(lines);
		} catch(ZParseException e) {
			return e;
		}
		fail("parsing should have failed");
		return null;
	}

	@Test
	public void sectionsSolutionsAndParts() throws Exception {
		Document d = parse(
				"TITLE: Homework 1",
				"=== Propositional logic ===",
				"** Solution 1 **",
				"(a) p and q",
				"(b)",
				"p or q",
				"TEXT: done",
				"=== Sets ===",
				"x elem S");
		assertThat(d.getMetadata().get("title"), is("Homework 1"));
		assertThat(d.getItems().size(), is(2));

		Section first = (Section) d.getItems().get(0);
		assertThat(first.getTitle(), is("Propositional logic"));
		Solution solution = (Solution) first.getItems().get(0);
		assertThat(solution.getTitle(), is("Solution 1"));
		assertThat(solution.getItems().size(), is(2));

		Part a = (Part) solution.getItems().get(0);
		assertThat(a.getTitle(), is("a"));
		assertThat(a.getItems().size(), is(1));
		assertThat(((ExpressionItem) a.getItems().get(0)).getExpression(),
				is(binop(ZOperator.AND, id("p"), id("q"))));

		Part b = (Part) solution.getItems().get(1);
		assertThat(b.getTitle(), is("b"));
		assertThat(b.getItems().size(), is(2));
		assertThat(((ExpressionItem) b.getItems().get(0)).getExpression(),
				is(binop(ZOperator.OR, id("p"), id("q"))));
		assertThat(((Paragraph) b.getItems().get(1)).getText(), is("done"));

		Section second = (Section) d.getItems().get(1);
		assertThat(second.getTitle(), is("Sets"));
		assertThat(((ExpressionItem) second.getItems().get(0)).getExpression(),
				is(binop(ZOperator.ELEM, id("x"), id("S"))));
	}

	@Test
	public void itemLocations() throws Exception {
		Document d = parse(
				"",
				"  x = 1");
		ExpressionItem item = (ExpressionItem) d.getItems().get(0);
		assertThat(item.getLocation().getStartLine(), is(2));
		assertThat(item.getLocation().getStartColumn(), is(3));
		assertThat(item.getLocation().getEndColumn(), is(8));
	}

	@Test
	public void truthTable() throws Exception {
		Document d = parse(
				"TRUTH TABLE:",
				"p | q | p and q",
				"T | T | T",
				"T | F | F",
				"F | T | F",
				"F | F | F");
		TruthTable t = (TruthTable) d.getItems().get(0);
		assertThat(t.getHeaders(), is(exprs(id("p"), id("q"), binop(ZOperator.AND, id("p"), id("q")))));
		assertThat(t.getRows().size(), is(4));
		assertThat(t.getRows().get(0), is(Arrays.asList(true, true, true)));
		assertThat(t.getRows().get(1), is(Arrays.asList(true, false, false)));
		assertThat(t.getRows().get(3), is(Arrays.asList(false, false, false)));
	}

	@Test
	public void truthTableRowWidth() throws Exception {
		ZParseException e = failure(
				"TRUTH TABLE:",
				"p | q",
				"T | T",
				"T");
		assertThat(e.getMsg(), is("truth table row has 1 values but the header has 2 columns"));
		assertThat(e.getLine(), is(4));
	}

	@Test
	public void equivChain() throws Exception {
		Document d = parse(
				"EQUIV:",
				"p and q",
				"<=> q and p [commutative]",
				"",
				"TEXT: next");
		assertThat(d.getItems().size(), is(2));
		EquivChain chain = (EquivChain) d.getItems().get(0);
		assertThat(chain.getKind(), is(EquivChain.Kind.EQUIV));
		assertThat(chain.getSteps().size(), is(2));
		EquivStep first = chain.getSteps().get(0);
		assertThat(first.getConnective(), nullValue());
		assertThat(first.getExpression(), is(binop(ZOperator.AND, id("p"), id("q"))));
		assertThat(first.getJustification(), nullValue());
		EquivStep second = chain.getSteps().get(1);
		assertThat(second.getConnective(), is(ZOperator.IFF));
		assertThat(second.getExpression(), is(binop(ZOperator.AND, id("q"), id("p"))));
		assertThat(second.getJustification(), is("commutative"));
	}

	@Test
	public void argueChain() throws Exception {
		Document d = parse(
				"ARGUE:",
				"x + 0",
				"= x [identity]");
		EquivChain chain = (EquivChain) d.getItems().get(0);
		assertThat(chain.getKind(), is(EquivChain.Kind.ARGUE));
		assertThat(chain.getSteps().get(1).getConnective(), is(ZOperator.EQUALS));
		assertThat(chain.getSteps().get(1).getJustification(), is("identity"));
	}

	@Test
	public void proofWithDischarge() throws Exception {
		Document d = parse(
				"PROOF:",
				"p => p [=> intro from 1]",
				"  [1] p [assumption]");
		ProofNode root = ((ProofTree) d.getItems().get(0)).getConclusion();
		assertThat(root.getExpression(), is(binop(ZOperator.IMPLIES, id("p"), id("p"))));
		assertThat(root.getJustification(), is("=> intro from 1"));
		assertThat(root.getDischarges(), is(Collections.singletonList(1)));
		assertThat(root.getLabel(), nullValue());
		assertThat(root.getChildren().size(), is(1));

		ProofNode assumption = (ProofNode) root.getChildren().get(0);
		assertThat(assumption.getExpression(), is(id("p")));
		assertThat(assumption.getLabel(), is(1));
		assertTrue(assumption.isAssumption());
		assertThat(assumption.getChildren().size(), is(0));
	}

	@Test
	public void proofCases() throws Exception {
		Document d = parse(
				"PROOF:",
				"r [or elim]",
				"  p or q",
				"  case p:",
				"    r",
				"  case q:",
				"    :: r",
				"    r");
		ProofNode root = ((ProofTree) d.getItems().get(0)).getConclusion();
		assertThat(root.getChildren().size(), is(3));
		assertThat(root.getChildren().get(0), instanceOf(ProofNode.class));
		ProofCase p = (ProofCase) root.getChildren().get(1);
		assertThat(p.getName(), is("p"));
		assertThat(p.getChildren().size(), is(1));
		ProofCase q = (ProofCase) root.getChildren().get(2);
		assertThat(q.getName(), is("q"));
		assertThat(q.getChildren().size(), is(2));
		assertTrue(((ProofNode) q.getChildren().get(0)).isSibling());
		assertFalse(((ProofNode) q.getChildren().get(1)).isSibling());
	}

	@Test
	public void dischargeWithoutAssumption() throws Exception {
		ZParseException e = failure(
				"PROOF:",
				"p => p [=> intro from 2]",
				"  [1] p [assumption]");
		assertThat(e.getMsg(), is("'from 2' does not match any assumption labelled [2] above this step"));
		assertThat(e.getLine(), is(2));
	}

	@Test
	public void proofIndentation() throws Exception {
		ZParseException e = failure(
				"PROOF:",
				"  p",
				"q");
		assertThat(e.getMsg(), is("proof line is not indented under the conclusion"));
		assertThat(e.getLine(), is(3));
	}

	@Test
	public void inferenceRule() throws Exception {
		Document d = parse(
				"INFRULE:",
				"p",
				"q",
				"-----",
				"p and q [and intro]");
		InferenceRule rule = (InferenceRule) d.getItems().get(0);
		assertThat(rule.getPremises().size(), is(2));
		assertThat(rule.getPremises().get(1).getExpression(), is(id("q")));
		assertThat(rule.getConclusion().getExpression(), is(binop(ZOperator.AND, id("p"), id("q"))));
		assertThat(rule.getConclusion().getLabel(), is("and intro"));
	}

	@Test
	public void strayRuleLine() throws Exception {
		ZParseException e = failure(
				"p",
				"---");
		assertThat(e.getMsg(), is("rule line outside an inference rule"));
	}

	@Test
	public void zedBlock() throws Exception {
		Document d = parse(
				"zed",
				"  given A",
				"  Pair == A cross A",
				"  Pair = A cross A",
				"end",
				"PAGEBREAK");
		assertThat(d.getItems().size(), is(2));
		ZedBlock zed = (ZedBlock) d.getItems().get(0);
		assertThat(zed.getItems().size(), is(3));
		assertThat(((ZParagraphItem) zed.getItems().get(0)).getParagraph(), is(given("A")));
		assertThat(zed.getItems().get(2), instanceOf(ExpressionItem.class));
		assertThat(d.getItems().get(1), instanceOf(PageBreak.class));
	}

	@Test
	public void zedBlockNeedsEnd() throws Exception {
		ZParseException e = failure(
				"zed",
				"  given A");
		assertThat(e.getMsg(), is("expected 'end' to close the zed block, found end of input"));
	}

	@Test
	public void trailingTokensOnALine() throws Exception {
		ZParseException e = failure("x = 1 )");
		assertThat(e.getMsg(), is("expected end of line after an expression, found ')'"));
		assertThat(e.getColumn(), is(7));
	}
}
