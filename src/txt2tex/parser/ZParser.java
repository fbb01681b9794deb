package txt2tex.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import txt2tex.lexer.ZToken;
import txt2tex.lexer.ZTokenType;
import txt2tex.model.document.*;
import txt2tex.model.z.ZExpression;
import txt2tex.model.z.ZOperator;
import txt2tex.model.z.ZParagraph;
import txt2tex.scope.ZScope;
import txt2tex.util.SourceLocation;

/**
 *
 * <p>
 * Parses the token stream of a whole document into a {@link Document}.
 * </p>
 *
 * <p>
 * Endpoints that are called elsewhere begin with read*. Each call owns a fresh {@link ZScope} and
 * {@link ParseContext}, so separate calls share no state. The first error aborts the call.
 * </p>
 *
 * <p>
 * Expressions are handled by {@link ZExpressionParser}, Z paragraphs by {@link ZParagraphParser} and prose
 * lines by {@link ProseScanner}. This class handles the line-oriented structures between them: sections,
 * solutions and parts, truth tables, equivalence chains, proof trees and inference rules.
 * </p>
 *
 */
public class ZParser {

	private static final Logger logger = Logger.getLogger("Txt2Tex Parser");

	private static final Pattern SECTION_TITLE = Pattern.compile("\\s*===\\s*(.*?)\\s*===\\s*");
	private static final Pattern SOLUTION_TITLE = Pattern.compile("\\s*\\*\\*\\s*(.*?)\\s*\\*\\*\\s*");
	private static final Pattern DISCHARGE = Pattern.compile("\\bfrom\\s+(\\d+(?:\\s*,\\s*\\d+)*)\\s*$");

	// tokens that always start a new item, and so end a line-oriented structure
	private static final Set<ZTokenType> ITEM_STARTS = EnumSet.of(
			ZTokenType.SECTION_HEADER, ZTokenType.SOLUTION_HEADER, ZTokenType.PART_LABEL, ZTokenType.TEXT,
			ZTokenType.PURETEXT, ZTokenType.LATEX, ZTokenType.PAGEBREAK, ZTokenType.METADATA,
			ZTokenType.TRUTH_TABLE, ZTokenType.EQUIV, ZTokenType.ARGUE, ZTokenType.PROOF, ZTokenType.INFRULE,
			ZTokenType.GIVEN, ZTokenType.AXDEF, ZTokenType.GENDEF, ZTokenType.SCHEMA, ZTokenType.ZED);

	private final ParseContext ctx;
	private final ZExpressionParser expressions;
	private final ZParagraphParser paragraphs;
	private final ProseScanner prose;
	private final Map<String, String> metadata = new LinkedHashMap<>();

	public ZParser(List<ZToken> tokens, boolean proseDetection) {
		ZScope scope = new ZScope();
		this.ctx = new ParseContext(tokens, scope, proseDetection);
		this.expressions = new ZExpressionParser(ctx);
		this.paragraphs = new ZParagraphParser(ctx, expressions);
		this.prose = new ProseScanner(scope, proseDetection);
	}

	public static Document readDocument(List<ZToken> tokens) throws ZParseException {
		return readDocument(tokens, true);
	}

	public static Document readDocument(List<ZToken> tokens, boolean proseDetection) throws ZParseException {
		return new ZParser(tokens, proseDetection).parseDocument();
	}

	/**
	 * Reads a single expression. Anything after it is an error.
	 */
	public static ZExpression readExpression(List<ZToken> tokens) throws ZParseException {
		ZParser parser = new ZParser(tokens, false);
		parser.ctx.skipNewlines();
		ZExpression e = parser.expressions.parseExpression();
		parser.ctx.skipNewlines();
		if(!parser.ctx.at(ZTokenType.EOF)) {
			throw parser.ctx.unexpected("the end of the expression");
		}
		return e;
	}

	public ZScope getScope() {
		return ctx.getScope();
	}

	public Document parseDocument() throws ZParseException {
		ZToken start = ctx.peek();
		List<DocumentItem> items = parseItems(Collections.emptySet());
		SourceLocation location = start.getLocation().combine(ctx.peek().getLocation());
		logger.fine("parsed " + items.size() + " top-level items");
		return new Document(location, items, metadata);
	}

	/**
	 * Reads items until EOF or one of the given tokens at the start of a line.
	 */
	private List<DocumentItem> parseItems(Set<ZTokenType> stops) throws ZParseException {
		List<DocumentItem> items = new ArrayList<>();
		ctx.skipNewlines();
		while(!ctx.at(ZTokenType.EOF) && !stops.contains(ctx.peek().getType())) {
			switch(ctx.peek().getType()) {
				case METADATA:
					parseMetadata();
					break;
				case SECTION_HEADER:
					items.add(parseSection());
					break;
				case SOLUTION_HEADER:
					items.add(parseSolution());
					break;
				case PART_LABEL:
					items.add(parsePart());
					break;
				default:
					items.add(parseItem());
			}
			ctx.skipNewlines();
		}
		return items;
	}

	private void parseMetadata() throws ZParseException {
		ZToken t = ctx.next();
		String value = t.getValue().trim();
		int colon = value.indexOf(':');
		metadata.put(value.substring(0, colon).toLowerCase(), value.substring(colon + 1).trim());
		ctx.expectLineEnd("metadata");
	}

	private static String title(Pattern p, ZToken header) {
		Matcher m = p.matcher(header.getValue());
		return m.matches() ? m.group(1) : header.getValue().trim();
	}

	private Section parseSection() throws ZParseException {
		ZToken header = ctx.next();
		ctx.expectLineEnd("a section header");
		List<DocumentItem> items = parseItems(EnumSet.of(ZTokenType.SECTION_HEADER));
		logger.fine("section \"" + title(SECTION_TITLE, header) + "\" with " + items.size() + " items");
		return new Section(ctx.locationFrom(header), title(SECTION_TITLE, header), items);
	}

	private Solution parseSolution() throws ZParseException {
		ZToken header = ctx.next();
		ctx.expectLineEnd("a solution header");
		List<DocumentItem> items = parseItems(EnumSet.of(ZTokenType.SECTION_HEADER, ZTokenType.SOLUTION_HEADER));
		return new Solution(ctx.locationFrom(header), title(SOLUTION_TITLE, header), items);
	}

	private Part parsePart() throws ZParseException {
		ZToken label = ctx.next();
		String v = label.getValue();
		String name = v.substring(1, v.length() - 1);
		List<DocumentItem> items = new ArrayList<>();
		// "(a) expression" puts the first item on the label's own line
		if(!ctx.atLineEnd()) {
			items.add(parseItem());
		}
		items.addAll(parseItems(EnumSet.of(
				ZTokenType.SECTION_HEADER, ZTokenType.SOLUTION_HEADER, ZTokenType.PART_LABEL)));
		return new Part(ctx.locationFrom(label), name, items);
	}

	private DocumentItem parseItem() throws ZParseException {
		ZToken t = ctx.peek();
		switch(t.getType()) {
			case TEXT:
			case PURETEXT:
			case LATEX: {
				ctx.next();
				Paragraph p = prose.scan(t);
				ctx.expectLineEnd("a paragraph");
				return p;
			}
			case PAGEBREAK:
				ctx.next();
				ctx.expectLineEnd("PAGEBREAK");
				return new PageBreak(t.getLocation());
			case TRUTH_TABLE:
				return parseTruthTable();
			case EQUIV:
			case ARGUE:
				return parseEquivChain();
			case PROOF:
				return parseProofTree();
			case INFRULE:
				return parseInferenceRule();
			case ZED:
				return parseZed();
			case RULE_LINE:
				throw new ZParseException(t.getLocation(), "rule line outside an inference rule",
						"a line of dashes separates premises from the conclusion after INFRULE:");
			default:
				return parseZedItem();
		}
	}

	// the items allowed both at document level and inside zed ... end
	private DocumentItem parseZedItem() throws ZParseException {
		if(paragraphs.atParagraph()) {
			ZParagraph p = paragraphs.parseParagraph();
			return new ZParagraphItem(p.getLocation(), p);
		}
		ZExpression e = expressions.parseExpression();
		ctx.expectLineEnd("an expression");
		return new ExpressionItem(e.getLocation(), e);
	}

	private ZedBlock parseZed() throws ZParseException {
		ZToken start = ctx.next();
		ctx.expectLineEnd("'zed'");
		List<DocumentItem> items = new ArrayList<>();
		ctx.skipNewlines();
		while(!ctx.at(ZTokenType.END, ZTokenType.EOF)) {
			items.add(parseZedItem());
			ctx.skipNewlines();
		}
		ctx.expect(ZTokenType.END, "'end' to close the zed block");
		SourceLocation location = ctx.locationFrom(start);
		ctx.expectLineEnd("'end'");
		return new ZedBlock(location, items);
	}

	/**
	 * @return true when the structure being read continues on the current line
	 */
	private boolean structureContinues() {
		return !ctx.atLineEnd() && !ITEM_STARTS.contains(ctx.peek().getType());
	}

	private void startStructure(String marker) throws ZParseException {
		ctx.next();
		ctx.expectLineEnd(marker);
		ctx.skipNewlines();
	}

	private TruthTable parseTruthTable() throws ZParseException {
		ZToken start = ctx.peek();
		startStructure("TRUTH TABLE:");
		List<ZExpression> headers = new ArrayList<>();
		headers.add(expressions.parseExpression());
		while(ctx.accept(ZTokenType.PIPE) != null) {
			headers.add(expressions.parseExpression());
		}
		ctx.expectLineEnd("the truth table header");
		List<List<Boolean>> rows = new ArrayList<>();
		while(atTruthValue()) {
			ZToken rowStart = ctx.peek();
			List<Boolean> row = new ArrayList<>();
			row.add(parseTruthValue());
			while(ctx.accept(ZTokenType.PIPE) != null) {
				row.add(parseTruthValue());
			}
			if(row.size() != headers.size()) {
				throw new ZParseException(ctx.locationFrom(rowStart),
						"truth table row has " + row.size() + " values but the header has " + headers.size()
								+ " columns");
			}
			rows.add(row);
			ctx.expectLineEnd("a truth table row");
		}
		if(rows.isEmpty()) {
			throw ctx.unexpected("a row of T and F values");
		}
		return new TruthTable(ctx.locationFrom(start), headers, rows);
	}

	private boolean atTruthValue() {
		ZToken t = ctx.peek();
		if(t.getType() == ZTokenType.TRUE || t.getType() == ZTokenType.FALSE) {
			return true;
		}
		return t.getType() == ZTokenType.IDENTIFIER && t.getValue().matches("[TFtf]");
	}

	private boolean parseTruthValue() throws ZParseException {
		if(!atTruthValue()) {
			throw ctx.unexpected("'T' or 'F'");
		}
		ZToken t = ctx.next();
		return t.getType() == ZTokenType.TRUE || t.getValue().equalsIgnoreCase("T");
	}

	private EquivChain parseEquivChain() throws ZParseException {
		ZToken start = ctx.peek();
		EquivChain.Kind kind = start.getType() == ZTokenType.EQUIV ? EquivChain.Kind.EQUIV : EquivChain.Kind.ARGUE;
		startStructure(start.getValue());
		List<EquivStep> steps = new ArrayList<>();
		while(structureContinues()) {
			ZToken stepStart = ctx.peek();
			ZOperator connective = null;
			if(ctx.at(ZTokenType.IFF, ZTokenType.IMPLIES, ZTokenType.EQUALS)) {
				connective = ZOperator.fromToken(ctx.next().getType(), ZOperator.Fixity.INFIX);
			}
			ZExpression e = expressions.parseExpression();
			String justification = ctx.at(ZTokenType.LBRACKET) ? readBracketed() : null;
			steps.add(new EquivStep(ctx.locationFrom(stepStart), connective, e, justification));
			ctx.expectLineEnd("a step");
		}
		if(steps.isEmpty()) {
			throw ctx.unexpected("the first step of the chain");
		}
		return new EquivChain(ctx.locationFrom(start), kind, steps);
	}

	/**
	 * Reads "[ ... ]" as text, keeping the spacing of the source between tokens.
	 */
	private String readBracketed() throws ZParseException {
		ctx.next();
		StringBuilder text = new StringBuilder();
		int depth = 0;
		while(true) {
			ZToken t = ctx.peek();
			if(t.getType() == ZTokenType.EOF || t.getType() == ZTokenType.NEWLINE) {
				throw ctx.unexpected("']' to close the justification");
			}
			ctx.next();
			if(t.getType() == ZTokenType.RBRACKET) {
				if(depth == 0) {
					break;
				}
				--depth;
			} else if(t.getType() == ZTokenType.LBRACKET || t.getType() == ZTokenType.INDEX_OPEN) {
				++depth;
			}
			if(text.length() > 0 && t.isPrecededBySpace()) {
				text.append(' ');
			}
			text.append(t.getValue());
		}
		return text.toString();
	}

	/**
	 * One line of a proof, before the tree is assembled from indentation.
	 */
	private static final class ProofLine {
		final int indent;
		final SourceLocation location;
		// null for a case line
		final ZExpression expression;
		final String caseName;
		final String justification;
		final Integer label;
		final boolean sibling;
		final List<Integer> discharges;
		final List<ProofLine> children = new ArrayList<>();

		ProofLine(int indent, SourceLocation location, ZExpression expression, String caseName,
		          String justification, Integer label, boolean sibling, List<Integer> discharges) {
			this.indent = indent;
			this.location = location;
			this.expression = expression;
			this.caseName = caseName;
			this.justification = justification;
			this.label = label;
			this.sibling = sibling;
			this.discharges = discharges;
		}
	}

	private ProofTree parseProofTree() throws ZParseException {
		ZToken start = ctx.peek();
		startStructure("PROOF:");
		List<ProofLine> lines = new ArrayList<>();
		while(structureContinues()) {
			lines.add(parseProofLine());
		}
		if(lines.isEmpty()) {
			throw ctx.unexpected("the conclusion of the proof");
		}
		ProofLine root = lines.get(0);
		if(root.expression == null) {
			throw new ZParseException(root.location, "a proof must start with its conclusion, not a case");
		}
		List<ProofLine> open = new ArrayList<>();
		open.add(root);
		for(ProofLine line : lines.subList(1, lines.size())) {
			while(!open.isEmpty() && open.get(open.size() - 1).indent >= line.indent) {
				open.remove(open.size() - 1);
			}
			if(open.isEmpty()) {
				throw new ZParseException(line.location, "proof line is not indented under the conclusion",
						"the supporting steps of a proof are indented further than the line they support");
			}
			open.get(open.size() - 1).children.add(line);
			open.add(line);
		}
		checkDischarges(root);
		return new ProofTree(ctx.locationFrom(start), (ProofNode) build(root));
	}

	private ProofLine parseProofLine() throws ZParseException {
		ZToken start = ctx.peek();
		int indent = start.getColumn();
		if(start.getType() == ZTokenType.IDENTIFIER && start.getValue().equals("case")) {
			ctx.next();
			StringBuilder name = new StringBuilder();
			while(!ctx.at(ZTokenType.COLON)) {
				if(ctx.atLineEnd()) {
					throw ctx.unexpected("':' after the case name");
				}
				ZToken t = ctx.next();
				if(name.length() > 0 && t.isPrecededBySpace()) {
					name.append(' ');
				}
				name.append(t.getValue());
			}
			ctx.next();
			SourceLocation location = ctx.locationFrom(start);
			ctx.expectLineEnd("a case label");
			return new ProofLine(indent, location, null, name.toString(), null, null, false,
					Collections.emptyList());
		}
		Integer label = null;
		if(ctx.at(ZTokenType.LBRACKET) && ctx.peek(1).getType() == ZTokenType.NUMBER
				&& ctx.peek(2).getType() == ZTokenType.RBRACKET) {
			ctx.next();
			label = Integer.valueOf(ctx.next().getValue());
			ctx.next();
		}
		boolean sibling = ctx.accept(ZTokenType.DOUBLE_COLON) != null;
		ZExpression e = expressions.parseExpression();
		String justification = ctx.at(ZTokenType.LBRACKET) ? readBracketed() : null;
		SourceLocation location = ctx.locationFrom(start);
		ctx.expectLineEnd("a proof step");
		return new ProofLine(indent, location, e, null, justification, label, sibling, discharges(justification));
	}

	private static List<Integer> discharges(String justification) {
		if(justification == null) {
			return Collections.emptyList();
		}
		Matcher m = DISCHARGE.matcher(justification);
		if(!m.find()) {
			return Collections.emptyList();
		}
		List<Integer> labels = new ArrayList<>();
		for(String n : m.group(1).split("\\s*,\\s*")) {
			labels.add(Integer.valueOf(n));
		}
		return labels;
	}

	private static void collectLabels(ProofLine line, Set<Integer> labels) {
		for(ProofLine child : line.children) {
			if(child.label != null) {
				labels.add(child.label);
			}
			collectLabels(child, labels);
		}
	}

	private static void checkDischarges(ProofLine line) throws ZParseException {
		if(!line.discharges.isEmpty()) {
			Set<Integer> labels = new HashSet<>();
			collectLabels(line, labels);
			for(Integer n : line.discharges) {
				if(!labels.contains(n)) {
					throw new ZParseException(line.location,
							"'from " + n + "' does not match any assumption labelled [" + n + "] above this step",
							"label the assumption as [" + n + "] on a line indented under this one");
				}
			}
		}
		for(ProofLine child : line.children) {
			checkDischarges(child);
		}
	}

	private static ProofElement build(ProofLine line) {
		List<ProofElement> children = new ArrayList<>();
		for(ProofLine child : line.children) {
			children.add(build(child));
		}
		if(line.expression == null) {
			return new ProofCase(line.location, line.caseName, children);
		}
		return new ProofNode(line.location, line.expression, line.justification, line.label,
				"assumption".equals(line.justification), line.sibling, line.discharges, children);
	}

	private InferenceRule parseInferenceRule() throws ZParseException {
		ZToken start = ctx.peek();
		startStructure("INFRULE:");
		List<InferenceLine> premises = new ArrayList<>();
		while(!ctx.at(ZTokenType.RULE_LINE)) {
			if(!structureContinues()) {
				throw ctx.unexpected("a premise or the rule line");
			}
			premises.add(parseInferenceLine());
		}
		ctx.next();
		ctx.expectLineEnd("the rule line");
		if(!structureContinues()) {
			throw ctx.unexpected("the conclusion of the rule");
		}
		InferenceLine conclusion = parseInferenceLine();
		return new InferenceRule(ctx.locationFrom(start), premises, conclusion);
	}

	private InferenceLine parseInferenceLine() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression e = expressions.parseExpression();
		String label = ctx.at(ZTokenType.LBRACKET) ? readBracketed() : null;
		SourceLocation location = ctx.locationFrom(start);
		ctx.expectLineEnd("an inference line");
		return new InferenceLine(location, e, label);
	}
}
