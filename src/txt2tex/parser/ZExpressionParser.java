package txt2tex.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import txt2tex.Unreachable;
import txt2tex.lexer.ZToken;
import txt2tex.lexer.ZTokenType;
import txt2tex.model.z.*;
import txt2tex.scope.Symbol;
import txt2tex.scope.SymbolKind;
import txt2tex.util.SourceLocation;

/**
 *
 * <p>
 * A recursive-descent parser for the expression and predicate language, one method per precedence level.
 * </p>
 *
 * <h3> Levels </h3>
 *
 * <p>From loosest to tightest binding:</p>
 * <ol>
 *     <li>shows, {@code <=>} (left), {@code =>} (right), or, and, not</li>
 *     <li>quantifiers, lambda and mu, which only appear as the first operand of a chain of
 *     and / or, or at the top of an expression</li>
 *     <li>the set union family ({@code union}, {@code \}, then {@code intersect})</li>
 *     <li>relation algebra: maplets, relation and function arrows, restrictions, composition, override</li>
 *     <li>comparisons; two or more of them in a row form a chain</li>
 *     <li>ranges, then additive and multiplicative arithmetic</li>
 *     <li>prefix operators, then postfix operators, then application forms</li>
 * </ol>
 *
 * <h3> Separators </h3>
 *
 * <p>A '.' (or '@', or bullet) belongs to the innermost open binder or comprehension that has not yet read
 * its own separator. Brackets open barrier frames so a separator inside them never reaches a binder
 * outside. See {@link SeparatorFrames}.</p>
 *
 */
public class ZExpressionParser {

	private static final Map<ZTokenType, ZOperator> UNION_OPERATORS = new EnumMap<>(ZTokenType.class);
	private static final Map<ZTokenType, ZOperator> INTERSECT_OPERATORS = new EnumMap<>(ZTokenType.class);
	private static final Map<ZTokenType, ZOperator> RELATION_OPERATORS = new EnumMap<>(ZTokenType.class);
	private static final Map<ZTokenType, ZOperator> COMPARISON_OPERATORS = new EnumMap<>(ZTokenType.class);
	private static final Map<ZTokenType, ZOperator> ADDITIVE_OPERATORS = new EnumMap<>(ZTokenType.class);
	private static final Map<ZTokenType, ZOperator> MULTIPLICATIVE_OPERATORS = new EnumMap<>(ZTokenType.class);
	private static final Map<ZTokenType, ZOperator> PREFIX_OPERATORS = new EnumMap<>(ZTokenType.class);

	private static final Set<ZTokenType> BINDERS = EnumSet.of(
			ZTokenType.FORALL, ZTokenType.EXISTS, ZTokenType.EXISTS1, ZTokenType.LAMBDA, ZTokenType.MU);

	// tokens that may begin an operand; used to tell postfix closure from an infix '+' or '*'
	private static final Set<ZTokenType> OPERAND_STARTS = EnumSet.of(
			ZTokenType.IDENTIFIER, ZTokenType.NUMBER, ZTokenType.TRUE, ZTokenType.FALSE, ZTokenType.EMPTYSET,
			ZTokenType.LPAREN, ZTokenType.LBRACE, ZTokenType.LANGLE, ZTokenType.LBAG, ZTokenType.IF,
			ZTokenType.NOT, ZTokenType.MINUS, ZTokenType.HASH, ZTokenType.DOM, ZTokenType.RAN, ZTokenType.INV,
			ZTokenType.ID, ZTokenType.BIGCUP, ZTokenType.BIGCAP, ZTokenType.FORALL, ZTokenType.EXISTS,
			ZTokenType.EXISTS1, ZTokenType.LAMBDA, ZTokenType.MU);

	// what may follow a name to apply it without parentheses, as in "P X" or "seq N"
	private static final Set<ZTokenType> JUXTAPOSED_ARGUMENT_STARTS = EnumSet.of(
			ZTokenType.IDENTIFIER, ZTokenType.NUMBER, ZTokenType.LBRACE, ZTokenType.LANGLE, ZTokenType.LBAG,
			ZTokenType.EMPTYSET);

	static {
		put(UNION_OPERATORS, ZOperator.UNION, ZOperator.SETMINUS);
		put(INTERSECT_OPERATORS, ZOperator.INTERSECT);
		put(RELATION_OPERATORS, ZOperator.MAPLET, ZOperator.RELATION, ZOperator.TFUN, ZOperator.PFUN,
				ZOperator.TINJ, ZOperator.PINJ, ZOperator.TSURJ, ZOperator.PSURJ, ZOperator.BIJ, ZOperator.FFUN,
				ZOperator.DRES, ZOperator.RRES, ZOperator.NDRES, ZOperator.NRRES, ZOperator.COMP,
				ZOperator.SEQUENTIAL, ZOperator.OVERRIDE);
		put(COMPARISON_OPERATORS, ZOperator.EQUALS, ZOperator.NOT_EQUAL, ZOperator.LESS, ZOperator.GREATER,
				ZOperator.LESS_EQUAL, ZOperator.GREATER_EQUAL, ZOperator.ELEM, ZOperator.NOTIN, ZOperator.SUBSET,
				ZOperator.PSUBSET);
		put(ADDITIVE_OPERATORS, ZOperator.PLUS, ZOperator.MINUS, ZOperator.CONCAT, ZOperator.FILTER,
				ZOperator.BAG_UNION);
		put(MULTIPLICATIVE_OPERATORS, ZOperator.TIMES, ZOperator.DIV, ZOperator.MOD, ZOperator.CROSS);
		put(PREFIX_OPERATORS, ZOperator.NEGATE, ZOperator.CARDINALITY, ZOperator.DOM, ZOperator.RAN,
				ZOperator.INV, ZOperator.ID, ZOperator.BIGCUP, ZOperator.BIGCAP);
	}

	private static void put(Map<ZTokenType, ZOperator> table, ZOperator... ops) {
		for(ZOperator op : ops) {
			table.put(op.getToken(), op);
		}
	}

	private final ParseContext ctx;

	public ZExpressionParser(ParseContext ctx) {
		this.ctx = ctx;
	}

	public ParseContext getContext() {
		return ctx;
	}

	/**
	 * Parses one complete expression or predicate, stopping at the first token that cannot continue it.
	 */
	public ZExpression parseExpression() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression lhs = parseIff();
		while(ctx.at(ZTokenType.SHOWS)) {
			ctx.next();
			ZExpression rhs = parseIff();
			lhs = new ZBinOp(ctx.locationFrom(start), ZOperator.SHOWS, lhs, rhs);
		}
		return lhs;
	}

	private ZExpression parseIff() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression lhs = parseImplies();
		while(ctx.at(ZTokenType.IFF)) {
			ctx.next();
			ZExpression rhs = parseImplies();
			lhs = new ZBinOp(ctx.locationFrom(start), ZOperator.IFF, lhs, rhs);
		}
		return lhs;
	}

	private ZExpression parseImplies() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression lhs = parseOr();
		if(ctx.at(ZTokenType.IMPLIES)) {
			ctx.next();
			ZExpression rhs = parseImplies();
			return new ZBinOp(ctx.locationFrom(start), ZOperator.IMPLIES, lhs, rhs);
		}
		return lhs;
	}

	private ZExpression parseOr() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression lhs = parseAnd(true);
		while(ctx.at(ZTokenType.OR)) {
			ctx.next();
			ZExpression rhs = parseAnd(false);
			lhs = new ZBinOp(ctx.locationFrom(start), ZOperator.OR, lhs, rhs);
		}
		return lhs;
	}

	private ZExpression parseAnd(boolean allowBinder) throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression lhs = parseNegation(allowBinder);
		while(ctx.at(ZTokenType.AND)) {
			ctx.next();
			ZExpression rhs = parseNegation(false);
			lhs = new ZBinOp(ctx.locationFrom(start), ZOperator.AND, lhs, rhs);
		}
		return lhs;
	}

	private ZExpression parseNegation(boolean allowBinder) throws ZParseException {
		ZToken start = ctx.peek();
		if(ctx.at(ZTokenType.NOT)) {
			ctx.next();
			ZExpression operand = parseNegation(allowBinder);
			return new ZUnaryOp(ctx.locationFrom(start), ZOperator.NOT, operand);
		}
		if(BINDERS.contains(start.getType())) {
			if(!allowBinder) {
				throw binderNeedsParentheses(start);
			}
			return parseBinder();
		}
		return parseUnion();
	}

	private ZParseException binderNeedsParentheses(ZToken binder) {
		return new ZParseException(binder.getLocation(),
				"'" + binder.getValue() + "' must be parenthesised here",
				"a quantifier extends as far right as possible; write (" + binder.getValue() + " ...) "
						+ "when it is an operand");
	}

	/**
	 * Parses the operand of a binding domain: everything tighter than the logical connectives, with ';' read
	 * as a separator between bindings.
	 */
	ZExpression parseDomain() throws ZParseException {
		boolean old = ctx.setSemicolonSeparates(true);
		try {
			return parseUnion();
		} finally {
			ctx.setSemicolonSeparates(old);
		}
	}

	ZExpression parseUnion() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression lhs = parseIntersect();
		while(UNION_OPERATORS.containsKey(ctx.peek().getType())) {
			ZOperator op = UNION_OPERATORS.get(ctx.next().getType());
			ZExpression rhs = parseIntersect();
			lhs = new ZBinOp(ctx.locationFrom(start), op, lhs, rhs);
		}
		return lhs;
	}

	private ZExpression parseIntersect() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression lhs = parseRelation();
		while(INTERSECT_OPERATORS.containsKey(ctx.peek().getType())) {
			ZOperator op = INTERSECT_OPERATORS.get(ctx.next().getType());
			ZExpression rhs = parseRelation();
			lhs = new ZBinOp(ctx.locationFrom(start), op, lhs, rhs);
		}
		return lhs;
	}

	private boolean atRelationOperator() {
		ZTokenType type = ctx.peek().getType();
		if(type == ZTokenType.SEMICOLON && ctx.semicolonSeparates()) {
			return false;
		}
		return RELATION_OPERATORS.containsKey(type);
	}

	private ZExpression parseRelation() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression lhs = parseComparison();
		while(atRelationOperator()) {
			ZOperator op = RELATION_OPERATORS.get(ctx.next().getType());
			ZExpression rhs = parseComparison();
			lhs = new ZBinOp(ctx.locationFrom(start), op, lhs, rhs);
		}
		return lhs;
	}

	private ZExpression parseComparison() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression first = parseRange();
		List<ZExpression> operands = new ArrayList<>();
		List<ZOperator> operators = new ArrayList<>();
		operands.add(first);
		while(COMPARISON_OPERATORS.containsKey(ctx.peek().getType())) {
			operators.add(COMPARISON_OPERATORS.get(ctx.next().getType()));
			operands.add(parseRange());
		}
		if(operators.isEmpty()) {
			return first;
		}
		if(operators.size() == 1) {
			return new ZBinOp(ctx.locationFrom(start), operators.get(0), operands.get(0), operands.get(1));
		}
		return new ZComparisonChain(ctx.locationFrom(start), operands, operators);
	}

	private ZExpression parseRange() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression lhs = parseAdditive();
		if(ctx.at(ZTokenType.RANGE)) {
			ctx.next();
			ZExpression rhs = parseAdditive();
			return new ZBinOp(ctx.locationFrom(start), ZOperator.RANGE, lhs, rhs);
		}
		return lhs;
	}

	private ZExpression parseAdditive() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression lhs = parseMultiplicative();
		while(ADDITIVE_OPERATORS.containsKey(ctx.peek().getType())) {
			ZOperator op = ADDITIVE_OPERATORS.get(ctx.next().getType());
			ZExpression rhs = parseMultiplicative();
			lhs = new ZBinOp(ctx.locationFrom(start), op, lhs, rhs);
		}
		return lhs;
	}

	private ZExpression parseMultiplicative() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression lhs = parsePrefix();
		while(MULTIPLICATIVE_OPERATORS.containsKey(ctx.peek().getType())) {
			ZOperator op = MULTIPLICATIVE_OPERATORS.get(ctx.next().getType());
			ZExpression rhs = parsePrefix();
			lhs = new ZBinOp(ctx.locationFrom(start), op, lhs, rhs);
		}
		return lhs;
	}

	private ZExpression parsePrefix() throws ZParseException {
		ZToken start = ctx.peek();
		ZOperator op = PREFIX_OPERATORS.get(start.getType());
		if(op != null) {
			ctx.next();
			ZExpression operand = parsePrefix();
			return new ZUnaryOp(ctx.locationFrom(start), op, operand);
		}
		return parsePostfix();
	}

	private ZExpression parsePostfix() throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression base = parseApplication(true);
		while(true) {
			ZToken t = ctx.peek();
			switch(t.getType()) {
				case TILDE:
					ctx.next();
					base = new ZUnaryOp(ctx.locationFrom(start), ZOperator.INVERSE, base);
					break;
				case PLUS:
				case STAR:
					if(OPERAND_STARTS.contains(ctx.peek(1).getType())) {
						return base;
					}
					ctx.next();
					base = new ZUnaryOp(ctx.locationFrom(start),
							t.getType() == ZTokenType.PLUS ? ZOperator.CLOSURE : ZOperator.REFLEXIVE_CLOSURE, base);
					break;
				case POWER: {
					ctx.next();
					ZExpression exponent = parseExponent();
					base = new ZSuperscript(ctx.locationFrom(start), base, exponent);
					break;
				}
				case SUPERSCRIPT_GROUP: {
					ctx.next();
					base = new ZSuperscript(ctx.locationFrom(start), base, groupText(t));
					break;
				}
				default:
					return base;
			}
		}
	}

	private ZExpression parseExponent() throws ZParseException {
		ZToken start = ctx.peek();
		if(ctx.at(ZTokenType.MINUS)) {
			ctx.next();
			ZExpression operand = parseApplication(false);
			return new ZUnaryOp(ctx.locationFrom(start), ZOperator.NEGATE, operand);
		}
		return parseApplication(false);
	}

	/**
	 * @return the text between the braces of a "_{...}" or "^{...}" token
	 */
	private static ZRawText groupText(ZToken group) {
		String v = group.getValue();
		return new ZRawText(group.getLocation(), v.substring(2, v.length() - 1).trim());
	}

	private static boolean isProjectable(ZExpression e) {
		return e instanceof ZIdentifier || e instanceof ZApplication || e instanceof ZInstantiation
				|| e instanceof ZProjection;
	}

	private static boolean isCallable(ZExpression e) {
		return isProjectable(e) || e instanceof ZSubscript || e instanceof ZRelationalImage;
	}

	private ZExpression parseApplication(boolean allowJuxtaposition) throws ZParseException {
		ZToken start = ctx.peek();
		ZExpression base = parseAtom();
		while(true) {
			ZToken t = ctx.peek();
			switch(t.getType()) {
				case LPAREN: {
					boolean grouped = base instanceof ZBinOp && ((ZBinOp) base).hasExplicitGrouping()
							&& !t.isPrecededBySpace();
					if(!isCallable(base) && !grouped) {
						return base;
					}
					List<ZExpression> args = parseList(ZTokenType.RPAREN, "')'", true);
					base = new ZApplication(ctx.locationFrom(start), base, args);
					break;
				}
				case LIMAGE: {
					ctx.next();
					SeparatorFrames.Frame barrier = ctx.getFrames().push(SeparatorFrames.Kind.BARRIER, t);
					try {
						ZExpression set = parseExpression();
						ctx.expect(ZTokenType.RIMAGE, "'|)' to close the relational image");
						base = new ZRelationalImage(ctx.locationFrom(start), base, set);
					} finally {
						ctx.getFrames().pop(barrier);
					}
					break;
				}
				case INDEX_OPEN: {
					List<ZExpression> args = parseList(ZTokenType.RBRACKET, "']'", false);
					base = new ZInstantiation(ctx.locationFrom(start), base, args);
					break;
				}
				case DOT: {
					ZTokenType after = ctx.peek(1).getType();
					if(!isProjectable(base) || (after != ZTokenType.IDENTIFIER && after != ZTokenType.NUMBER)) {
						return base;
					}
					ctx.next();
					ZToken field = ctx.next();
					base = new ZProjection(ctx.locationFrom(start), base, field.getValue());
					break;
				}
				case SUBSCRIPT: {
					ctx.next();
					String v = t.getValue().substring(1);
					ZExpression sub = Character.isDigit(v.charAt(0))
							? new ZNumber(t.getLocation(), v)
							: new ZIdentifier(t.getLocation(), v);
					base = new ZSubscript(ctx.locationFrom(start), base, sub);
					break;
				}
				case SUBSCRIPT_GROUP:
					ctx.next();
					base = new ZSubscript(ctx.locationFrom(start), base, groupText(t));
					break;
				default:
					if(allowJuxtaposition && t.isPrecededBySpace()
							&& (base instanceof ZIdentifier || base instanceof ZInstantiation)
							&& JUXTAPOSED_ARGUMENT_STARTS.contains(t.getType())) {
						ZExpression arg = parseApplication(true);
						return new ZApplication(ctx.locationFrom(start), base, Collections.singletonList(arg));
					}
					return base;
			}
		}
	}

	/**
	 * Parses a comma-separated list after the opening bracket at the cursor, through the given closing one. The brackets form a barrier for separators.
	 */
	private List<ZExpression> parseList(ZTokenType close, String closeName, boolean allowEmpty)
			throws ZParseException {
		ZToken opener = ctx.next();
		SeparatorFrames.Frame barrier = ctx.getFrames().push(SeparatorFrames.Kind.BARRIER, opener);
		try {
			List<ZExpression> items = new ArrayList<>();
			if(ctx.at(close)) {
				if(!allowEmpty) {
					throw ctx.unexpected("an expression");
				}
				ctx.next();
				return items;
			}
			items.add(parseExpression());
			while(ctx.accept(ZTokenType.COMMA) != null) {
				items.add(parseExpression());
			}
			ctx.expect(close, "',' or " + closeName);
			return items;
		} finally {
			ctx.getFrames().pop(barrier);
		}
	}

	private ZExpression parseAtom() throws ZParseException {
		ZToken t = ctx.peek();
		switch(t.getType()) {
			case IDENTIFIER:
				ctx.next();
				return reference(t);
			case NUMBER:
				ctx.next();
				return new ZNumber(t.getLocation(), t.getValue());
			case TRUE:
				ctx.next();
				return new ZConstant(t.getLocation(), ZConstant.Kind.TRUE);
			case FALSE:
				ctx.next();
				return new ZConstant(t.getLocation(), ZConstant.Kind.FALSE);
			case EMPTYSET:
				ctx.next();
				return new ZConstant(t.getLocation(), ZConstant.Kind.EMPTYSET);
			case LPAREN:
				return parseParenthesised();
			case LBRACE:
				return parseBrace();
			case LANGLE: {
				List<ZExpression> elements = parseList(ZTokenType.RANGLE, "'>'", true);
				return new ZSequenceLiteral(ctx.locationFrom(t), elements);
			}
			case LBAG: {
				List<ZExpression> elements = parseList(ZTokenType.RBAG, "']]'", true);
				return new ZBagLiteral(ctx.locationFrom(t), elements);
			}
			case IF:
				return parseConditional();
			case FORALL:
			case EXISTS:
			case EXISTS1:
			case LAMBDA:
			case MU:
				throw binderNeedsParentheses(t);
			default:
				throw ctx.unexpected("an expression");
		}
	}

	/**
	 * Checks a name used in an expression. A subscript or postfix glyph hugging the name may be part of a
	 * declared name ("x_1", "R+"), so the joined spelling is resolved first; the tree keeps the suffix as an
	 * operator either way.
	 */
	private ZIdentifier reference(ZToken name) throws ZParseException {
		ZToken suffix = ctx.peek();
		if(isNameSuffix(suffix)) {
			String joined = name.getValue() + suffix.getValue();
			if(ctx.getScope().lookup(joined) != null) {
				return new ZIdentifier(name.getLocation(), name.getValue());
			}
			checkVisible(joined, name.getLocation().combine(suffix.getLocation()));
		}
		checkVisible(name.getValue(), name.getLocation());
		return new ZIdentifier(name.getLocation(), name.getValue());
	}

	private static boolean isNameSuffix(ZToken t) {
		if(t.isPrecededBySpace()) {
			return false;
		}
		switch(t.getType()) {
			case SUBSCRIPT:
			case PLUS:
			case STAR:
			case TILDE:
				return true;
			default:
				return false;
		}
	}

	private void checkVisible(String name, SourceLocation at) throws ZParseException {
		String schema = ctx.getScope().owningSchema(name);
		if(schema != null) {
			throw new ZParseException(at,
					"'" + name + "' is not declared in this scope",
					"'" + name + "' is a component of schema " + schema
							+ "; include " + schema + " in the declarations to use it here");
		}
	}

	private ZExpression parseParenthesised() throws ZParseException {
		ZToken open = ctx.next();
		SeparatorFrames.Frame barrier = ctx.getFrames().push(SeparatorFrames.Kind.BARRIER, open);
		try {
			if(ctx.at(ZTokenType.RPAREN)) {
				throw new ZParseException(ctx.peek().getLocation(), "empty parentheses");
			}
			ZExpression first = parseExpression();
			if(ctx.at(ZTokenType.COMMA)) {
				List<ZExpression> elements = new ArrayList<>();
				elements.add(first);
				while(ctx.accept(ZTokenType.COMMA) != null) {
					elements.add(parseExpression());
				}
				ctx.expect(ZTokenType.RPAREN, "',' or ')'");
				return new ZTuple(ctx.locationFrom(open), elements);
			}
			ctx.expect(ZTokenType.RPAREN, "')'");
			if(first instanceof ZBinOp) {
				return ((ZBinOp) first).withExplicitGrouping(ctx.locationFrom(open));
			}
			return first;
		} finally {
			ctx.getFrames().pop(barrier);
		}
	}

	private ZExpression parseConditional() throws ZParseException {
		ZToken start = ctx.next();
		ZExpression condition = parseExpression();
		ctx.expect(ZTokenType.THEN, "'then'");
		ZExpression thenBranch = parseExpression();
		ctx.expect(ZTokenType.ELSE, "'else'");
		ZExpression elseBranch = parseExpression();
		return new ZConditional(ctx.locationFrom(start), condition, thenBranch, elseBranch);
	}

	/**
	 * A brace opens a set comprehension when it is followed by bound names and then ':' or '|'; otherwise
	 * it opens a set literal.
	 */
	private boolean atComprehension() {
		int i = 1;
		while(true) {
			if(ctx.peek(i).getType() != ZTokenType.IDENTIFIER) {
				return false;
			}
			++i;
			if(ctx.peek(i).getType() == ZTokenType.SUBSCRIPT) {
				++i;
			}
			ZTokenType after = ctx.peek(i).getType();
			if(after == ZTokenType.COLON || after == ZTokenType.PIPE) {
				return true;
			}
			if(after != ZTokenType.COMMA) {
				return false;
			}
			++i;
		}
	}

	private ZExpression parseBrace() throws ZParseException {
		ZToken open = ctx.peek();
		if(!atComprehension()) {
			List<ZExpression> elements = parseList(ZTokenType.RBRACE, "'}'", true);
			return new ZSetLiteral(ctx.locationFrom(open), elements);
		}
		ctx.next();
		SeparatorFrames.Frame frame = ctx.getFrames().push(SeparatorFrames.Kind.COMPREHENSION, open);
		ctx.getScope().enterBlock();
		try {
			List<ZBinding> bindings = parseBindings();
			ZExpression constraint = null;
			ZExpression selector = null;
			if(ctx.accept(ZTokenType.PIPE) != null) {
				frame.advance(SeparatorFrames.State.CONSTRAINT);
				constraint = parseExpression();
			}
			if(atSeparatorOf(frame)) {
				ctx.next();
				frame.advance(SeparatorFrames.State.BODY);
				selector = parseExpression();
			}
			ctx.expect(ZTokenType.RBRACE, constraint == null && selector == null ? "'|', '.' or '}'" : "'}'");
			return new ZSetComprehension(ctx.locationFrom(open), bindings, constraint, selector);
		} finally {
			ctx.getScope().exitBlock();
			ctx.getFrames().pop(frame);
		}
	}

	private boolean atSeparatorOf(SeparatorFrames.Frame frame) {
		return ctx.at(ZTokenType.BULLET, ZTokenType.DOT) && ctx.getFrames().owner() == frame;
	}

	private ZExpression parseBinder() throws ZParseException {
		ZToken start = ctx.next();
		SeparatorFrames.Frame frame = ctx.getFrames().push(SeparatorFrames.Kind.BINDER, start);
		ctx.getScope().enterBlock();
		try {
			List<ZBinding> bindings = parseBindings();
			ZExpression first = null;
			ZExpression second = null;
			boolean constrained = false;
			if(ctx.accept(ZTokenType.PIPE) != null) {
				constrained = true;
				frame.advance(SeparatorFrames.State.CONSTRAINT);
				first = parseExpression();
				if(atSeparatorOf(frame)) {
					ctx.next();
					frame.advance(SeparatorFrames.State.BODY);
					second = parseExpression();
				}
			} else if(atSeparatorOf(frame)) {
				ctx.next();
				frame.advance(SeparatorFrames.State.BODY);
				second = parseExpression();
			} else {
				throw ctx.unexpected("'|' or '.' after the bound variables of '" + start.getValue() + "'");
			}
			SourceLocation location = ctx.locationFrom(start);
			switch(start.getType()) {
				case FORALL:
				case EXISTS:
				case EXISTS1: {
					ZQuantified.Kind kind = start.getType() == ZTokenType.FORALL ? ZQuantified.Kind.FORALL
							: start.getType() == ZTokenType.EXISTS ? ZQuantified.Kind.EXISTS
							: ZQuantified.Kind.EXISTS1;
					if(second == null) {
						return new ZQuantified(location, kind, bindings, null, first);
					}
					return new ZQuantified(location, kind, bindings, first, second);
				}
				case LAMBDA:
					if(second == null) {
						throw ctx.unexpected("'.' and the body of the lambda");
					}
					return new ZLambda(location, bindings, first, second);
				case MU:
					return new ZDefiniteDescription(location, bindings, first, second);
				default:
					throw new Unreachable();
			}
		} finally {
			ctx.getScope().exitBlock();
			ctx.getFrames().pop(frame);
		}
	}

	/**
	 * Parses "x, y : T; z : U", declaring each bound name in the innermost open block once its domain has
	 * been read.
	 */
	List<ZBinding> parseBindings() throws ZParseException {
		List<ZBinding> bindings = new ArrayList<>();
		do {
			ZToken start = ctx.peek();
			List<ZIdentifier> names = new ArrayList<>();
			boolean tuplePattern = ctx.at(ZTokenType.LPAREN);
			if(tuplePattern) {
				parseTuplePattern(names);
			} else {
				names.add(parseBoundName());
				while(ctx.accept(ZTokenType.COMMA) != null) {
					names.add(parseBoundName());
				}
			}
			ZExpression domain = null;
			if(ctx.accept(ZTokenType.COLON) != null) {
				domain = parseDomain();
			}
			for(ZIdentifier name : names) {
				ctx.getScope().declareLocal(
						new Symbol(name.getName(), SymbolKind.BOUND_VARIABLE, name.getLocation()));
			}
			bindings.add(new ZBinding(ctx.locationFrom(start), names, domain, tuplePattern));
		} while(ctx.accept(ZTokenType.SEMICOLON) != null);
		return bindings;
	}

	/**
	 * Reads "(x, y, ...)" in binding position. Only plain names may appear; nested patterns are not supported.
	 */
	private void parseTuplePattern(List<ZIdentifier> names) throws ZParseException {
		ctx.next();
		if(ctx.at(ZTokenType.RPAREN)) {
			throw new ZParseException(ctx.peek().getLocation(), "empty tuple pattern",
					"write the bound names between the parentheses, as in (x, y) : A cross B");
		}
		do {
			if(!ctx.at(ZTokenType.IDENTIFIER)) {
				throw new ZParseException(ctx.peek().getLocation(),
						"a tuple pattern in a binder may contain only names",
						"bind the components by name, as in (x, y), and constrain them after '|'");
			}
			names.add(parseBoundName());
		} while(ctx.accept(ZTokenType.COMMA) != null);
		ctx.expect(ZTokenType.RPAREN, "',' or ')' to close the tuple pattern");
	}

	/**
	 * Reads a name being introduced. A single-character subscript joins the name, so "x_1" declares "x_1".
	 */
	ZIdentifier parseBoundName() throws ZParseException {
		ZToken name = ctx.expect(ZTokenType.IDENTIFIER, "a name");
		if(ctx.at(ZTokenType.SUBSCRIPT)) {
			ZToken sub = ctx.next();
			return new ZIdentifier(ctx.locationFrom(name), name.getValue() + sub.getValue());
		}
		return new ZIdentifier(name.getLocation(), name.getValue());
	}
}
