package txt2tex.model.z;

import txt2tex.lexer.ZTokenType;

/**
 * The operators of the notation. Each has a canonical ASCII spelling, which is what the formatting visitor
 * prints; a renderer maps operators to its own symbols.
 */
public enum ZOperator {
	// infix, lowest precedence first
	SHOWS("shows", Fixity.INFIX, ZTokenType.SHOWS),
	IFF("<=>", Fixity.INFIX, ZTokenType.IFF),
	IMPLIES("=>", Fixity.INFIX, ZTokenType.IMPLIES),
	OR("or", Fixity.INFIX, ZTokenType.OR),
	AND("and", Fixity.INFIX, ZTokenType.AND),
	UNION("union", Fixity.INFIX, ZTokenType.UNION),
	SETMINUS("\\", Fixity.INFIX, ZTokenType.SETMINUS),
	INTERSECT("intersect", Fixity.INFIX, ZTokenType.INTERSECT),
	MAPLET("|->", Fixity.INFIX, ZTokenType.MAPLET),
	RELATION("<->", Fixity.INFIX, ZTokenType.RELATION),
	TFUN("->", Fixity.INFIX, ZTokenType.TFUN),
	PFUN("+->", Fixity.INFIX, ZTokenType.PFUN),
	TINJ(">->", Fixity.INFIX, ZTokenType.TINJ),
	PINJ(">+>", Fixity.INFIX, ZTokenType.PINJ),
	TSURJ("-->>", Fixity.INFIX, ZTokenType.TSURJ),
	PSURJ("+->>", Fixity.INFIX, ZTokenType.PSURJ),
	BIJ(">->>", Fixity.INFIX, ZTokenType.BIJ),
	FFUN("77->", Fixity.INFIX, ZTokenType.FFUN),
	DRES("<|", Fixity.INFIX, ZTokenType.DRES),
	RRES("|>", Fixity.INFIX, ZTokenType.RRES),
	NDRES("<<|", Fixity.INFIX, ZTokenType.NDRES),
	NRRES("|>>", Fixity.INFIX, ZTokenType.NRRES),
	COMP("o9", Fixity.INFIX, ZTokenType.COMP),
	SEQUENTIAL(";", Fixity.INFIX, ZTokenType.SEMICOLON),
	OVERRIDE("++", Fixity.INFIX, ZTokenType.OVERRIDE),
	EQUALS("=", Fixity.INFIX, ZTokenType.EQUALS),
	NOT_EQUAL("!=", Fixity.INFIX, ZTokenType.NOT_EQUAL),
	LESS("<", Fixity.INFIX, ZTokenType.LESS),
	GREATER(">", Fixity.INFIX, ZTokenType.GREATER),
	LESS_EQUAL("<=", Fixity.INFIX, ZTokenType.LESS_EQUAL),
	GREATER_EQUAL(">=", Fixity.INFIX, ZTokenType.GREATER_EQUAL),
	ELEM("elem", Fixity.INFIX, ZTokenType.ELEM),
	NOTIN("notin", Fixity.INFIX, ZTokenType.NOTIN),
	SUBSET("subset", Fixity.INFIX, ZTokenType.SUBSET),
	PSUBSET("psubset", Fixity.INFIX, ZTokenType.PSUBSET),
	RANGE("..", Fixity.INFIX, ZTokenType.RANGE),
	PLUS("+", Fixity.INFIX, ZTokenType.PLUS),
	MINUS("-", Fixity.INFIX, ZTokenType.MINUS),
	CONCAT("^", Fixity.INFIX, ZTokenType.CONCAT),
	FILTER("filter", Fixity.INFIX, ZTokenType.FILTER),
	BAG_UNION("bag_union", Fixity.INFIX, ZTokenType.BAG_UNION),
	TIMES("*", Fixity.INFIX, ZTokenType.STAR),
	DIV("div", Fixity.INFIX, ZTokenType.DIV),
	MOD("mod", Fixity.INFIX, ZTokenType.MOD),
	CROSS("cross", Fixity.INFIX, ZTokenType.CROSS),

	NOT("not", Fixity.PREFIX, ZTokenType.NOT),
	NEGATE("-", Fixity.PREFIX, ZTokenType.MINUS),
	CARDINALITY("#", Fixity.PREFIX, ZTokenType.HASH),
	DOM("dom", Fixity.PREFIX, ZTokenType.DOM),
	RAN("ran", Fixity.PREFIX, ZTokenType.RAN),
	INV("inv", Fixity.PREFIX, ZTokenType.INV),
	ID("id", Fixity.PREFIX, ZTokenType.ID),
	BIGCUP("bigcup", Fixity.PREFIX, ZTokenType.BIGCUP),
	BIGCAP("bigcap", Fixity.PREFIX, ZTokenType.BIGCAP),

	INVERSE("~", Fixity.POSTFIX, ZTokenType.TILDE),
	CLOSURE("+", Fixity.POSTFIX, ZTokenType.PLUS),
	REFLEXIVE_CLOSURE("*", Fixity.POSTFIX, ZTokenType.STAR);

	public enum Fixity {
		INFIX,
		PREFIX,
		POSTFIX,
	}

	private final String spelling;
	private final Fixity fixity;
	private final ZTokenType token;

	ZOperator(String spelling, Fixity fixity, ZTokenType token) {
		this.spelling = spelling;
		this.fixity = fixity;
		this.token = token;
	}

	public String getSpelling() {
		return spelling;
	}

	public Fixity getFixity() {
		return fixity;
	}

	public ZTokenType getToken() {
		return token;
	}

	/**
	 * @return the operator with the given fixity that the token type denotes, or null if there is none
	 */
	public static ZOperator fromToken(ZTokenType type, Fixity fixity) {
		for(ZOperator op : values()) {
			if(op.token == type && op.fixity == fixity) {
				return op;
			}
		}
		return null;
	}
}
