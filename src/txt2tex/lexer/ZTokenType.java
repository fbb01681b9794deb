package txt2tex.lexer;

public enum ZTokenType {
	IDENTIFIER,
	NUMBER,
	// x_i and x_{...}; the value keeps the leading underscore
	SUBSCRIPT,
	SUBSCRIPT_GROUP,
	// x^{...} hugging its base
	SUPERSCRIPT_GROUP,

	// structural markers, only recognised at the start of a line
	SECTION_HEADER,
	SOLUTION_HEADER,
	PART_LABEL,
	TEXT,
	PURETEXT,
	LATEX,
	PAGEBREAK,
	METADATA,
	TRUTH_TABLE,
	EQUIV,
	ARGUE,
	PROOF,
	INFRULE,
	RULE_LINE,

	// Z paragraphs
	GIVEN,
	AXDEF,
	GENDEF,
	SCHEMA,
	ZED,
	WHERE,
	END,
	DELTA,
	XI,

	// logic
	AND,
	OR,
	NOT,
	IMPLIES,
	IFF,
	TRUE,
	FALSE,
	SHOWS,

	// binders
	FORALL,
	EXISTS,
	EXISTS1,
	MU,
	LAMBDA,

	IF,
	THEN,
	ELSE,

	// separators
	PIPE,
	BULLET,
	DOT,
	COLON,
	DOUBLE_COLON,
	SEMICOLON,
	COMMA,
	DEFINE_FREE_TYPE,
	DEFINE_ABBREVIATION,

	// brackets
	LPAREN,
	RPAREN,
	LBRACKET,
	INDEX_OPEN,
	RBRACKET,
	LBRACE,
	RBRACE,
	LANGLE,
	RANGLE,
	LBAG,
	RBAG,
	LIMAGE,
	RIMAGE,

	// comparisons
	EQUALS,
	NOT_EQUAL,
	LESS,
	GREATER,
	LESS_EQUAL,
	GREATER_EQUAL,
	ELEM,
	NOTIN,
	SUBSET,
	PSUBSET,

	// sets
	UNION,
	INTERSECT,
	SETMINUS,
	CROSS,
	BIGCUP,
	BIGCAP,
	EMPTYSET,

	// relations
	RELATION,
	MAPLET,
	DRES,
	RRES,
	NDRES,
	NRRES,
	COMP,
	OVERRIDE,
	DOM,
	RAN,
	INV,
	ID,
	TILDE,

	// function arrows
	TFUN,
	PFUN,
	TINJ,
	PINJ,
	TSURJ,
	PSURJ,
	BIJ,
	FFUN,

	// arithmetic and sequences
	PLUS,
	MINUS,
	STAR,
	DIV,
	MOD,
	HASH,
	RANGE,
	POWER,
	CONCAT,
	FILTER,
	BAG_UNION,

	NEWLINE,
	EOF,
}
