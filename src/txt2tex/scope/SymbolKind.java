package txt2tex.scope;

public enum SymbolKind {
	GIVEN_TYPE,
	FREE_TYPE,
	CONSTRUCTOR,
	ABBREVIATION,
	// names declared by axdef and gendef
	GLOBAL_CONSTANT,
	SCHEMA,
	SCHEMA_COMPONENT,
	GENERIC_PARAMETER,
	BOUND_VARIABLE,
}
