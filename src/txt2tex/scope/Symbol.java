package txt2tex.scope;

import txt2tex.util.SourceLocation;

public class Symbol {
	private final String name;
	private final SymbolKind kind;
	private final SourceLocation declaredAt;

	public Symbol(String name, SymbolKind kind, SourceLocation declaredAt) {
		this.name = name;
		this.kind = kind;
		this.declaredAt = declaredAt;
	}

	public String getName() {
		return name;
	}

	public SymbolKind getKind() {
		return kind;
	}

	public SourceLocation getDeclaredAt() {
		return declaredAt;
	}

	@Override
	public String toString() {
		return "Symbol [" + kind + " " + name + "]";
	}
}
