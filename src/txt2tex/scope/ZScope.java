package txt2tex.scope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import txt2tex.Unreachable;

/**
 * Name resolution for one document.
 *
 * The global table holds given types, free types and their constructors, abbreviations, axdef and gendef
 * names and schema names. Each schema body, generic parameter list and binder pushes a {@link ChainMap} on
 * top of it and pops it when the construct ends; names declared there are visible only inside.
 *
 * When a schema closes its components are remembered, so that a schema inclusion can bring them back into
 * scope and so that a stray reference to one of them from outside can be reported.
 */
public class ZScope {

	private final Map<String, Symbol> global = new HashMap<>();
	private final Deque<ChainMap<String, Symbol>> blocks = new ArrayDeque<>();
	private final Map<String, List<Symbol>> schemaComponents = new HashMap<>();
	// component name -> the closed schema that declared it
	private final Map<String, String> closedComponents = new HashMap<>();

	private Map<String, Symbol> current() {
		return blocks.isEmpty() ? global : blocks.peek();
	}

	public void enterBlock() {
		blocks.push(new ChainMap<>(current()));
	}

	public void exitBlock() {
		if(blocks.isEmpty()) {
			throw new Unreachable("scope block stack underflow");
		}
		blocks.pop();
	}

	public boolean isGlobal() {
		return blocks.isEmpty();
	}

	public int depth() {
		return blocks.isEmpty() ? 0 : blocks.peek().getDepth();
	}

	public void declareGlobal(Symbol symbol) {
		global.put(symbol.getName(), symbol);
		closedComponents.remove(symbol.getName());
	}

	/**
	 * Declares the symbol in the innermost block, or globally when no block is open.
	 */
	public void declareLocal(Symbol symbol) {
		current().put(symbol.getName(), symbol);
	}

	/**
	 * @return the visible symbol with the given name, innermost first, or null
	 */
	public Symbol lookup(String name) {
		return current().get(name);
	}

	public boolean isSchema(String name) {
		Symbol s = global.get(name);
		return s != null && s.getKind() == SymbolKind.SCHEMA;
	}

	/**
	 * Records the components of a schema whose body has just been parsed.
	 */
	public void closeSchema(String schema, List<Symbol> components) {
		schemaComponents.put(schema, new ArrayList<>(components));
		for(Symbol s : components) {
			if(!global.containsKey(s.getName())) {
				closedComponents.put(s.getName(), schema);
			}
		}
	}

	public List<Symbol> getSchemaComponents(String schema) {
		List<Symbol> components = schemaComponents.get(schema);
		return components == null ? Collections.emptyList() : Collections.unmodifiableList(components);
	}

	/**
	 * @return the schema a name is a component of, if the name is not otherwise visible here, or null
	 */
	public String owningSchema(String name) {
		if(lookup(name) != null) {
			return null;
		}
		return closedComponents.get(name);
	}

	/**
	 * @return the symbols declared in the innermost open block, in declaration order
	 */
	public List<Symbol> innermostDeclarations() {
		if(blocks.isEmpty()) {
			throw new Unreachable("no block is open");
		}
		return new ArrayList<>(blocks.peek().getMembers().values());
	}

	public Map<String, Symbol> getGlobals() {
		return Collections.unmodifiableMap(global);
	}
}
