package txt2tex.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import txt2tex.lexer.ZToken;
import txt2tex.lexer.ZTokenType;
import txt2tex.model.z.*;
import txt2tex.scope.Symbol;
import txt2tex.scope.SymbolKind;
import txt2tex.scope.ZScope;

/**
 * Parses Z paragraphs: given types, free types, abbreviations and the three declaration blocks, and keeps
 * the symbol tables in step with what they declare.
 */
public class ZParagraphParser {

	private final ParseContext ctx;
	private final ZExpressionParser expressions;

	public ZParagraphParser(ParseContext ctx, ZExpressionParser expressions) {
		this.ctx = ctx;
		this.expressions = expressions;
	}

	/**
	 * @return true if the tokens at the cursor begin a Z paragraph
	 */
	public boolean atParagraph() {
		switch(ctx.peek().getType()) {
			case GIVEN:
			case AXDEF:
			case GENDEF:
			case SCHEMA:
				return true;
			case IDENTIFIER: {
				ZTokenType after = ctx.peek(1).getType();
				return after == ZTokenType.DEFINE_FREE_TYPE || after == ZTokenType.DEFINE_ABBREVIATION;
			}
			case LBRACKET:
				return atGenericAbbreviation();
			default:
				return false;
		}
	}

	// [X, Y] name ==
	private boolean atGenericAbbreviation() {
		int i = 1;
		while(ctx.peek(i).getType() == ZTokenType.IDENTIFIER) {
			++i;
			if(ctx.peek(i).getType() == ZTokenType.RBRACKET) {
				return ctx.peek(i + 1).getType() == ZTokenType.IDENTIFIER
						&& ctx.peek(i + 2).getType() == ZTokenType.DEFINE_ABBREVIATION;
			}
			if(ctx.peek(i).getType() != ZTokenType.COMMA) {
				return false;
			}
			++i;
		}
		return false;
	}

	public ZParagraph parseParagraph() throws ZParseException {
		switch(ctx.peek().getType()) {
			case GIVEN:
				return parseGivenType();
			case AXDEF:
			case GENDEF:
			case SCHEMA:
				return parseBlock();
			case LBRACKET:
				return parseAbbreviation();
			case IDENTIFIER:
				if(ctx.peek(1).getType() == ZTokenType.DEFINE_FREE_TYPE) {
					return parseFreeType();
				}
				if(ctx.peek(1).getType() == ZTokenType.DEFINE_ABBREVIATION) {
					return parseAbbreviation();
				}
				// fall through
			default:
				throw ctx.unexpected("a Z paragraph");
		}
	}

	private ZGivenType parseGivenType() throws ZParseException {
		ZToken start = ctx.next();
		List<ZIdentifier> names = new ArrayList<>();
		do {
			ZToken name = ctx.expect(ZTokenType.IDENTIFIER, "the name of a given type");
			names.add(new ZIdentifier(name.getLocation(), name.getValue()));
		} while(ctx.accept(ZTokenType.COMMA) != null);
		for(ZIdentifier name : names) {
			ctx.getScope().declareGlobal(new Symbol(name.getName(), SymbolKind.GIVEN_TYPE, name.getLocation()));
		}
		ZGivenType result = new ZGivenType(ctx.locationFrom(start), names);
		ctx.expectLineEnd("the given types");
		return result;
	}

	private ZFreeType parseFreeType() throws ZParseException {
		ZToken nameToken = ctx.next();
		ZIdentifier name = new ZIdentifier(nameToken.getLocation(), nameToken.getValue());
		// declared first so branches may refer to the type recursively
		ctx.getScope().declareGlobal(new Symbol(name.getName(), SymbolKind.FREE_TYPE, name.getLocation()));
		ctx.expect(ZTokenType.DEFINE_FREE_TYPE, "'::='");
		List<ZFreeTypeBranch> branches = new ArrayList<>();
		do {
			branches.add(parseBranch());
		} while(ctx.accept(ZTokenType.PIPE) != null);
		ZFreeType result = new ZFreeType(ctx.locationFrom(nameToken), name, branches);
		ctx.expectLineEnd("the free type " + name.getName());
		return result;
	}

	private ZFreeTypeBranch parseBranch() throws ZParseException {
		ZToken ctor = ctx.expect(ZTokenType.IDENTIFIER, "a constructor name");
		ZIdentifier constructor = new ZIdentifier(ctor.getLocation(), ctor.getValue());
		ZExpression argument = null;
		if(ctx.accept(ZTokenType.LANGLE) != null) {
			SeparatorFrames.Frame barrier = ctx.getFrames().push(SeparatorFrames.Kind.BARRIER, ctx.previous());
			try {
				argument = expressions.parseExpression();
				ctx.expect(ZTokenType.RANGLE, "'>' to close the constructor argument");
			} finally {
				ctx.getFrames().pop(barrier);
			}
		}
		ctx.getScope().declareGlobal(
				new Symbol(constructor.getName(), SymbolKind.CONSTRUCTOR, constructor.getLocation()));
		return new ZFreeTypeBranch(ctx.locationFrom(ctor), constructor, argument);
	}

	private ZAbbreviation parseAbbreviation() throws ZParseException {
		ZToken start = ctx.peek();
		List<ZIdentifier> parameters = parseGenericParameters();
		ZToken nameToken = ctx.expect(ZTokenType.IDENTIFIER, "the name being defined");
		ZIdentifier name = new ZIdentifier(nameToken.getLocation(), nameToken.getValue());
		ctx.expect(ZTokenType.DEFINE_ABBREVIATION, "'=='");
		ZScope scope = ctx.getScope();
		scope.enterBlock();
		ZExpression definition;
		try {
			declareParameters(parameters);
			definition = expressions.parseExpression();
		} finally {
			scope.exitBlock();
		}
		scope.declareGlobal(new Symbol(name.getName(), SymbolKind.ABBREVIATION, name.getLocation()));
		ZAbbreviation result = new ZAbbreviation(ctx.locationFrom(start), parameters, name, definition);
		ctx.expectLineEnd("the abbreviation " + name.getName());
		return result;
	}

	private List<ZIdentifier> parseGenericParameters() throws ZParseException {
		if(!ctx.at(ZTokenType.LBRACKET, ZTokenType.INDEX_OPEN)) {
			return Collections.emptyList();
		}
		ctx.next();
		List<ZIdentifier> parameters = new ArrayList<>();
		do {
			ZToken p = ctx.expect(ZTokenType.IDENTIFIER, "a generic parameter");
			parameters.add(new ZIdentifier(p.getLocation(), p.getValue()));
		} while(ctx.accept(ZTokenType.COMMA) != null);
		ctx.expect(ZTokenType.RBRACKET, "',' or ']'");
		return parameters;
	}

	private void declareParameters(List<ZIdentifier> parameters) {
		for(ZIdentifier p : parameters) {
			ctx.getScope().declareLocal(new Symbol(p.getName(), SymbolKind.GENERIC_PARAMETER, p.getLocation()));
		}
	}

	private ZBlock parseBlock() throws ZParseException {
		ZToken start = ctx.next();
		ZTokenType kind = start.getType();
		ZIdentifier name = null;
		if(kind == ZTokenType.SCHEMA) {
			ZToken nameToken = ctx.expect(ZTokenType.IDENTIFIER, "the schema name");
			name = new ZIdentifier(nameToken.getLocation(), nameToken.getValue());
		}
		List<ZIdentifier> parameters = parseGenericParameters();
		if(kind == ZTokenType.GENDEF && parameters.isEmpty()) {
			throw ctx.unexpected("generic parameters in brackets after 'gendef'");
		}
		ctx.expectLineEnd("the block header");

		SymbolKind declared = kind == ZTokenType.SCHEMA ? SymbolKind.SCHEMA_COMPONENT : SymbolKind.GLOBAL_CONSTANT;
		List<ZDeclarationItem> declarations;
		List<ZExpression> predicates = new ArrayList<>();
		List<Symbol> components = new ArrayList<>();
		ZScope scope = ctx.getScope();
		scope.enterBlock();
		try {
			declareParameters(parameters);
			declarations = parseDeclarations(declared, components);
			if(ctx.accept(ZTokenType.WHERE) != null) {
				ctx.expectLineEnd("'where'");
				ctx.skipNewlines();
				while(!ctx.at(ZTokenType.END, ZTokenType.EOF)) {
					predicates.add(expressions.parseExpression());
					ctx.expectLineEnd("a predicate");
					ctx.skipNewlines();
				}
			}
			ctx.expect(ZTokenType.END, "'end' to close the " + start.getValue() + " block");
			if(name != null) {
				scope.closeSchema(name.getName(), components);
			}
		} finally {
			scope.exitBlock();
		}

		ZBlock result;
		if(kind == ZTokenType.SCHEMA) {
			scope.declareGlobal(new Symbol(name.getName(), SymbolKind.SCHEMA, name.getLocation()));
			result = new ZSchema(ctx.locationFrom(start), name, parameters, declarations, predicates);
		} else {
			for(Symbol s : components) {
				scope.declareGlobal(s);
			}
			if(kind == ZTokenType.AXDEF) {
				result = new ZAxiomaticDefinition(ctx.locationFrom(start), parameters, declarations, predicates);
			} else {
				result = new ZGenericDefinition(ctx.locationFrom(start), parameters, declarations, predicates);
			}
		}
		ctx.expectLineEnd("'end'");
		return result;
	}

	/**
	 * Reads declaration lines up to 'where' or 'end'. Every name introduced, directly or through a schema
	 * inclusion, is declared in the open block and added to components.
	 */
	private List<ZDeclarationItem> parseDeclarations(SymbolKind kind, List<Symbol> components)
			throws ZParseException {
		List<ZDeclarationItem> items = new ArrayList<>();
		ctx.skipNewlines();
		while(!ctx.at(ZTokenType.WHERE, ZTokenType.END, ZTokenType.EOF)) {
			do {
				if(atDeclarationGroup()) {
					parseDeclarationGroup(kind, items, components);
				} else {
					items.add(parseInclusion(components));
				}
			} while(ctx.accept(ZTokenType.SEMICOLON) != null && !ctx.atLineEnd());
			ctx.expectLineEnd("a declaration");
			ctx.skipNewlines();
		}
		return items;
	}

	private boolean atDeclarationGroup() {
		if(!ctx.at(ZTokenType.IDENTIFIER)) {
			return false;
		}
		int i = 1;
		if(ctx.peek(i).getType() == ZTokenType.SUBSCRIPT) {
			++i;
		}
		ZTokenType after = ctx.peek(i).getType();
		return after == ZTokenType.COLON || after == ZTokenType.COMMA;
	}

	private void parseDeclarationGroup(SymbolKind kind, List<ZDeclarationItem> items, List<Symbol> components)
			throws ZParseException {
		List<ZIdentifier> names = new ArrayList<>();
		names.add(expressions.parseBoundName());
		while(ctx.accept(ZTokenType.COMMA) != null) {
			names.add(expressions.parseBoundName());
		}
		ctx.expect(ZTokenType.COLON, "':' and the declared type");
		ZExpression type = expressions.parseDomain();
		boolean first = true;
		for(ZIdentifier name : names) {
			items.add(new ZDeclaration(name.getLocation().combine(type.getLocation()), name,
					first ? type : type.copy()));
			first = false;
			Symbol symbol = new Symbol(name.getName(), kind, name.getLocation());
			ctx.getScope().declareLocal(symbol);
			components.add(symbol);
		}
	}

	private ZSchemaInclusion parseInclusion(List<Symbol> components) throws ZParseException {
		ZToken start = ctx.peek();
		ZSchemaInclusion.Decoration decoration = ZSchemaInclusion.Decoration.NONE;
		if(ctx.accept(ZTokenType.DELTA) != null) {
			decoration = ZSchemaInclusion.Decoration.DELTA;
		} else if(ctx.accept(ZTokenType.XI) != null) {
			decoration = ZSchemaInclusion.Decoration.XI;
		}
		ZToken nameToken = ctx.expect(ZTokenType.IDENTIFIER, "a declaration or a schema name");
		ZScope scope = ctx.getScope();
		if(!scope.isSchema(nameToken.getValue())) {
			throw new ZParseException(nameToken.getLocation(),
					"schema '" + nameToken.getValue() + "' is not declared",
					"a schema must be defined before it is included; to declare a name write '"
							+ nameToken.getValue() + " : T'");
		}
		List<ZExpression> arguments = new ArrayList<>();
		if(ctx.accept(ZTokenType.INDEX_OPEN) != null) {
			do {
				arguments.add(expressions.parseDomain());
			} while(ctx.accept(ZTokenType.COMMA) != null);
			ctx.expect(ZTokenType.RBRACKET, "',' or ']'");
		}
		for(Symbol s : scope.getSchemaComponents(nameToken.getValue())) {
			include(s, s.getName(), components);
			if(decoration != ZSchemaInclusion.Decoration.NONE) {
				include(s, s.getName() + "'", components);
			}
		}
		return new ZSchemaInclusion(ctx.locationFrom(start), decoration,
				new ZIdentifier(nameToken.getLocation(), nameToken.getValue()), arguments);
	}

	private void include(Symbol component, String name, List<Symbol> components) {
		Symbol imported = new Symbol(name, component.getKind(), component.getDeclaredAt());
		ctx.getScope().declareLocal(imported);
		components.add(imported);
	}
}
