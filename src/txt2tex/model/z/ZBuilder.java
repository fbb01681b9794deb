package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ZBuilder {
	private ZBuilder() {}

	public static ZIdentifier id(String name) {
		return new ZIdentifier(SourceLocation.unknown(), name);
	}

	public static List<ZIdentifier> ids(String... names) {
		ZIdentifier[] result = new ZIdentifier[names.length];
		for(int i = 0; i < names.length; ++i) {
			result[i] = id(names[i]);
		}
		return Arrays.asList(result);
	}

	public static ZNumber num(String value) {
		return new ZNumber(SourceLocation.unknown(), value);
	}

	public static ZNumber num(int value) {
		return num(Integer.toString(value));
	}

	public static ZConstant TRUE() {
		return new ZConstant(SourceLocation.unknown(), ZConstant.Kind.TRUE);
	}

	public static ZConstant FALSE() {
		return new ZConstant(SourceLocation.unknown(), ZConstant.Kind.FALSE);
	}

	public static ZConstant emptyset() {
		return new ZConstant(SourceLocation.unknown(), ZConstant.Kind.EMPTYSET);
	}

	public static ZRawText raw(String text) {
		return new ZRawText(SourceLocation.unknown(), text);
	}

	public static ZBinOp binop(ZOperator op, ZExpression lhs, ZExpression rhs) {
		return new ZBinOp(SourceLocation.unknown(), op, lhs, rhs);
	}

	// a binary operation the source wrote in parentheses
	public static ZBinOp grouped(ZOperator op, ZExpression lhs, ZExpression rhs) {
		return new ZBinOp(SourceLocation.unknown(), op, lhs, rhs, true);
	}

	public static ZUnaryOp unary(ZOperator op, ZExpression operand) {
		return new ZUnaryOp(SourceLocation.unknown(), op, operand);
	}

	public static ZComparisonChain chain(List<ZExpression> operands, ZOperator... operators) {
		return new ZComparisonChain(SourceLocation.unknown(), operands, Arrays.asList(operators));
	}

	public static List<ZExpression> exprs(ZExpression... expressions) {
		return Arrays.asList(expressions);
	}

	public static ZSubscript subscript(ZExpression base, ZExpression subscript) {
		return new ZSubscript(SourceLocation.unknown(), base, subscript);
	}

	public static ZSuperscript superscript(ZExpression base, ZExpression exponent) {
		return new ZSuperscript(SourceLocation.unknown(), base, exponent);
	}

	public static ZBinding binding(List<ZIdentifier> names, ZExpression domain) {
		return new ZBinding(SourceLocation.unknown(), names, domain);
	}

	public static ZBinding tuplePattern(List<ZIdentifier> names, ZExpression domain) {
		return new ZBinding(SourceLocation.unknown(), names, domain, true);
	}

	public static ZBinding binding(String name, ZExpression domain) {
		return binding(ids(name), domain);
	}

	public static List<ZBinding> bindings(ZBinding... bindings) {
		return Arrays.asList(bindings);
	}

	public static ZQuantified forall(List<ZBinding> bindings, ZExpression constraint, ZExpression body) {
		return new ZQuantified(SourceLocation.unknown(), ZQuantified.Kind.FORALL, bindings, constraint, body);
	}

	public static ZQuantified exists(List<ZBinding> bindings, ZExpression constraint, ZExpression body) {
		return new ZQuantified(SourceLocation.unknown(), ZQuantified.Kind.EXISTS, bindings, constraint, body);
	}

	public static ZQuantified exists1(List<ZBinding> bindings, ZExpression constraint, ZExpression body) {
		return new ZQuantified(SourceLocation.unknown(), ZQuantified.Kind.EXISTS1, bindings, constraint, body);
	}

	public static ZLambda lambda(List<ZBinding> bindings, ZExpression constraint, ZExpression body) {
		return new ZLambda(SourceLocation.unknown(), bindings, constraint, body);
	}

	public static ZDefiniteDescription mu(List<ZBinding> bindings, ZExpression constraint, ZExpression body) {
		return new ZDefiniteDescription(SourceLocation.unknown(), bindings, constraint, body);
	}

	public static ZSetLiteral set(ZExpression... elements) {
		return new ZSetLiteral(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static ZSetComprehension setComprehension(List<ZBinding> bindings, ZExpression constraint,
	                                                 ZExpression selector) {
		return new ZSetComprehension(SourceLocation.unknown(), bindings, constraint, selector);
	}

	public static ZSequenceLiteral seq(ZExpression... elements) {
		return new ZSequenceLiteral(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static ZBagLiteral bag(ZExpression... elements) {
		return new ZBagLiteral(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static ZTuple tuple(ZExpression... elements) {
		return new ZTuple(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static ZApplication apply(ZExpression function, ZExpression... arguments) {
		return new ZApplication(SourceLocation.unknown(), function, Arrays.asList(arguments));
	}

	public static ZApplication apply(String function, ZExpression... arguments) {
		return apply(id(function), arguments);
	}

	public static ZRelationalImage image(ZExpression relation, ZExpression set) {
		return new ZRelationalImage(SourceLocation.unknown(), relation, set);
	}

	public static ZInstantiation instantiate(ZExpression base, ZExpression... arguments) {
		return new ZInstantiation(SourceLocation.unknown(), base, Arrays.asList(arguments));
	}

	public static ZProjection project(ZExpression base, String field) {
		return new ZProjection(SourceLocation.unknown(), base, field);
	}

	public static ZConditional cond(ZExpression condition, ZExpression thenBranch, ZExpression elseBranch) {
		return new ZConditional(SourceLocation.unknown(), condition, thenBranch, elseBranch);
	}

	// paragraphs

	public static ZGivenType given(String... names) {
		return new ZGivenType(SourceLocation.unknown(), ids(names));
	}

	public static ZFreeTypeBranch branch(String constructor, ZExpression argument) {
		return new ZFreeTypeBranch(SourceLocation.unknown(), id(constructor), argument);
	}

	public static ZFreeType freeType(String name, ZFreeTypeBranch... branches) {
		return new ZFreeType(SourceLocation.unknown(), id(name), Arrays.asList(branches));
	}

	public static ZAbbreviation abbreviation(List<ZIdentifier> parameters, String name, ZExpression definition) {
		return new ZAbbreviation(SourceLocation.unknown(), parameters, id(name), definition);
	}

	public static ZAbbreviation abbreviation(String name, ZExpression definition) {
		return abbreviation(Collections.emptyList(), name, definition);
	}

	public static ZDeclaration decl(String name, ZExpression type) {
		return new ZDeclaration(SourceLocation.unknown(), id(name), type);
	}

	public static ZSchemaInclusion include(ZSchemaInclusion.Decoration decoration, String schema,
	                                       ZExpression... arguments) {
		return new ZSchemaInclusion(SourceLocation.unknown(), decoration, id(schema), Arrays.asList(arguments));
	}

	public static List<ZDeclarationItem> decls(ZDeclarationItem... items) {
		return Arrays.asList(items);
	}

	public static ZAxiomaticDefinition axdef(List<ZIdentifier> parameters, List<ZDeclarationItem> declarations,
	                                         ZExpression... predicates) {
		return new ZAxiomaticDefinition(SourceLocation.unknown(), parameters, declarations, Arrays.asList(predicates));
	}

	public static ZGenericDefinition gendef(List<ZIdentifier> parameters, List<ZDeclarationItem> declarations,
	                                        ZExpression... predicates) {
		return new ZGenericDefinition(SourceLocation.unknown(), parameters, declarations, Arrays.asList(predicates));
	}

	public static ZSchema schema(String name, List<ZIdentifier> parameters, List<ZDeclarationItem> declarations,
	                             ZExpression... predicates) {
		return new ZSchema(SourceLocation.unknown(), id(name), parameters, declarations, Arrays.asList(predicates));
	}
}
