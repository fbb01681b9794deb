package txt2tex.model.z;

public abstract class ZExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(ZIdentifier zIdentifier) throws E;
	public abstract T visit(ZNumber zNumber) throws E;
	public abstract T visit(ZConstant zConstant) throws E;
	public abstract T visit(ZRawText zRawText) throws E;
	public abstract T visit(ZBinOp zBinOp) throws E;
	public abstract T visit(ZUnaryOp zUnaryOp) throws E;
	public abstract T visit(ZComparisonChain zComparisonChain) throws E;
	public abstract T visit(ZSubscript zSubscript) throws E;
	public abstract T visit(ZSuperscript zSuperscript) throws E;
	public abstract T visit(ZQuantified zQuantified) throws E;
	public abstract T visit(ZLambda zLambda) throws E;
	public abstract T visit(ZDefiniteDescription zDefiniteDescription) throws E;
	public abstract T visit(ZSetLiteral zSetLiteral) throws E;
	public abstract T visit(ZSetComprehension zSetComprehension) throws E;
	public abstract T visit(ZSequenceLiteral zSequenceLiteral) throws E;
	public abstract T visit(ZBagLiteral zBagLiteral) throws E;
	public abstract T visit(ZTuple zTuple) throws E;
	public abstract T visit(ZApplication zApplication) throws E;
	public abstract T visit(ZRelationalImage zRelationalImage) throws E;
	public abstract T visit(ZInstantiation zInstantiation) throws E;
	public abstract T visit(ZProjection zProjection) throws E;
	public abstract T visit(ZConditional zConditional) throws E;
}
