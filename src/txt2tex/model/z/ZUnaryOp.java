package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Objects;

/**
 * A prefix (not, #, dom ...) or postfix (~, closures) operator applied to one operand.
 */
public class ZUnaryOp extends ZExpression {

	private final ZOperator op;
	private final ZExpression operand;

	public ZUnaryOp(SourceLocation location, ZOperator op, ZExpression operand) {
		super(location);
		this.op = op;
		this.operand = operand;
	}

	public ZOperator getOperation() {
		return op;
	}

	public ZExpression getOperand() {
		return operand;
	}

	public boolean isPostfix() {
		return op.getFixity() == ZOperator.Fixity.POSTFIX;
	}

	@Override
	public ZUnaryOp copy() {
		return new ZUnaryOp(getLocation(), op, operand.copy());
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(op, operand);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZUnaryOp other = (ZUnaryOp) obj;
		return op == other.op && Objects.equals(operand, other.operand);
	}
}
