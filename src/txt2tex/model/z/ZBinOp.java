package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * lhs <op> rhs
 *
 * explicitGrouping records that the source wrapped this operation in parentheses, which a renderer keeps
 * even where precedence would not need them.
 *
 */
public class ZBinOp extends ZExpression {

	private final ZOperator op;
	private final ZExpression lhs;
	private final ZExpression rhs;
	private final boolean explicitGrouping;

	public ZBinOp(SourceLocation location, ZOperator op, ZExpression lhs, ZExpression rhs) {
		this(location, op, lhs, rhs, false);
	}

	public ZBinOp(SourceLocation location, ZOperator op, ZExpression lhs, ZExpression rhs, boolean explicitGrouping) {
		super(location);
		this.op = op;
		this.lhs = lhs;
		this.rhs = rhs;
		this.explicitGrouping = explicitGrouping;
	}

	/**
	 * @param location the span of the parentheses
	 * @return this operation marked as parenthesised in the source
	 */
	public ZBinOp withExplicitGrouping(SourceLocation location) {
		return new ZBinOp(location, op, lhs, rhs, true);
	}

	@Override
	public ZBinOp copy() {
		return new ZBinOp(getLocation(), op, lhs.copy(), rhs.copy(), explicitGrouping);
	}

	public ZOperator getOperation() {
		return op;
	}

	public ZExpression getLHS() {
		return lhs;
	}

	public ZExpression getRHS() {
		return rhs;
	}

	public boolean hasExplicitGrouping() {
		return explicitGrouping;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(op, lhs, rhs, explicitGrouping);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZBinOp other = (ZBinOp) obj;
		return op == other.op && explicitGrouping == other.explicitGrouping && Objects.equals(lhs, other.lhs)
				&& Objects.equals(rhs, other.rhs);
	}

}
