package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Objects;

public class ZConditional extends ZExpression {

	private final ZExpression condition;
	private final ZExpression thenBranch;
	private final ZExpression elseBranch;

	public ZConditional(SourceLocation location, ZExpression condition, ZExpression thenBranch,
	                    ZExpression elseBranch) {
		super(location);
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public ZExpression getCondition() {
		return condition;
	}

	public ZExpression getThen() {
		return thenBranch;
	}

	public ZExpression getElse() {
		return elseBranch;
	}

	@Override
	public ZConditional copy() {
		return new ZConditional(getLocation(), condition.copy(), thenBranch.copy(), elseBranch.copy());
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, thenBranch, elseBranch);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZConditional other = (ZConditional) obj;
		return Objects.equals(condition, other.condition) && Objects.equals(thenBranch, other.thenBranch)
				&& Objects.equals(elseBranch, other.elseBranch);
	}
}
