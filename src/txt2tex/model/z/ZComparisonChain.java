package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * a < b <= c, read pairwise as (a < b) and (b <= c). There is always one more operand than operator, and at
 * least two operators; a single comparison is a plain {@link ZBinOp}.
 */
public class ZComparisonChain extends ZExpression {

	private final List<ZExpression> operands;
	private final List<ZOperator> operators;

	public ZComparisonChain(SourceLocation location, List<ZExpression> operands, List<ZOperator> operators) {
		super(location);
		if(operands.size() != operators.size() + 1) {
			throw new IllegalArgumentException("a comparison chain needs one more operand than operators");
		}
		this.operands = operands;
		this.operators = operators;
	}

	public List<ZExpression> getOperands() {
		return operands;
	}

	public List<ZOperator> getOperators() {
		return operators;
	}

	@Override
	public ZComparisonChain copy() {
		return new ZComparisonChain(getLocation(),
				operands.stream().map(ZExpression::copy).collect(Collectors.toList()), operators);
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operands, operators);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZComparisonChain other = (ZComparisonChain) obj;
		return Objects.equals(operands, other.operands) && Objects.equals(operators, other.operators);
	}
}
