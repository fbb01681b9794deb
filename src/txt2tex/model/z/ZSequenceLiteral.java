package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;

/**
 * <a, b, c>, or with the Unicode angle brackets
 */
public class ZSequenceLiteral extends ZEnumeration {

	public ZSequenceLiteral(SourceLocation location, List<ZExpression> elements) {
		super(location, elements);
	}

	@Override
	public ZSequenceLiteral copy() {
		return new ZSequenceLiteral(getLocation(), copyElements());
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
