package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;

/**
 * [[a, a, b]]
 */
public class ZBagLiteral extends ZEnumeration {

	public ZBagLiteral(SourceLocation location, List<ZExpression> elements) {
		super(location, elements);
	}

	@Override
	public ZBagLiteral copy() {
		return new ZBagLiteral(getLocation(), copyElements());
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
