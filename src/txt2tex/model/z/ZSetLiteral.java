package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;

/**
 * { a, b, c }
 */
public class ZSetLiteral extends ZEnumeration {

	public ZSetLiteral(SourceLocation location, List<ZExpression> elements) {
		super(location, elements);
	}

	@Override
	public ZSetLiteral copy() {
		return new ZSetLiteral(getLocation(), copyElements());
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
