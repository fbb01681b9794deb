package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;

/**
 * (a, b), at least two elements
 */
public class ZTuple extends ZEnumeration {

	public ZTuple(SourceLocation location, List<ZExpression> elements) {
		super(location, elements);
	}

	@Override
	public ZTuple copy() {
		return new ZTuple(getLocation(), copyElements());
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
