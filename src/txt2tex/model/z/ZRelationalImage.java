package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Objects;

/**
 * R(| S |)
 */
public class ZRelationalImage extends ZExpression {

	private final ZExpression relation;
	private final ZExpression set;

	public ZRelationalImage(SourceLocation location, ZExpression relation, ZExpression set) {
		super(location);
		this.relation = relation;
		this.set = set;
	}

	public ZExpression getRelation() {
		return relation;
	}

	public ZExpression getSet() {
		return set;
	}

	@Override
	public ZRelationalImage copy() {
		return new ZRelationalImage(getLocation(), relation.copy(), set.copy());
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(relation, set);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZRelationalImage other = (ZRelationalImage) obj;
		return Objects.equals(relation, other.relation) && Objects.equals(set, other.set);
	}
}
