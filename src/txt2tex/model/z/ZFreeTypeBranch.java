package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Objects;

/**
 * One alternative of a free type: a constant, or a constructor with its argument domain as in node<T cross T>.
 */
public class ZFreeTypeBranch extends ZNode {

	private final ZIdentifier constructor;
	private final ZExpression argument;

	public ZFreeTypeBranch(SourceLocation location, ZIdentifier constructor, ZExpression argument) {
		super(location);
		this.constructor = constructor;
		this.argument = argument;
	}

	public ZIdentifier getConstructor() {
		return constructor;
	}

	/**
	 * @return the argument domain, or null for a constant
	 */
	public ZExpression getArgument() {
		return argument;
	}

	@Override
	public <T, E extends Throwable> T accept(ZNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(constructor, argument);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZFreeTypeBranch other = (ZFreeTypeBranch) obj;
		return Objects.equals(constructor, other.constructor) && Objects.equals(argument, other.argument);
	}
}
