package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Objects;

/**
 * name : type. "a, b : T" yields one declaration per name, each with its own copy of T.
 */
public class ZDeclaration extends ZDeclarationItem {

	private final ZIdentifier name;
	private final ZExpression type;

	public ZDeclaration(SourceLocation location, ZIdentifier name, ZExpression type) {
		super(location);
		this.name = name;
		this.type = type;
	}

	public ZIdentifier getName() {
		return name;
	}

	public ZExpression getType() {
		return type;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZDeclaration other = (ZDeclaration) obj;
		return Objects.equals(name, other.name) && Objects.equals(type, other.type);
	}
}
