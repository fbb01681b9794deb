package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * Tree ::= leaf | node<Tree cross Tree>
 */
public class ZFreeType extends ZParagraph {

	private final ZIdentifier name;
	private final List<ZFreeTypeBranch> branches;

	public ZFreeType(SourceLocation location, ZIdentifier name, List<ZFreeTypeBranch> branches) {
		super(location);
		this.name = name;
		this.branches = branches;
	}

	public ZIdentifier getName() {
		return name;
	}

	public List<ZFreeTypeBranch> getBranches() {
		return branches;
	}

	@Override
	public <T, E extends Throwable> T accept(ZParagraphVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, branches);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZFreeType other = (ZFreeType) obj;
		return Objects.equals(name, other.name) && Objects.equals(branches, other.branches);
	}
}
