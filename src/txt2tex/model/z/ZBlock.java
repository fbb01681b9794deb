package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * The shared shape of axdef, gendef and schema boxes: generic parameters, declarations, and the predicates
 * after "where".
 */
public abstract class ZBlock extends ZParagraph {

	private final List<ZIdentifier> genericParameters;
	private final List<ZDeclarationItem> declarations;
	private final List<ZExpression> predicates;

	public ZBlock(SourceLocation location, List<ZIdentifier> genericParameters,
	              List<ZDeclarationItem> declarations, List<ZExpression> predicates) {
		super(location);
		this.genericParameters = genericParameters;
		this.declarations = declarations;
		this.predicates = predicates;
	}

	public List<ZIdentifier> getGenericParameters() {
		return genericParameters;
	}

	public List<ZDeclarationItem> getDeclarations() {
		return declarations;
	}

	public List<ZExpression> getPredicates() {
		return predicates;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), genericParameters, declarations, predicates);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZBlock other = (ZBlock) obj;
		return Objects.equals(genericParameters, other.genericParameters)
				&& Objects.equals(declarations, other.declarations) && Objects.equals(predicates, other.predicates);
	}
}
