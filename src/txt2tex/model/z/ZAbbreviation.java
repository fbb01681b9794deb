package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * [X] name == definition
 */
public class ZAbbreviation extends ZParagraph {

	private final List<ZIdentifier> genericParameters;
	private final ZIdentifier name;
	private final ZExpression definition;

	public ZAbbreviation(SourceLocation location, List<ZIdentifier> genericParameters, ZIdentifier name,
	                     ZExpression definition) {
		super(location);
		this.genericParameters = genericParameters;
		this.name = name;
		this.definition = definition;
	}

	public List<ZIdentifier> getGenericParameters() {
		return genericParameters;
	}

	public ZIdentifier getName() {
		return name;
	}

	public ZExpression getDefinition() {
		return definition;
	}

	@Override
	public <T, E extends Throwable> T accept(ZParagraphVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(genericParameters, name, definition);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZAbbreviation other = (ZAbbreviation) obj;
		return Objects.equals(genericParameters, other.genericParameters) && Objects.equals(name, other.name)
				&& Objects.equals(definition, other.definition);
	}
}
