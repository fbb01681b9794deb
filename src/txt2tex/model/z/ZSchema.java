package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class ZSchema extends ZBlock {

	private final ZIdentifier name;

	public ZSchema(SourceLocation location, ZIdentifier name, List<ZIdentifier> genericParameters,
	               List<ZDeclarationItem> declarations, List<ZExpression> predicates) {
		super(location, genericParameters, declarations, predicates);
		this.name = name;
	}

	public ZIdentifier getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(ZParagraphVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 31 * super.hashCode() + Objects.hashCode(name);
	}

	@Override
	public boolean equals(Object obj) {
		return super.equals(obj) && Objects.equals(name, ((ZSchema) obj).name);
	}
}
