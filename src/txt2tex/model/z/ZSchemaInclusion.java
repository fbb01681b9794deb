package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A schema named in another schema's declarations, optionally as Delta S or Xi S, with optional generic
 * arguments S[N].
 */
public class ZSchemaInclusion extends ZDeclarationItem {

	public enum Decoration {
		NONE,
		DELTA,
		XI,
	}

	private final Decoration decoration;
	private final ZIdentifier schema;
	private final List<ZExpression> arguments;

	public ZSchemaInclusion(SourceLocation location, Decoration decoration, ZIdentifier schema,
	                        List<ZExpression> arguments) {
		super(location);
		this.decoration = decoration;
		this.schema = schema;
		this.arguments = arguments;
	}

	public Decoration getDecoration() {
		return decoration;
	}

	public ZIdentifier getSchema() {
		return schema;
	}

	public List<ZExpression> getArguments() {
		return arguments;
	}

	@Override
	public int hashCode() {
		return Objects.hash(decoration, schema, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZSchemaInclusion other = (ZSchemaInclusion) obj;
		return decoration == other.decoration && Objects.equals(schema, other.schema)
				&& Objects.equals(arguments, other.arguments);
	}
}
