package txt2tex.model.document;

import txt2tex.model.z.ZExpression;
import txt2tex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * TRUTH TABLE: followed by a header row of expressions and rows of T/F values, every row as wide as the
 * header.
 */
public class TruthTable extends DocumentItem {

	private final List<ZExpression> headers;
	private final List<List<Boolean>> rows;

	public TruthTable(SourceLocation location, List<ZExpression> headers, List<List<Boolean>> rows) {
		super(location);
		this.headers = headers;
		this.rows = rows;
	}

	public List<ZExpression> getHeaders() {
		return headers;
	}

	public List<List<Boolean>> getRows() {
		return rows;
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(headers, rows);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TruthTable other = (TruthTable) obj;
		return Objects.equals(headers, other.headers) && Objects.equals(rows, other.rows);
	}
}
