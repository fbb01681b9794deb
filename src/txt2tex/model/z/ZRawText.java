package txt2tex.model.z;

import txt2tex.util.SourceLocation;

import java.util.Objects;

/**
 * Text passed through unparsed, such as the contents of x^{...} or x_{...}.
 */
public class ZRawText extends ZExpression {
	private final String text;

	public ZRawText(SourceLocation location, String text) {
		super(location);
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public ZRawText copy() {
		return new ZRawText(getLocation(), text);
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZRawText other = (ZRawText) obj;
		return Objects.equals(text, other.text);
	}
}
