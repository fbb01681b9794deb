package txt2tex.lexer;

import txt2tex.util.SourceLocatable;
import txt2tex.util.SourceLocation;

public class ZToken extends SourceLocatable {

	private final String value;
	private final ZTokenType type;
	private final SourceLocation location;
	private final boolean precededBySpace;

	public ZToken(String value, ZTokenType type, SourceLocation location, boolean precededBySpace) {
		this.value = value;
		this.type = type;
		this.location = location;
		this.precededBySpace = precededBySpace;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the exact source text of this token
	 */
	public String getValue() {
		return value;
	}

	public ZTokenType getType() {
		return type;
	}

	/**
	 * @return true if whitespace (or a line start) separates this token from the one before it
	 */
	public boolean isPrecededBySpace() {
		return precededBySpace;
	}

	public int getLine() {
		return location.getStartLine();
	}

	public int getColumn() {
		return location.getStartColumn();
	}

	public boolean is(ZTokenType t) {
		return type == t;
	}

	@Override
	public String toString() {
		return "ZToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((location == null) ? 0 : location.hashCode());
		result = prime * result + ((type == null) ? 0 : type.hashCode());
		result = prime * result + ((value == null) ? 0 : value.hashCode());
		result = prime * result + (precededBySpace ? 1231 : 1237);
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ZToken other = (ZToken) obj;
		if (location == null) {
			if (other.location != null)
				return false;
		} else if (!location.equals(other.location))
			return false;
		if (type != other.type)
			return false;
		if (precededBySpace != other.precededBySpace)
			return false;
		if (value == null) {
			return other.value == null;
		} else return value.equals(other.value);
	}

}
