package txt2tex;

/**
 * Thrown where the parser or a formatter reaches a state its own checks should have excluded.
 */
public class Unreachable extends RuntimeException {
	public Unreachable() {
		super("unreachable");
	}

	public Unreachable(String what) {
		super("unreachable: " + what);
	}

	public Unreachable(Exception e) {
		super("unreachable", e);
	}
}
