package txt2tex;

public class Txt2TexOptionException extends Exception {

	public Txt2TexOptionException(String message) {
		super(message);
	}

	public Txt2TexOptionException(String message, Throwable cause) {
		super(message, cause);
	}
}
