package txt2tex;

import java.io.IOException;
import java.nio.file.Path;

import txt2tex.model.document.Document;

/**
 * The outcome for one file of a batch: a document, a lexer or parser failure, or a failure to read the file.
 */
public class BatchResult {

	private final Path file;
	private final String source;
	private final Document document;
	private final Txt2TexException error;
	private final IOException readError;

	private BatchResult(Path file, String source, Document document, Txt2TexException error,
	                    IOException readError) {
		this.file = file;
		this.source = source;
		this.document = document;
		this.error = error;
		this.readError = readError;
	}

	public static BatchResult success(Path file, String source, Document document) {
		return new BatchResult(file, source, document, null, null);
	}

	public static BatchResult failure(Path file, String source, Txt2TexException error) {
		return new BatchResult(file, source, null, error, null);
	}

	public static BatchResult unreadable(Path file, IOException readError) {
		return new BatchResult(file, null, null, null, readError);
	}

	public boolean isSuccess() {
		return document != null;
	}

	public Path getFile() {
		return file;
	}

	/**
	 * @return the text of the file, or null if it could not be read
	 */
	public String getSource() {
		return source;
	}

	public Document getDocument() {
		return document;
	}

	public Txt2TexException getError() {
		return error;
	}

	public IOException getReadError() {
		return readError;
	}
}
