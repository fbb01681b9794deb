package txt2tex;

import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

import txt2tex.formatters.DiagnosticFormatter;
import txt2tex.lexer.ZLexer;
import txt2tex.lexer.ZToken;
import txt2tex.model.document.Document;
import txt2tex.model.z.ZExpression;
import txt2tex.parser.ZParser;

/**
 * Lexes and parses one document. Instances hold only their options and may be shared between threads.
 */
public class Txt2Tex {

	private static final Logger logger = Logger.getLogger("Txt2Tex");

	private final Txt2TexOptions options;

	public Txt2Tex() {
		this(new Txt2TexOptions());
	}

	public Txt2Tex(Txt2TexOptions options) {
		this.options = options;
	}

	public Txt2TexOptions getOptions() {
		return options;
	}

	/**
	 * @param file where the source came from, used in source locations; may be null
	 */
	public Document parse(Path file, String source) throws Txt2TexException {
		String name = file == null ? "<input>" : file.toString();
		logger.info("Lexing " + name);
		List<ZToken> tokens = new ZLexer(file, source).readTokens();
		logger.info("Parsing " + name + " (" + tokens.size() + " tokens)");
		return ZParser.readDocument(tokens, options.proseDetection);
	}

	public Document parse(String source) throws Txt2TexException {
		return parse(null, source);
	}

	public ZExpression parseExpression(String source) throws Txt2TexException {
		return ZParser.readExpression(ZLexer.tokenize(source));
	}

	/**
	 * Renders a failure from {@link #parse} as the user should see it.
	 */
	public String describe(Txt2TexException e, String source) {
		return new DiagnosticFormatter(options.contextLines, options.hints).format(e, source);
	}
}
