package txt2tex;

import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings for a txt2tex run, read from a JSON file such as
 *
 * <pre>
 * {
 *   "prose": { "detect": true },
 *   "diagnostics": { "context_lines": 1, "hints": true },
 *   "batch": { "threads": 4 }
 * }
 * </pre>
 *
 * Every key is optional.
 */
public class Txt2TexOptions {

	public static final String PROSE_FIELD = "prose";
	public static final String DIAGNOSTICS_FIELD = "diagnostics";
	public static final String BATCH_FIELD = "batch";

	private static final int DEFAULT_CONTEXT_LINES = 1;
	private static final int DEFAULT_THREADS = 4;

	// try to find expressions in TEXT: paragraphs that are not written between dollar signs
	public boolean proseDetection = true;
	public int contextLines = DEFAULT_CONTEXT_LINES;
	public boolean hints = true;
	public int batchThreads = DEFAULT_THREADS;

	public Txt2TexOptions() {
	}

	public static Txt2TexOptions read(Path configFile) throws Txt2TexOptionException {
		String s;
		try {
			byte[] jsonBytes = Files.readAllBytes(configFile);
			s = new String(jsonBytes, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new Txt2TexOptionException("Error reading configuration file: " + ex.getMessage(), ex);
		}
		try {
			return fromJSON(new JSONObject(s));
		} catch (JSONException e) {
			throw new Txt2TexOptionException(configFile + ": parsing error: " + e.getMessage(), e);
		}
	}

	public static Txt2TexOptions fromJSON(JSONObject config) throws Txt2TexOptionException {
		Txt2TexOptions options = new Txt2TexOptions();
		try {
			if (config.has(PROSE_FIELD)) {
				JSONObject prose = config.getJSONObject(PROSE_FIELD);
				options.proseDetection = prose.optBoolean("detect", true);
			}
			if (config.has(DIAGNOSTICS_FIELD)) {
				JSONObject diagnostics = config.getJSONObject(DIAGNOSTICS_FIELD);
				if (diagnostics.has("context_lines")) {
					options.contextLines = diagnostics.getInt("context_lines");
				}
				options.hints = diagnostics.optBoolean("hints", true);
			}
			if (config.has(BATCH_FIELD)) {
				JSONObject batch = config.getJSONObject(BATCH_FIELD);
				if (batch.has("threads")) {
					options.batchThreads = batch.getInt("threads");
				}
			}
		} catch (JSONException e) {
			throw new Txt2TexOptionException("invalid configuration: " + e.getMessage(), e);
		}
		if (options.contextLines < 0) {
			throw new Txt2TexOptionException("diagnostics.context_lines must not be negative");
		}
		if (options.batchThreads < 1) {
			throw new Txt2TexOptionException("batch.threads must be at least 1");
		}
		return options;
	}
}
