package txt2tex;

import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

import txt2tex.model.document.Document;

/**
 * Parses many documents at once. Each file gets its own lexer, parser and symbol tables, so files are
 * processed in parallel on a fixed pool of batch.threads threads and one failure does not affect the others.
 */
public class BatchDriver {

	private static final Logger logger = Logger.getLogger("Txt2Tex Batch");

	private final Txt2TexOptions options;
	private final Txt2Tex txt2tex;

	public BatchDriver(Txt2TexOptions options) {
		this.options = options;
		this.txt2tex = new Txt2Tex(options);
	}

	/**
	 * Parses every .txt file under the directory, in path order.
	 */
	public List<BatchResult> runDirectory(Path directory) throws InterruptedException {
		Collection<File> found = FileUtils.listFiles(directory.toFile(), new String[] {"txt"}, true);
		List<Path> files = new ArrayList<>();
		for(File f : found) {
			files.add(f.toPath());
		}
		files.sort(null);
		return run(files);
	}

	/**
	 * @return one result per file, in the order given
	 */
	public List<BatchResult> run(List<Path> files) throws InterruptedException {
		logger.info("Parsing " + files.size() + " files on " + options.batchThreads + " threads");
		ExecutorService pool = Executors.newFixedThreadPool(options.batchThreads);
		try {
			List<Future<BatchResult>> futures = new ArrayList<>();
			for(Path file : files) {
				futures.add(pool.submit(() -> translate(file)));
			}
			List<BatchResult> results = new ArrayList<>();
			int failures = 0;
			for(Future<BatchResult> f : futures) {
				BatchResult result;
				try {
					result = f.get();
				} catch(ExecutionException e) {
					// translate reports every expected failure in its result
					throw new Unreachable(e);
				}
				if(!result.isSuccess()) {
					++failures;
				}
				results.add(result);
			}
			logger.info("Finished: " + (results.size() - failures) + " parsed, " + failures + " failed");
			return results;
		} finally {
			pool.shutdown();
		}
	}

	private BatchResult translate(Path file) {
		String source;
		try {
			source = FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
		} catch(IOException e) {
			logger.warning("Could not read " + file + ": " + e.getMessage());
			return BatchResult.unreadable(file, e);
		}
		try {
			Document document = txt2tex.parse(file, source);
			return BatchResult.success(file, source, document);
		} catch(Txt2TexException e) {
			logger.info(file + ": " + e.getMessage());
			return BatchResult.failure(file, source, e);
		}
	}
}
