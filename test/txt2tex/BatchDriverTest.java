package txt2tex;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class BatchDriverTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private BatchDriver driver;

	@Before
	public void setup() {
		Txt2TexOptions options = new Txt2TexOptions();
		options.batchThreads = 2;
		driver = new BatchDriver(options);
	}

	private File write(String name, String contents) throws IOException {
		File file = new File(folder.getRoot(), name);
		FileUtils.writeStringToFile(file, contents, StandardCharsets.UTF_8);
		return file;
	}

	@Test
	public void failuresAreIsolated() throws IOException, InterruptedException {
		File good = write("good.txt", "given A\nx elem A\n");
		File bad = write("bad.txt", "x = (a + b\n");
		File alsoGood = write("also-good.txt", "TEXT: fine\n");
		List<BatchResult> results = driver.run(Arrays.asList(good.toPath(), bad.toPath(), alsoGood.toPath()));

		assertThat(results.size(), is(3));
		assertTrue(results.get(0).isSuccess());
		assertThat(results.get(0).getDocument().getItems().size(), is(2));
		assertFalse(results.get(1).isSuccess());
		assertThat(results.get(1).getError().getMsg(), is("unclosed '('"));
		assertThat(results.get(1).getError().getLocation().getFile(), is(bad.toPath()));
		assertThat(results.get(1).getSource(), is("x = (a + b\n"));
		assertTrue(results.get(2).isSuccess());
	}

	@Test
	public void unreadableFile() throws InterruptedException {
		Path missing = folder.getRoot().toPath().resolve("missing.txt");
		List<BatchResult> results = driver.run(Arrays.asList(missing));
		assertFalse(results.get(0).isSuccess());
		assertThat(results.get(0).getReadError(), notNullValue());
		assertThat(results.get(0).getError(), nullValue());
		assertThat(results.get(0).getSource(), nullValue());
	}

	@Test
	public void directoryIsWalkedInPathOrder() throws IOException, InterruptedException {
		write("b.txt", "p");
		write("a.txt", "q");
		write("notes.md", "not a document");
		write("sub/c.txt", "r");
		List<BatchResult> results = driver.runDirectory(folder.getRoot().toPath());
		List<String> names = new ArrayList<>();
		for(BatchResult r : results) {
			names.add(folder.getRoot().toPath().relativize(r.getFile()).toString().replace(File.separatorChar, '/'));
			assertTrue(r.isSuccess());
		}
		assertThat(names, is(Arrays.asList("a.txt", "b.txt", "sub/c.txt")));
	}

	@Test
	public void manyFilesOnFewThreads() throws IOException, InterruptedException {
		List<Path> files = new ArrayList<>();
		for(int i = 0; i < 20; ++i) {
			files.add(write("doc" + i + ".txt", "schema S\n  x : N\nend\nforall y : N . y >= " + i + "\n").toPath());
		}
		List<BatchResult> results = driver.run(files);
		for(int i = 0; i < 20; ++i) {
			assertThat(results.get(i).getFile(), is(files.get(i)));
			assertTrue(results.get(i).isSuccess());
		}
	}
}
