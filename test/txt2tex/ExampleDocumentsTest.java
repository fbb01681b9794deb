package txt2tex;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import txt2tex.model.document.Document;

@RunWith(Parameterized.class)
public class ExampleDocumentsTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				// name, top-level items, metadata entries
				{"logic.txt", 1, 2},
				{"library.txt", 2, 1},
				{"sets.txt", 1, 0},
		});
	}

	private final String name;
	private final int items;
	private final int metadata;

	public ExampleDocumentsTest(String name, int items, int metadata) {
		this.name = name;
		this.items = items;
		this.metadata = metadata;
	}

	private String read() throws IOException {
		try(InputStream in = getClass().getResourceAsStream("/documents/" + name)) {
			assertThat("missing fixture " + name, in, notNullValue());
			return IOUtils.toString(in, StandardCharsets.UTF_8);
		}
	}

	@Test
	public void test() throws IOException, Txt2TexException {
		Document d = new Txt2Tex().parse(Paths.get(name), read());
		assertThat(d.getItems().size(), is(items));
		assertThat(d.getMetadata().size(), is(metadata));
		// the outline is stable across a second parse
		assertThat(new Txt2Tex().parse(Paths.get(name), read()).toString(), is(d.toString()));
	}

	@Test
	public void batch() throws IOException, InterruptedException, URISyntaxException {
		Path directory = Paths.get(getClass().getResource("/documents").toURI());
		List<BatchResult> results = new BatchDriver(new Txt2TexOptions()).runDirectory(directory);
		for(BatchResult result : results) {
			assertTrue(result.getFile() + " failed", result.isSuccess());
		}
		assertThat(results.size(), is(3));
	}
}
