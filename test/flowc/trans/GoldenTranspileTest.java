package flowc.trans;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.io.FileUtils;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

// every examples/flow/X.flow must translate to exactly examples/flow/X.cpp
@RunWith(Parameterized.class)
public class GoldenTranspileTest {

	private static final Path EXAMPLES = Paths.get("examples", "flow");

	@Parameters(name = "{0}")
	public static List<Object[]> data() throws IOException {
		try (Stream<Path> files = Files.list(EXAMPLES)) {
			return files
					.filter(p -> p.getFileName().toString().endsWith(".flow"))
					.sorted()
					.map(p -> new Object[] {p.getFileName().toString()})
					.collect(Collectors.toList());
		}
	}

	private final String fileName;

	public GoldenTranspileTest(String fileName) {
		this.fileName = fileName;
	}

	@Test
	public void test() throws IOException {
		String source = FileUtils.readFileToString(EXAMPLES.resolve(fileName).toFile(), StandardCharsets.UTF_8);
		String expectedName = fileName.substring(0, fileName.length() - ".flow".length()) + ".cpp";
		String expected = FileUtils.readFileToString(EXAMPLES.resolve(expectedName).toFile(), StandardCharsets.UTF_8);

		assertThat(FlowTranspiler.transpile(source), is(expected));
	}
}
