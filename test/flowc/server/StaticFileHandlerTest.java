package flowc.server;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class StaticFileHandlerTest {

	private Path tempDir;
	private Path root;
	private StaticFileHandler handler;

	@Before
	public void setup() throws IOException {
		tempDir = Files.createTempDirectory("flowcstatic");
		root = tempDir.resolve("static");
		FileUtils.writeStringToFile(root.resolve("index.html").toFile(), "index", StandardCharsets.UTF_8);
		FileUtils.writeStringToFile(root.resolve("docs").resolve("index.html").toFile(), "docs", StandardCharsets.UTF_8);
		FileUtils.forceMkdir(root.resolve("empty").toFile());
		FileUtils.writeStringToFile(tempDir.resolve("secret.txt").toFile(), "secret", StandardCharsets.UTF_8);
		handler = new StaticFileHandler(root.toString());
	}

	@After
	public void teardown() throws IOException {
		FileUtils.deleteDirectory(tempDir.toFile());
	}

	@Test
	public void testDirectoriesServeTheirIndex() {
		assertThat(handler.resolve("/"), is(root.resolve("index.html").toAbsolutePath()));
		assertThat(handler.resolve("/docs"), is(root.resolve("docs").resolve("index.html").toAbsolutePath()));
		assertThat(handler.resolve("/docs/"), is(root.resolve("docs").resolve("index.html").toAbsolutePath()));
	}

	@Test
	public void testMissing() {
		assertNull(handler.resolve("/nowhere"));
		assertNull(handler.resolve("/empty"));
	}

	@Test
	public void testStaysInsideTheDirectory() {
		assertNull(handler.resolve("/../secret.txt"));
		assertNull(handler.resolve("/docs/../../secret.txt"));
		assertThat(handler.resolve("/docs/../index.html"), is(root.resolve("index.html").toAbsolutePath()));
	}

	// the directory need not exist; every request is then a 404
	@Test
	public void testMissingDirectory() {
		StaticFileHandler nowhere = new StaticFileHandler(tempDir.resolve("absent").toString());
		assertNull(nowhere.resolve("/"));
		assertNull(nowhere.resolve("/index.html"));
	}
}
