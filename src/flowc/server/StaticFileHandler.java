package flowc.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * Serves files below a directory for every path no other context claims. Directories are served through their
 * index.html; anything missing, or outside the directory, is a plain-text 404.
 */
class StaticFileHandler implements HttpHandler {
	private static final Logger logger = Logger.getLogger(StaticFileHandler.class.getName());

	static final String INDEX = "index.html";

	private final Path root;

	StaticFileHandler(String directory) {
		this.root = Paths.get(directory).toAbsolutePath().normalize();
	}

	@Override
	public void handle(HttpExchange exchange) throws IOException {
		if (!"GET".equals(exchange.getRequestMethod())) {
			JsonResponses.sendText(exchange, 405, "Method Not Allowed");
			return;
		}

		Path file = resolve(exchange.getRequestURI().getPath());
		if (file == null) {
			JsonResponses.sendText(exchange, 404, "Not Found");
			return;
		}
		logger.fine("serving " + file);
		String contentType = URLConnection.guessContentTypeFromName(file.getFileName().toString());
		if (contentType == null) {
			contentType = "application/octet-stream";
		}
		JsonResponses.sendBytes(exchange, 200, contentType, FileUtils.readFileToByteArray(file.toFile()));
	}

	/**
	 * @return the readable file a request path names, or null
	 */
	Path resolve(String requestPath) {
		String relative = requestPath == null ? "" : requestPath;
		while (relative.startsWith("/")) {
			relative = relative.substring(1);
		}
		Path file;
		try {
			file = root.resolve(relative).normalize();
		} catch (InvalidPathException e) {
			return null;
		}
		if (!file.startsWith(root)) {
			return null;
		}
		if (Files.isDirectory(file)) {
			file = file.resolve(INDEX);
		}
		if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
			return null;
		}
		return file;
	}
}
