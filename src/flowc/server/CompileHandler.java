package flowc.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import flowc.run.CompilationReport;
import flowc.run.CompilationService;
import org.apache.commons.io.IOUtils;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

class CompileHandler implements HttpHandler {
	private static final Logger logger = Logger.getLogger(CompileHandler.class.getName());

	private final CompilationService service;

	CompileHandler(CompilationService service) {
		this.service = service;
	}

	@Override
	public void handle(HttpExchange exchange) throws IOException {
		if (JsonResponses.rejectUnlessExactPath(exchange)) {
			return;
		}
		if (!"POST".equals(exchange.getRequestMethod())) {
			JsonResponses.sendError(exchange, 405, "method not allowed");
			return;
		}

		String body;
		try (InputStream in = exchange.getRequestBody()) {
			body = IOUtils.toString(in, StandardCharsets.UTF_8);
		}

		String source;
		try {
			source = new JSONObject(body).getString("source");
		} catch (JSONException e) {
			logger.fine("rejected compile request: " + e.getMessage());
			JsonResponses.sendError(exchange, 400, "expected a JSON object with a string \"source\": " + e.getMessage());
			return;
		}

		CompilationReport report = service.compile(source);
		JsonResponses.sendJson(exchange, 200, report.toJSON());
	}
}
