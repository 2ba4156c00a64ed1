package flowc.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import flowc.FlowcOptions;
import flowc.run.CompilationService;
import org.json.JSONObject;

import java.io.IOException;

class HealthHandler implements HttpHandler {
	private final CompilationService service;

	HealthHandler(CompilationService service) {
		this.service = service;
	}

	@Override
	public void handle(HttpExchange exchange) throws IOException {
		if (JsonResponses.rejectUnlessExactPath(exchange)) {
			return;
		}
		if (!"GET".equals(exchange.getRequestMethod())) {
			JsonResponses.sendError(exchange, 405, "method not allowed");
			return;
		}
		JSONObject body = new JSONObject();
		body.put("status", "alive");
		body.put("service", FlowcServer.SERVICE_NAME);
		body.put("version", FlowcOptions.VERSION);
		body.put("phi", FlowcServer.PHI);
		body.put("compilations", service.getCompilationCount());
		JsonResponses.sendJson(exchange, 200, body);
	}
}
