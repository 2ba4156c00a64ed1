package flowc.server;

import com.sun.net.httpserver.HttpExchange;
import org.json.JSONObject;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

final class JsonResponses {
	private JsonResponses() {}

	/**
	 * Contexts match by prefix; this rejects "/healthz" reaching the "/health" handler.
	 */
	static boolean rejectUnlessExactPath(HttpExchange exchange) throws IOException {
		if (exchange.getRequestURI().getPath().equals(exchange.getHttpContext().getPath())) {
			return false;
		}
		sendText(exchange, 404, "Not Found");
		return true;
	}

	static void sendJson(HttpExchange exchange, int status, JSONObject body) throws IOException {
		send(exchange, status, "application/json", body.toString());
	}

	static void sendError(HttpExchange exchange, int status, String message) throws IOException {
		JSONObject body = new JSONObject();
		body.put("error", message);
		sendJson(exchange, status, body);
	}

	static void sendText(HttpExchange exchange, int status, String text) throws IOException {
		send(exchange, status, "text/plain; charset=utf-8", text);
	}

	private static void send(HttpExchange exchange, int status, String contentType, String text) throws IOException {
		sendBytes(exchange, status, contentType, text.getBytes(StandardCharsets.UTF_8));
	}

	static void sendBytes(HttpExchange exchange, int status, String contentType, byte[] bytes) throws IOException {
		exchange.getResponseHeaders().set("Content-Type", contentType);
		exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}
}
