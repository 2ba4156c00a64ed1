package flowc;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.Map;

/**
 * Options for the HTTP and WebSocket services, from the "server" section of the configuration file. The {@code PORT}
 * and {@code WS_PORT} environment variables take precedence over the configured ports.
 */
public class ServerOptions {
	public static final String SERVER_FIELD = "server";
	public static final String PORT_VARIABLE = "PORT";
	public static final String WS_PORT_VARIABLE = "WS_PORT";

	public static final int DEFAULT_PORT = 9602;
	public static final int DEFAULT_WS_PORT = 9603;
	public static final int DEFAULT_THREADS = 4;
	public static final String DEFAULT_STATIC_DIR = "static";

	private final int port;
	private final int wsPort;
	private final int threads;
	private final String staticDir;

	public ServerOptions(JSONObject config, Map<String, String> environment) throws FlowcOptionException {
		JSONObject server = config.optJSONObject(SERVER_FIELD);
		if (server == null) {
			server = new JSONObject();
		}

		try {
			this.port = portFrom(environment, PORT_VARIABLE,
					server.has("port") ? server.getInt("port") : DEFAULT_PORT);
			this.wsPort = portFrom(environment, WS_PORT_VARIABLE,
					server.has("ws_port") ? server.getInt("ws_port") : DEFAULT_WS_PORT);
			this.threads = server.has("threads") ? server.getInt("threads") : DEFAULT_THREADS;
			this.staticDir = server.has("static_dir") ? server.getString("static_dir") : DEFAULT_STATIC_DIR;
		} catch (JSONException e) {
			throw new FlowcOptionException("invalid server configuration: " + e.getMessage(), e);
		}

		// port 0 asks the OS for any free port
		if (port < 0 || port > 65535) {
			throw new FlowcOptionException("server port out of range: " + port);
		}
		if (wsPort < 0 || wsPort > 65535) {
			throw new FlowcOptionException("server.ws_port out of range: " + wsPort);
		}
		if (port != 0 && port == wsPort) {
			throw new FlowcOptionException("server.ws_port must differ from the HTTP port " + port);
		}
		if (threads <= 0) {
			throw new FlowcOptionException("server.threads must be positive, got " + threads);
		}
	}

	private static int portFrom(Map<String, String> environment, String variable, int configured)
			throws FlowcOptionException {
		String fromEnvironment = environment.get(variable);
		if (fromEnvironment == null || fromEnvironment.trim().isEmpty()) {
			return configured;
		}
		try {
			return Integer.parseInt(fromEnvironment.trim());
		} catch (NumberFormatException e) {
			throw new FlowcOptionException(variable + " is not a port number: " + fromEnvironment, e);
		}
	}

	public int getPort() {
		return port;
	}

	public int getWebSocketPort() {
		return wsPort;
	}

	public int getThreads() {
		return threads;
	}

	/**
	 * @return the directory served for paths no other route claims, relative to the working directory unless absolute
	 */
	public String getStaticDir() {
		return staticDir;
	}
}
