package flowc.server;

import com.sun.net.httpserver.HttpServer;
import flowc.ServerOptions;
import flowc.run.CompilationService;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * HTTP and WebSocket front end for the compiler.
 *
 * <ul>
 * <li>GET /health, GET /status: liveness and the number of compilations so far</li>
 * <li>POST /api/compile: {"source": "..."} in, {"cpp", "output", "success", "compilation_id"} out</li>
 * <li>anything else: a file from the static directory, or 404</li>
 * <li>ws://host:ws_port/ws: one "compiled" frame per Flow program sent, see {@link FlowcWebSocketServer}</li>
 * </ul>
 *
 * Both listeners share one {@link CompilationService}, so compilation ids are unique across them.
 */
public class FlowcServer {
	private static final Logger logger = Logger.getLogger(FlowcServer.class.getName());

	public static final String SERVICE_NAME = "flow-chat";
	public static final double PHI = 1.618033988749895;

	private final ServerOptions options;
	private final CompilationService service;
	private HttpServer httpServer;
	private ExecutorService executor;
	private FlowcWebSocketServer webSocketServer;

	public FlowcServer(ServerOptions options, CompilationService service) {
		this.options = options;
		this.service = service;
	}

	public void start() throws IOException {
		if (httpServer != null) {
			throw new IllegalStateException("server already started");
		}
		httpServer = HttpServer.create(new InetSocketAddress(options.getPort()), 0);
		HealthHandler health = new HealthHandler(service);
		httpServer.createContext("/health", health);
		httpServer.createContext("/status", health);
		httpServer.createContext("/api/compile", new CompileHandler(service));
		httpServer.createContext("/", new StaticFileHandler(options.getStaticDir()));
		executor = Executors.newFixedThreadPool(options.getThreads());
		httpServer.setExecutor(executor);
		httpServer.start();

		FlowcWebSocketServer candidate = new FlowcWebSocketServer(options.getWebSocketPort(), service);
		try {
			candidate.startAndWait();
		} catch (IOException e) {
			candidate.shutdown();
			stop();
			throw e;
		}
		webSocketServer = candidate;
		logger.info("Listening on 0.0.0.0:" + getPort());
		logger.info("phi = " + PHI);
	}

	/**
	 * @return the port actually bound, which differs from the configured one when that was 0
	 */
	public int getPort() {
		if (httpServer == null) {
			throw new IllegalStateException("server not started");
		}
		return httpServer.getAddress().getPort();
	}

	/**
	 * @return the port the WebSocket endpoint is bound to
	 */
	public int getWebSocketPort() {
		if (webSocketServer == null) {
			throw new IllegalStateException("server not started");
		}
		return webSocketServer.getPort();
	}

	public void stop() {
		if (httpServer == null) {
			return;
		}
		if (webSocketServer != null) {
			webSocketServer.shutdown();
			webSocketServer = null;
		}
		httpServer.stop(0);
		executor.shutdown();
		try {
			if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
				executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
		httpServer = null;
		logger.info("Stopped");
	}
}
