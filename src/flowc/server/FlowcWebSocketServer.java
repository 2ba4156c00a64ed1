package flowc.server;

import flowc.run.CompilationReport;
import flowc.run.CompilationService;
import flowc.trans.passes.parse.LineClassifier;
import org.java_websocket.WebSocket;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.json.JSONObject;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Interactive compiler on {@code ws://host:port/ws}. Each client is greeted with an "info" frame; every non-blank
 * text frame after that is compiled and answered with a "compiled" frame. Frames from one client are answered in the
 * order they arrive.
 */
class FlowcWebSocketServer extends WebSocketServer {
	private static final Logger logger = Logger.getLogger(FlowcWebSocketServer.class.getName());

	static final String PATH = "/ws";
	static final String WELCOME = "FLOW COMPILER v2.0 \u2014 Flow-to-C++17. Type Flow code.";

	private static final long START_TIMEOUT_SECONDS = 10;

	private final CompilationService service;
	private final CountDownLatch started = new CountDownLatch(1);
	private volatile Exception startFailure;

	FlowcWebSocketServer(int port, CompilationService service) {
		super(new InetSocketAddress(port));
		this.service = service;
		setReuseAddr(true);
	}

	/**
	 * Starts the server thread and waits until the port is bound.
	 */
	void startAndWait() throws IOException {
		start();
		try {
			if (!started.await(START_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				throw new IOException("WebSocket server did not start within " + START_TIMEOUT_SECONDS + "s");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IOException("interrupted while starting the WebSocket server", e);
		}
		if (startFailure != null) {
			throw new IOException("could not start the WebSocket server: " + startFailure.getMessage(), startFailure);
		}
	}

	void shutdown() {
		try {
			stop(1000);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	@Override
	public void onStart() {
		logger.info("WebSocket endpoint ws://0.0.0.0:" + getPort() + PATH);
		started.countDown();
	}

	@Override
	public void onOpen(WebSocket conn, ClientHandshake handshake) {
		String resource = handshake.getResourceDescriptor();
		int query = resource.indexOf('?');
		if (query >= 0) {
			resource = resource.substring(0, query);
		}
		if (!PATH.equals(resource)) {
			conn.close(CloseFrame.POLICY_VALIDATION, "Not Found");
			return;
		}
		logger.fine("client connected from " + conn.getRemoteSocketAddress());

		JSONObject welcome = new JSONObject();
		welcome.put("type", "info");
		welcome.put("message", WELCOME);
		welcome.put("phi", FlowcServer.PHI);
		conn.send(welcome.toString());
	}

	@Override
	public void onMessage(WebSocket conn, String message) {
		String source = LineClassifier.strip(message);
		if (source.isEmpty()) {
			return;
		}

		CompilationReport report = service.compile(source);
		JSONObject reply = new JSONObject();
		reply.put("type", "compiled");
		reply.put("flow", report.getFlow());
		reply.put("cpp", report.getCpp());
		reply.put("output", report.getOutput());
		reply.put("compiled", report.isSuccess());
		reply.put("compilation_id", report.getId());
		if (conn.isOpen()) {
			conn.send(reply.toString());
		}
	}

	@Override
	public void onClose(WebSocket conn, int code, String reason, boolean remote) {
		logger.fine("client disconnected: " + code + " " + reason);
	}

	@Override
	public void onError(WebSocket conn, Exception ex) {
		if (conn == null && started.getCount() > 0) {
			// the port could not be bound; onStart will not follow
			startFailure = ex;
			started.countDown();
			return;
		}
		if (conn == null) {
			logger.log(Level.SEVERE, "WebSocket server failed", ex);
			return;
		}
		logger.log(Level.WARNING, "WebSocket error from " + conn.getRemoteSocketAddress(), ex);
	}
}
