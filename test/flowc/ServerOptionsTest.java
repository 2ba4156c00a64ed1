package flowc;

import static org.junit.Assert.*;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

public class ServerOptionsTest {

	private JSONObject config;
	private Map<String, String> environment;

	@Before
	public void setup() {
		config = new JSONObject();
		JSONObject server = new JSONObject();
		server.put("port", 8080);
		server.put("threads", 2);
		config.put(ServerOptions.SERVER_FIELD, server);
		environment = new HashMap<>();
	}

	@Test
	public void testReadsConfiguration() {
		ServerOptions options = new ServerOptions(config, environment);
		assertEquals(8080, options.getPort());
		assertEquals(2, options.getThreads());
	}

	@Test
	public void testDefaults() {
		ServerOptions options = new ServerOptions(new JSONObject(), Collections.emptyMap());
		assertEquals(9602, options.getPort());
		assertEquals(9603, options.getWebSocketPort());
		assertEquals(4, options.getThreads());
		assertEquals("static", options.getStaticDir());
	}

	// the PORT environment variable wins over the configuration file
	@Test
	public void testPortFromEnvironment() {
		environment.put("PORT", " 7000 ");
		assertEquals(7000, new ServerOptions(config, environment).getPort());
	}

	@Test
	public void testWebSocketPortFromEnvironment() {
		config.getJSONObject(ServerOptions.SERVER_FIELD).put("ws_port", 8081);
		environment.put("WS_PORT", "7001");
		ServerOptions options = new ServerOptions(config, environment);
		assertEquals(7001, options.getWebSocketPort());
		assertEquals(8080, options.getPort());
	}

	@Test
	public void testBlankPortVariableIsIgnored() {
		environment.put("PORT", "");
		assertEquals(8080, new ServerOptions(config, environment).getPort());
	}

	@Test(expected = FlowcOptionException.class)
	public void testPortVariableNotANumber() {
		environment.put("PORT", "http");
		new ServerOptions(config, environment);
	}

	@Test(expected = FlowcOptionException.class)
	public void testPortOutOfRange() {
		config.getJSONObject(ServerOptions.SERVER_FIELD).put("port", 70000);
		new ServerOptions(config, environment);
	}

	@Test
	public void testWebSocketPortAndStaticDir() {
		config.getJSONObject(ServerOptions.SERVER_FIELD).put("ws_port", 8081);
		config.getJSONObject(ServerOptions.SERVER_FIELD).put("static_dir", "/srv/flow");
		ServerOptions options = new ServerOptions(config, environment);
		assertEquals(8081, options.getWebSocketPort());
		assertEquals("/srv/flow", options.getStaticDir());
	}

	@Test(expected = FlowcOptionException.class)
	public void testWebSocketPortOutOfRange() {
		config.getJSONObject(ServerOptions.SERVER_FIELD).put("ws_port", -1);
		new ServerOptions(config, environment);
	}

	@Test(expected = FlowcOptionException.class)
	public void testWebSocketPortClashesWithHttpPort() {
		config.getJSONObject(ServerOptions.SERVER_FIELD).put("ws_port", 8080);
		new ServerOptions(config, environment);
	}

	@Test
	public void testBothPortsMayBeEphemeral() {
		config.getJSONObject(ServerOptions.SERVER_FIELD).put("port", 0);
		config.getJSONObject(ServerOptions.SERVER_FIELD).put("ws_port", 0);
		assertEquals(0, new ServerOptions(config, environment).getWebSocketPort());
	}

	@Test(expected = FlowcOptionException.class)
	public void testNoThreads() {
		config.getJSONObject(ServerOptions.SERVER_FIELD).put("threads", 0);
		new ServerOptions(config, environment);
	}
}
