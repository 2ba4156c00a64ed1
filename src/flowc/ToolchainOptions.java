package flowc;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Options for compiling and running generated programs, read from the "toolchain"
// section of the JSON configuration file. Every field is optional; an absent section
// means g++ in C++17 mode with a five second limit on each step.
public class ToolchainOptions {
	public static final String TOOLCHAIN_FIELD = "toolchain";

	public static final String DEFAULT_COMPILER = "g++";
	public static final List<String> DEFAULT_FLAGS = Collections.singletonList("-std=c++17");
	public static final long DEFAULT_TIMEOUT_MILLIS = 5000;

	private final String compiler;
	private final List<String> flags;
	private final long timeoutMillis;
	private final Path scratchDir;

	public ToolchainOptions(JSONObject config) throws FlowcOptionException {
		JSONObject toolchain = config.optJSONObject(TOOLCHAIN_FIELD);
		if (toolchain == null) {
			toolchain = new JSONObject();
		}

		try {
			this.compiler = toolchain.optString("compiler", DEFAULT_COMPILER);
			if (compiler.trim().isEmpty()) {
				throw new FlowcOptionException("toolchain.compiler must not be empty");
			}

			if (toolchain.has("flags")) {
				JSONArray flags = toolchain.getJSONArray("flags");
				List<String> parsed = new ArrayList<>();
				for (int i = 0; i < flags.length(); i++) {
					parsed.add(flags.getString(i));
				}
				this.flags = Collections.unmodifiableList(parsed);
			} else {
				this.flags = DEFAULT_FLAGS;
			}

			this.timeoutMillis = toolchain.has("timeout_ms") ? toolchain.getLong("timeout_ms") : DEFAULT_TIMEOUT_MILLIS;
			if (timeoutMillis <= 0) {
				throw new FlowcOptionException("toolchain.timeout_ms must be positive, got " + timeoutMillis);
			}

			this.scratchDir = toolchain.has("scratch_dir")
					? Paths.get(toolchain.getString("scratch_dir"))
					: Paths.get(System.getProperty("java.io.tmpdir"));
		} catch (JSONException e) {
			throw new FlowcOptionException("invalid toolchain configuration: " + e.getMessage(), e);
		}
	}

	public ToolchainOptions() {
		this(new JSONObject());
	}

	public String getCompiler() {
		return compiler;
	}

	public List<String> getFlags() {
		return flags;
	}

	public long getTimeoutMillis() {
		return timeoutMillis;
	}

	public Path getScratchDir() {
		return scratchDir;
	}
}
