package flowc;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public class FlowcOptions {
	public static final String VERSION = "2.0.0";

	@Option(value = "Print the version and exit", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "-r Compile the generated C++ and run it", aliases = {"-run"})
	public boolean run = false;

	@Option(value = "-s Serve the compile API over HTTP and WebSocket instead of translating a file", aliases = {"-serve"})
	public boolean serve = false;

	@Option("-c path to the configuration file, if any")
	public String configFilePath;

	@Option("-o path to write the generated C++ to")
	public String outputFilePath;

	public String inputFilePath;

	// fields extracted from the JSON configuration file
	public String buildDir;
	public String buildFile;
	public ToolchainOptions toolchain;
	public ServerOptions server;

	private final Options plumeOptions;
	private String[] remainingArgs;
	private String argumentError;

	public FlowcOptions(String[] args) {
		plumeOptions = new Options("flowc [options] program.flow", this);
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			remainingArgs = new String[0];
			argumentError = e.getMessage();
		}
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public void parse(Map<String, String> environment) throws FlowcOptionException {
		if (argumentError != null) {
			throw new FlowcOptionException(argumentError);
		}

		if (version || help) {
			return;
		}

		if (serve) {
			if (remainingArgs.length != 0) {
				throw new FlowcOptionException("no input file is expected when serving");
			}
		} else {
			if (remainingArgs.length != 1) {
				throw new FlowcOptionException("expected exactly one input file, got " + remainingArgs.length);
			}
			inputFilePath = remainingArgs[0];
		}

		JSONObject config = new JSONObject();
		if (configFilePath != null && !configFilePath.isEmpty()) {
			String s;

			try {
				s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new FlowcOptionException("Error reading configuration file: " + ex.getMessage(), ex);
			}

			try {
				config = new JSONObject(s);
			} catch (JSONException e) {
				throw new FlowcOptionException(configFilePath + ": parsing error: " + e.getMessage(), e);
			}
		}

		JSONObject build = config.optJSONObject("build");
		if (build != null) {
			buildDir = build.optString("output_dir", null);
			buildFile = build.optString("dest_file", null);
		}
		toolchain = new ToolchainOptions(config);
		server = new ServerOptions(config, environment);
	}

	/**
	 * @return where the generated C++ goes, or null for standard output
	 */
	public File getDestination() {
		if (outputFilePath != null) {
			return new File(outputFilePath);
		}
		if (buildFile == null) {
			return null;
		}
		return buildDir == null ? new File(buildFile) : new File(buildDir, buildFile);
	}
}
