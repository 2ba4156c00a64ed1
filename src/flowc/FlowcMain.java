package flowc;

import flowc.errors.IOErrorIssue;
import flowc.errors.TopLevelIssueContext;
import flowc.run.CompilationReport;
import flowc.run.CompilationSequence;
import flowc.run.CompilationService;
import flowc.run.CppToolchain;
import flowc.run.Toolchain;
import flowc.server.FlowcServer;
import flowc.trans.FlowTranspiler;
import flowc.trans.passes.parse.option.OptionParsingPass;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.logging.Logger;

public class FlowcMain {
	private static final Logger logger = Logger.getLogger(FlowcMain.class.getName());

	private final String[] cmdArgs;
	private final Map<String, String> environment;
	private final PrintStream stdout;
	private final PrintStream stderr;
	private final Toolchain toolchain;
	private FlowcServer server;

	public FlowcMain(String[] args, Map<String, String> environment, PrintStream stdout, PrintStream stderr) {
		this(args, environment, stdout, stderr, null);
	}

	// a null toolchain means the C++ compiler named by the options
	FlowcMain(String[] args, Map<String, String> environment, PrintStream stdout, PrintStream stderr,
			Toolchain toolchain) {
		this.cmdArgs = args;
		this.environment = environment;
		this.stdout = stdout;
		this.stderr = stderr;
		this.toolchain = toolchain;
	}

	public static void main(String[] args) {
		FlowcMain main = new FlowcMain(args, System.getenv(), System.out, System.err);
		int status = main.run();
		if (main.server != null) {
			FlowcServer running = main.server;
			Runtime.getRuntime().addShutdownHook(new Thread(running::stop));
			return;
		}
		if (status == 0) {
			logger.fine("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(status);
		}
	}

	// Top-level workhorse method. Returns the process exit status.
	public int run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		FlowcOptions opts = OptionParsingPass.perform(ctx, Logger.getLogger("flowc"), cmdArgs, environment);
		if (ctx.hasErrors()) {
			stderr.println(ctx.format());
			opts.printHelp();
			return 1;
		}
		if (opts.version) {
			stdout.println("flowc version " + FlowcOptions.VERSION);
			return 0;
		}
		if (opts.help) {
			opts.printHelp();
			return 0;
		}

		CompilationService service = new CompilationService(
				new CompilationSequence(), toolchain != null ? toolchain : new CppToolchain(opts.toolchain));

		if (opts.serve) {
			return serve(ctx, opts, service);
		}

		logger.fine("Opening source file " + opts.inputFilePath);
		String source;
		try {
			source = FileUtils.readFileToString(new File(opts.inputFilePath), StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			stderr.println(ctx.format());
			return 1;
		}

		String cpp;
		CompilationReport report = null;
		if (opts.run) {
			logger.info("Translating, compiling and running with " + opts.toolchain.getCompiler());
			report = service.compile(source);
			cpp = report.getCpp();
		} else {
			logger.fine("Translating to C++");
			cpp = FlowTranspiler.transpile(source);
		}

		File destination = opts.getDestination();
		if (destination == null) {
			stdout.print(cpp);
		} else {
			logger.info("Writing C++ to \"" + destination + "\"");
			try {
				FileUtils.writeStringToFile(destination, cpp, StandardCharsets.UTF_8);
			} catch (IOException e) {
				ctx.error(new IOErrorIssue(e));
				stderr.println(ctx.format());
				return 1;
			}
		}

		if (report == null) {
			return 0;
		}
		if (report.isSuccess()) {
			stdout.print(report.getOutput());
			return 0;
		}
		stderr.println(report.getOutput());
		return 1;
	}

	private int serve(TopLevelIssueContext ctx, FlowcOptions opts, CompilationService service) {
		FlowcServer candidate = new FlowcServer(opts.server, service);
		try {
			candidate.start();
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			stderr.println(ctx.format());
			return 1;
		}
		server = candidate;
		return 0;
	}

	/**
	 * @return the server started by {@code -s}, or null
	 */
	public FlowcServer getServer() {
		return server;
	}
}
