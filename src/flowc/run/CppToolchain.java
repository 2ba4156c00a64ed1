package flowc.run;

import flowc.ToolchainOptions;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Compiles generated C++ with an external compiler and runs the resulting binary.
 *
 * Each compilation works in its own directory under the scratch directory, named after the compilation id, and
 * the directory is removed afterwards. Both the compile and the run step are killed if they exceed the configured
 * timeout.
 */
public class CppToolchain implements Toolchain {
	private static final Logger logger = Logger.getLogger(CppToolchain.class.getName());

	static final String SOURCE_FILE = "program.cpp";
	static final String BINARY_FILE = "program";

	private final ToolchainOptions options;

	public CppToolchain(ToolchainOptions options) {
		this.options = options;
	}

	private static class ProcessOutcome {
		final boolean timedOut;
		final int exitCode;
		final String stdout;
		final String stderr;

		ProcessOutcome(boolean timedOut, int exitCode, String stdout, String stderr) {
			this.timedOut = timedOut;
			this.exitCode = exitCode;
			this.stdout = stdout;
			this.stderr = stderr;
		}
	}

	public Path workingDirectory(long compilationId) {
		return options.getScratchDir().resolve("flowc-" + compilationId);
	}

	@Override
	public RunResult compileAndRun(long compilationId, String cppSource) {
		Path workDir = workingDirectory(compilationId);
		Path sourcePath = workDir.resolve(SOURCE_FILE);
		Path binaryPath = workDir.resolve(BINARY_FILE);

		try {
			Files.createDirectories(workDir);
			FileUtils.writeStringToFile(sourcePath.toFile(), cppSource, StandardCharsets.UTF_8);
		} catch (IOException e) {
			logger.warning(String.format("Could not write %s: %s", sourcePath, e.getMessage()));
			expunge(workDir);
			return RunResult.failure("Failed to write temp file");
		}

		try {
			List<String> compileCommand = new ArrayList<>();
			compileCommand.add(options.getCompiler());
			compileCommand.addAll(options.getFlags());
			compileCommand.add("-o");
			compileCommand.add(binaryPath.toString());
			compileCommand.add(sourcePath.toString());

			logger.fine("Compiling: " + String.join(" ", compileCommand));
			ProcessOutcome compile;
			try {
				compile = execute(compileCommand, workDir, "compile");
			} catch (IOException e) {
				logger.warning(String.format("Could not start %s: %s", options.getCompiler(), e.getMessage()));
				return RunResult.failure(options.getCompiler() + " not found");
			}
			if (compile.timedOut) {
				return timedOut();
			}
			if (compile.exitCode != 0) {
				return RunResult.failure("Compilation error:\n" + compile.stderr);
			}

			logger.fine("Running: " + binaryPath);
			ProcessOutcome run;
			try {
				run = execute(Collections.singletonList(binaryPath.toString()), workDir, "run");
			} catch (IOException e) {
				return RunResult.failure("Failed to run: " + e.getMessage());
			}
			if (run.timedOut) {
				return timedOut();
			}
			if (run.exitCode != 0) {
				return RunResult.failure("Runtime error:\n" + run.stderr);
			}
			return new RunResult(run.stdout.isEmpty() ? "(no output)" : run.stdout, true);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return RunResult.failure("Interrupted");
		} finally {
			expunge(workDir);
		}
	}

	private RunResult timedOut() {
		return RunResult.failure("Timed out after " + options.getTimeoutMillis() + " ms");
	}

	// stdout and stderr go to files so neither pipe can fill up and block the child
	private ProcessOutcome execute(List<String> command, Path workDir, String step)
			throws IOException, InterruptedException {
		File stdoutFile = workDir.resolve(step + ".out").toFile();
		File stderrFile = workDir.resolve(step + ".err").toFile();
		ProcessBuilder pb = new ProcessBuilder(command)
				.directory(workDir.toFile())
				.redirectOutput(stdoutFile)
				.redirectError(stderrFile);
		Process p = pb.start();
		if (!p.waitFor(options.getTimeoutMillis(), TimeUnit.MILLISECONDS)) {
			p.destroyForcibly();
			p.waitFor();
			logger.warning(String.format("%s step exceeded %d ms", step, options.getTimeoutMillis()));
			return new ProcessOutcome(true, -1, "", "");
		}
		return new ProcessOutcome(
				false,
				p.exitValue(),
				FileUtils.readFileToString(stdoutFile, StandardCharsets.UTF_8),
				FileUtils.readFileToString(stderrFile, StandardCharsets.UTF_8));
	}

	private static void expunge(Path workDir) {
		try {
			FileUtils.deleteDirectory(workDir.toFile());
		} catch (IOException e) {
			logger.warning("could not delete " + workDir + "; check your scratch directory");
		}
	}
}
