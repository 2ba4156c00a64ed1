package flowc.run;

import flowc.trans.FlowTranspiler;

import java.util.logging.Logger;

/**
 * Translates a Flow program, then compiles and runs it, numbering every compilation.
 */
public class CompilationService {
	private static final Logger logger = Logger.getLogger(CompilationService.class.getName());

	private static final int SUMMARY_LENGTH = 60;

	private final CompilationSequence sequence;
	private final Toolchain toolchain;

	public CompilationService(CompilationSequence sequence, Toolchain toolchain) {
		this.sequence = sequence;
		this.toolchain = toolchain;
	}

	public CompilationReport compile(String source) {
		long id = sequence.next();
		String cpp = FlowTranspiler.transpile(source);
		RunResult result = toolchain.compileAndRun(id, cpp);
		logger.info(String.format("[flow #%d] %s %s", id, result.isSuccess() ? "ok" : "failed", summarize(source)));
		return new CompilationReport(id, source, cpp, result);
	}

	public long getCompilationCount() {
		return sequence.current();
	}

	static String summarize(String source) {
		String firstLine = source.split("\n", 2)[0].trim();
		if (firstLine.length() > SUMMARY_LENGTH) {
			return firstLine.substring(0, SUMMARY_LENGTH);
		}
		return firstLine;
	}
}
