package flowc.run;

public interface Toolchain {
	/**
	 * Compiles and runs one generated program. Failures are reported in the result, never thrown.
	 *
	 * @param compilationId unique per call; keeps concurrent compilations apart
	 */
	RunResult compileAndRun(long compilationId, String cppSource);
}
