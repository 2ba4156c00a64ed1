package flowc.run;

import java.util.Objects;

/**
 * What happened when a generated program was compiled and run: the text to show the user, and whether it
 * succeeded.
 */
public class RunResult {
	private final String output;
	private final boolean success;

	public RunResult(String output, boolean success) {
		this.output = output;
		this.success = success;
	}

	public static RunResult failure(String output) {
		return new RunResult(output, false);
	}

	public String getOutput() {
		return output;
	}

	public boolean isSuccess() {
		return success;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RunResult runResult = (RunResult) o;
		return success == runResult.success &&
				Objects.equals(output, runResult.output);
	}

	@Override
	public int hashCode() {
		return Objects.hash(output, success);
	}

	@Override
	public String toString() {
		return "RunResult(" + success + ", " + output + ")";
	}
}
