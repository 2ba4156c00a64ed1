package flowc.run;

import org.json.JSONObject;

/**
 * One end-to-end compilation: the Flow program, the C++ it became and what running it produced.
 */
public class CompilationReport {
	private final long id;
	private final String flow;
	private final String cpp;
	private final RunResult result;

	public CompilationReport(long id, String flow, String cpp, RunResult result) {
		this.id = id;
		this.flow = flow;
		this.cpp = cpp;
		this.result = result;
	}

	public long getId() {
		return id;
	}

	public String getFlow() {
		return flow;
	}

	public String getCpp() {
		return cpp;
	}

	public String getOutput() {
		return result.getOutput();
	}

	public boolean isSuccess() {
		return result.isSuccess();
	}

	public JSONObject toJSON() {
		JSONObject json = new JSONObject();
		json.put("cpp", cpp);
		json.put("output", result.getOutput());
		json.put("success", result.isSuccess());
		json.put("compilation_id", id);
		return json;
	}
}
