package flowc.trans.passes.codegen.cpp;

import java.util.List;

/**
 * One open block: what kind it is and the buffer its closing line goes to.
 */
public class ScopeFrame {
	private final ScopeKind kind;
	private final List<String> lines;

	public ScopeFrame(ScopeKind kind, List<String> lines) {
		this.kind = kind;
		this.lines = lines;
	}

	public ScopeKind getKind() {
		return kind;
	}

	public List<String> getLines() {
		return lines;
	}
}
