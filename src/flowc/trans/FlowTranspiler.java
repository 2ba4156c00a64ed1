package flowc.trans;

import flowc.trans.passes.codegen.cpp.CppAssembler;
import flowc.trans.passes.codegen.cpp.CppStatementEmitter;
import flowc.trans.passes.codegen.cpp.IncludeSet;
import flowc.trans.passes.codegen.cpp.ScopeTracker;
import flowc.trans.passes.parse.LineClassifier;

/**
 * Translates a Flow program into a self-contained C++17 translation unit.
 *
 * Translation is a single pass over the lines of the input. It holds no state between calls, performs no I/O and
 * never fails: input it does not understand is carried through into the output as-is.
 */
public class FlowTranspiler {

	private FlowTranspiler() {}

	public static String transpile(String source) {
		IncludeSet includes = new IncludeSet();
		ScopeTracker scope = new ScopeTracker();
		CppStatementEmitter emitter = new CppStatementEmitter(scope, includes);

		for (String rawLine : source.split("\n", -1)) {
			String line = LineClassifier.strip(rawLine);
			if (line.isEmpty()) {
				continue;
			}
			LineClassifier.classify(line).accept(emitter);
		}

		return CppAssembler.perform(includes, scope);
	}
}
