package flowc.trans.passes.codegen.cpp;

import flowc.formatters.IndentingWriter;
import flowc.model.cpp.CppHeader;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Puts the pieces of a translation together into one compilable unit, wrapping the main block in {@code int main()}.
 */
public class CppAssembler {

	public static final String BANNER = "// Generated by flowc — the Flow compiler";

	private CppAssembler() {}

	public static String perform(IncludeSet includes, ScopeTracker scope) {
		StringWriter w = new StringWriter();
		try (IndentingWriter out = new IndentingWriter(w)) {
			out.write(BANNER);
			out.newLine();
			for (CppHeader header : includes.getRequired()) {
				out.write(header.toIncludeLine());
				out.newLine();
			}
			out.newLine();
			for (String line : scope.getFunctionLines()) {
				out.writeVerbatimLine(line);
			}
			out.write("int main() {");
			out.newLine();
			for (String line : scope.getMainLines()) {
				out.writeVerbatimLine(line);
			}
			try (IndentingWriter.Indent ignored = out.indent()) {
				out.write("return 0;");
				out.newLine();
			}
			out.write("}");
			out.newLine();
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}
}
