package flowc.trans;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class FlowTranspilerTest {

	private static final String BANNER = "// Generated by flowc — the Flow compiler\n";

	private static int count(String haystack, String needle) {
		int n = 0;
		int i = haystack.indexOf(needle);
		while (i != -1) {
			n++;
			i = haystack.indexOf(needle, i + needle.length());
		}
		return n;
	}

	@Test
	public void testEmptyProgram() {
		assertThat(FlowTranspiler.transpile(""), is(BANNER
				+ "\n"
				+ "int main() {\n"
				+ "    return 0;\n"
				+ "}\n"));
	}

	@Test
	public void testBlankLinesOnly() {
		assertThat(FlowTranspiler.transpile("\n   \n\t\n"), is(FlowTranspiler.transpile("")));
	}

	@Test
	public void testSayHello() {
		assertThat(FlowTranspiler.transpile("say \"hello\""), is(BANNER
				+ "#include <iostream>\n"
				+ "#include <string>\n"
				+ "\n"
				+ "int main() {\n"
				+ "    std::cout << std::string(\"hello\") << std::endl;\n"
				+ "    return 0;\n"
				+ "}\n"));
	}

	@Test
	public void testLet() {
		String cpp = FlowTranspiler.transpile("let x = 42");
		assertThat(cpp, containsString("    auto x = 42;\n"));
		assertThat(cpp, not(containsString("#include")));
	}

	@Test
	public void testIncompleteLetEmitsNothing() {
		assertThat(FlowTranspiler.transpile("let x"), is(FlowTranspiler.transpile("")));
	}

	@Test
	public void testPhiAndGrowUseDifferentLiterals() {
		String cpp = FlowTranspiler.transpile("let x = phi\ngrow x");
		assertThat(cpp, containsString("    auto x = 1.6180339887498948;\n"));
		assertThat(cpp, containsString("    x *= 1.618033988749895;\n"));
	}

	@Test
	public void testPowerRequiresCmath() {
		String cpp = FlowTranspiler.transpile("let y = x ^ 2");
		assertThat(cpp, containsString("#include <cmath>\n"));
		assertThat(cpp, containsString("    auto y = std::pow(x, 2);\n"));
		assertThat(cpp, not(containsString("#include <iostream>")));
	}

	@Test
	public void testIncludesInCanonicalOrder() {
		String cpp = FlowTranspiler.transpile("let y = 2 ^ 3\nlet s = \"s\"\nsay y");
		assertThat(cpp, startsWith(BANNER
				+ "#include <iostream>\n"
				+ "#include <string>\n"
				+ "#include <cmath>\n"
				+ "\n"));
	}

	@Test
	public void testBalancedFunction() {
		String cpp = FlowTranspiler.transpile("define add(a, b)\nreturn a + b\nend\nsay add(1, 2)");
		assertThat(cpp, is(BANNER
				+ "#include <iostream>\n"
				+ "\n"
				+ "auto add(auto a, auto b) {\n"
				+ "    return a + b;\n"
				+ "}\n"
				+ "\n"
				+ "int main() {\n"
				+ "std::cout << add(1, 2) << std::endl;\n"
				+ "    return 0;\n"
				+ "}\n"));
		assertThat(count(cpp, "{"), is(count(cpp, "}")));
	}

	@Test
	public void testIfElse() {
		String cpp = FlowTranspiler.transpile("if a and b then\nsay 1\nelse\nsay 2\nend");
		assertThat(cpp, containsString(""
				+ "    if (a && b) {\n"
				+ "        std::cout << 1 << std::endl;\n"
				+ "    } else {\n"
				+ "        std::cout << 2 << std::endl;\n"
				+ "    }\n"
				+ "    return 0;\n"));
	}

	@Test
	public void testLoopsAndJumps() {
		String cpp = FlowTranspiler.transpile("loop n times\nbreak\nend\nwhile not done do\ncontinue\nend");
		assertThat(cpp, containsString(""
				+ "    for (int _i = 0; _i < n; _i++) {\n"
				+ "        break;\n"
				+ "    }\n"
				+ "    while (!done) {\n"
				+ "        continue;\n"
				+ "    }\n"));
	}

	@Test
	public void testComment() {
		assertThat(FlowTranspiler.transpile("--   note"), containsString("    // note\n"));
	}

	@Test
	public void testExpressionStatement() {
		assertThat(FlowTranspiler.transpile("tick()"), containsString("    tick();\n"));
	}

	@Test
	public void testUnmatchedEndDoesNotFail() {
		String cpp = FlowTranspiler.transpile("end\nend\nsay 1");
		assertThat(cpp, containsString("int main() {\n}\n}\nstd::cout << 1 << std::endl;\n    return 0;\n}\n"));
	}

	@Test
	public void testNestedDefineDropsOpenFunction() {
		String cpp = FlowTranspiler.transpile("define f()\nif x then\ndefine g()\nreturn 1\nend\nsay g()");
		assertThat(cpp, is(BANNER
				+ "#include <iostream>\n"
				+ "\n"
				+ "auto f() {\n"
				+ "    if (x) {\n"
				+ "auto g() {\n"
				+ "    return 1;\n"
				+ "}\n"
				+ "\n"
				+ "int main() {\n"
				+ "std::cout << g() << std::endl;\n"
				+ "    return 0;\n"
				+ "}\n"));
	}

	// a function closed inside an open main-block if leaves the rest of the if at column 0
	@Test
	public void testFunctionInsideMainBlock() {
		String cpp = FlowTranspiler.transpile("if x then\ndefine g()\nend\nsay 1\nend");
		assertThat(cpp, is(BANNER
				+ "#include <iostream>\n"
				+ "\n"
				+ "auto g() {\n"
				+ "}\n"
				+ "\n"
				+ "int main() {\n"
				+ "    if (x) {\n"
				+ "std::cout << 1 << std::endl;\n"
				+ "}\n"
				+ "    return 0;\n"
				+ "}\n"));
	}

	@Test
	public void testNonBreakingSpacesAreTrimmed() {
		assertThat(FlowTranspiler.transpile("\u00A0say 1\u2003"), is(FlowTranspiler.transpile("say 1")));
		assertThat(FlowTranspiler.transpile("let x =\u3000phi"), containsString("    auto x = 1.6180339887498948;\n"));
	}

	@Test
	public void testCarriageReturnsAreTrimmed() {
		assertThat(FlowTranspiler.transpile("let x = 1\r\nsay x\r\n"),
				is(FlowTranspiler.transpile("let x = 1\nsay x\n")));
	}

	@Test
	public void testIndentationIsIgnored() {
		assertThat(FlowTranspiler.transpile("    if x then\n\t\tsay x\n  end"),
				is(FlowTranspiler.transpile("if x then\nsay x\nend")));
	}

	@Test
	public void testDeterministic() {
		String source = "define f(x)\nreturn x ^ 2\nend\nlet a = f(3)\nsay a\ngrow a";
		assertThat(FlowTranspiler.transpile(source), is(FlowTranspiler.transpile(source)));
	}

	@Test
	public void testEndsWithSingleNewline() {
		String cpp = FlowTranspiler.transpile("say 1");
		assertTrue(cpp.endsWith("}\n"));
		assertFalse(cpp.endsWith("\n\n"));
	}
}
