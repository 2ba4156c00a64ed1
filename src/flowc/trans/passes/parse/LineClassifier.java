package flowc.trans.passes.parse;

import flowc.model.flow.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Recognises which statement form a single line of Flow is.
 *
 * Checks run in a fixed order and the first match wins. Every line is recognised as something: a line matching no
 * structured form is an expression statement.
 */
public class LineClassifier {

	public static final String COMMENT_MARKER = "--";

	private static final String DEFINE = "define ";
	private static final String RETURN = "return ";
	private static final String SAY = "say ";
	private static final String LET = "let ";
	private static final String IF = "if ";
	private static final String THEN = "then";
	private static final String LOOP = "loop ";
	private static final String TIMES = "times";
	private static final String WHILE = "while ";
	private static final String DO = "do";
	private static final String GROW = "grow ";

	private LineClassifier() {}

	/**
	 * @param line a trimmed, non-empty line
	 */
	public static FlowStatement classify(String line) {
		if (line.startsWith(COMMENT_MARKER)) {
			return new FlowComment(stripLeading(line.substring(COMMENT_MARKER.length())));
		}
		if (line.equals("end")) {
			return new FlowEnd();
		}
		if (line.startsWith(DEFINE)) {
			return parseSignature(line.substring(DEFINE.length()));
		}
		if (line.startsWith(RETURN)) {
			return new FlowReturn(line.substring(RETURN.length()));
		}
		if (line.startsWith(SAY)) {
			return new FlowSay(line.substring(SAY.length()));
		}
		if (line.startsWith(LET)) {
			String rest = line.substring(LET.length());
			int eq = rest.indexOf('=');
			if (eq == -1) {
				return new FlowIncompleteLet(rest);
			}
			return new FlowLet(strip(rest.substring(0, eq)), strip(rest.substring(eq + 1)));
		}
		if (line.startsWith(IF) && line.endsWith(THEN)) {
			return new FlowIf(between(line, IF, THEN));
		}
		if (line.equals("else")) {
			return new FlowElse();
		}
		if (line.startsWith(LOOP) && line.endsWith(TIMES)) {
			return new FlowLoop(between(line, LOOP, TIMES));
		}
		if (line.startsWith(WHILE) && line.endsWith(DO)) {
			return new FlowWhile(between(line, WHILE, DO));
		}
		if (line.startsWith(GROW)) {
			return new FlowGrow(strip(line.substring(GROW.length())));
		}
		if (line.equals("break")) {
			return new FlowBreak();
		}
		if (line.equals("continue")) {
			return new FlowContinue();
		}
		return new FlowExpressionStatement(line);
	}

	static FlowFunctionDefinition parseSignature(String signature) {
		String s = strip(signature);
		int open = s.indexOf('(');
		if (open == -1) {
			return new FlowFunctionDefinition(s, Collections.emptyList());
		}
		String name = strip(s.substring(0, open));
		// a ')' before the '(' does not close the parameter list
		int close = s.indexOf(')', open + 1);
		if (close == -1) {
			close = s.length();
		}
		List<String> params = new ArrayList<>();
		for (String param : s.substring(open + 1, close).split(",")) {
			String p = strip(param);
			if (!p.isEmpty()) {
				params.add(p);
			}
		}
		return new FlowFunctionDefinition(name, Collections.unmodifiableList(params));
	}

	// prefix and suffix never overlap for the forms that use this
	private static String between(String line, String prefix, String suffix) {
		return strip(line.substring(prefix.length(), line.length() - suffix.length()));
	}

	private static String stripLeading(String s) {
		int i = 0;
		while (i < s.length() && isWhitespace(s.charAt(i))) {
			i++;
		}
		return s.substring(i);
	}

	/**
	 * Removes leading and trailing whitespace as Unicode defines it. Unlike {@link String#trim()} this removes
	 * no-break and other wide spaces, and keeps control characters that are not whitespace.
	 */
	public static String strip(String s) {
		int start = 0;
		int end = s.length();
		while (start < end && isWhitespace(s.charAt(start))) {
			start++;
		}
		while (end > start && isWhitespace(s.charAt(end - 1))) {
			end--;
		}
		return s.substring(start, end);
	}

	// tab through carriage return, next line, and the space, line and paragraph separators
	static boolean isWhitespace(char c) {
		return (c >= '\t' && c <= '\r') || c == '\u0085' || Character.isSpaceChar(c);
	}
}
