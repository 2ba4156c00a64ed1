package flowc.trans.passes.codegen.cpp;

import flowc.model.cpp.CppHeader;
import flowc.trans.passes.parse.LineClassifier;

import java.util.regex.Pattern;

/**
 * Renders a Flow expression as C++ expression text.
 *
 * There is no expression parser: a handful of whole-expression forms are recognised in a fixed order and everything
 * else passes through with the boolean keywords substituted. Malformed input produces malformed output.
 */
public class ExpressionTranslator {

	/**
	 * Value of the {@code phi} keyword, 17 significant digits.
	 */
	public static final String PHI = "1.6180339887498948";

	private static final String POWER = " ^ ";

	// what a 64-bit float parser accepts; Double.parseDouble is looser (1d, 0x1p3, surrounding whitespace)
	private static final Pattern NUMERAL = Pattern.compile(
			"[+-]?(inf|infinity|nan|[0-9]+(\\.[0-9]*)?([eE][+-]?[0-9]+)?|\\.[0-9]+([eE][+-]?[0-9]+)?)",
			Pattern.CASE_INSENSITIVE);

	private final IncludeSet includes;

	public ExpressionTranslator(IncludeSet includes) {
		this.includes = includes;
	}

	public String translate(String expr) {
		String s = LineClassifier.strip(expr);

		if (s.equals("phi")) {
			return PHI;
		}

		if (s.startsWith("\"") && s.endsWith("\"")) {
			includes.require(CppHeader.STRING);
			return "std::string(" + s + ")";
		}

		if (s.equals("true") || s.equals("false")) {
			return s;
		}

		if (isNumeral(s)) {
			return s;
		}

		int power = s.indexOf(POWER);
		if (power != -1) {
			includes.require(CppHeader.CMATH);
			String base = translate(s.substring(0, power));
			String exponent = translate(s.substring(power + POWER.length()));
			return "std::pow(" + base + ", " + exponent + ")";
		}

		return s.replace(" and ", " && ")
				.replace(" or ", " || ")
				.replace("not ", "!");
	}

	static boolean isNumeral(String s) {
		return NUMERAL.matcher(s).matches();
	}
}
