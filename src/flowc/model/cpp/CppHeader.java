package flowc.model.cpp;

/**
 * Standard library headers a generated program may need. Declaration order is the order in which include lines are
 * written.
 */
public enum CppHeader {
	IOSTREAM("iostream"),
	STRING("string"),
	CMATH("cmath");

	private final String name;

	CppHeader(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public String toIncludeLine() {
		return "#include <" + name + ">";
	}
}
