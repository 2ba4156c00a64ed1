package flowc.trans.passes.codegen.cpp;

import flowc.model.cpp.CppHeader;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Records which headers the generated program requires. Headers are only ever added during one translation.
 */
public class IncludeSet {
	private final EnumSet<CppHeader> required = EnumSet.noneOf(CppHeader.class);

	public void require(CppHeader header) {
		required.add(header);
	}

	public boolean isRequired(CppHeader header) {
		return required.contains(header);
	}

	/**
	 * @return the required headers, in canonical include order
	 */
	public Set<CppHeader> getRequired() {
		return Collections.unmodifiableSet(required);
	}
}
