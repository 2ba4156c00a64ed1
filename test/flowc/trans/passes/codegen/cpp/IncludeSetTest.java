package flowc.trans.passes.codegen.cpp;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import flowc.model.cpp.CppHeader;

public class IncludeSetTest {

	// include lines come out in canonical order regardless of the order headers were required in
	@Test
	public void testCanonicalOrder() {
		IncludeSet includes = new IncludeSet();
		includes.require(CppHeader.CMATH);
		includes.require(CppHeader.IOSTREAM);
		includes.require(CppHeader.STRING);
		includes.require(CppHeader.CMATH);

		List<String> lines = new ArrayList<>();
		for (CppHeader header : includes.getRequired()) {
			lines.add(header.toIncludeLine());
		}
		assertEquals(Arrays.asList("#include <iostream>", "#include <string>", "#include <cmath>"), lines);
	}

	@Test
	public void testNothingRequired() {
		IncludeSet includes = new IncludeSet();
		assertTrue(includes.getRequired().isEmpty());
		assertFalse(includes.isRequired(CppHeader.IOSTREAM));
	}
}
