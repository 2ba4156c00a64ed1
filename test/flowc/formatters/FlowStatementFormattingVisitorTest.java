package flowc.formatters;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import flowc.model.flow.FlowStatement;
import flowc.trans.passes.parse.LineClassifier;

// printing a classified line gives back a line that classifies the same way
@RunWith(Parameterized.class)
public class FlowStatementFormattingVisitorTest {

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"-- note", "-- note"},
				{"end", "end"},
				{"define f(a,b)", "define f(a, b)"},
				{"return 1", "return 1"},
				{"say x", "say x"},
				{"let x=1", "let x = 1"},
				{"let x", "let x"},
				{"if  a  then", "if a then"},
				{"else", "else"},
				{"loop 3 times", "loop 3 times"},
				{"while a do", "while a do"},
				{"grow x", "grow x"},
				{"break", "break"},
				{"continue", "continue"},
				{"f(x)", "f(x)"},
		});
	}

	private final String line;
	private final String expected;

	public FlowStatementFormattingVisitorTest(String line, String expected) {
		this.line = line;
		this.expected = expected;
	}

	@Test
	public void test() {
		FlowStatement statement = LineClassifier.classify(line);
		assertThat(statement.toString(), is(expected));
		assertThat(LineClassifier.classify(statement.toString()), is(statement));
	}
}
