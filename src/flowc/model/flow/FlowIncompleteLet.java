package flowc.model.flow;

import java.util.Objects;

/**
 * A binding with no '=' in it. Carries the text after the keyword; generates nothing.
 *
 */
public class FlowIncompleteLet extends FlowStatement {
	private final String text;

	public FlowIncompleteLet(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(FlowStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FlowIncompleteLet that = (FlowIncompleteLet) o;
		return Objects.equals(text, that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}
}
