package flowc.model.flow;

import java.util.Objects;

/**
 * Writes the value of an expression to standard output, followed by a newline
 *
 */
public class FlowSay extends FlowStatement {
	private final String value;

	public FlowSay(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(FlowStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FlowSay that = (FlowSay) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
