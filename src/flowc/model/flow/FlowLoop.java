package flowc.model.flow;

import java.util.Objects;

/**
 * Repeats its body a fixed number of times
 *
 */
public class FlowLoop extends FlowStatement {
	private final String count;

	public FlowLoop(String count) {
		this.count = count;
	}

	public String getCount() {
		return count;
	}

	@Override
	public <T, E extends Throwable> T accept(FlowStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FlowLoop that = (FlowLoop) o;
		return Objects.equals(count, that.count);
	}

	@Override
	public int hashCode() {
		return Objects.hash(count);
	}
}
