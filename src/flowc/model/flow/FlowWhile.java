package flowc.model.flow;

import java.util.Objects;

public class FlowWhile extends FlowStatement {
	private final String condition;

	public FlowWhile(String condition) {
		this.condition = condition;
	}

	public String getCondition() {
		return condition;
	}

	@Override
	public <T, E extends Throwable> T accept(FlowStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FlowWhile that = (FlowWhile) o;
		return Objects.equals(condition, that.condition);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition);
	}
}
