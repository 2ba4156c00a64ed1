package flowc.model.flow;

import java.util.Objects;

/**
 * Scales a variable in place by the golden ratio
 *
 */
public class FlowGrow extends FlowStatement {
	private final String variable;

	public FlowGrow(String variable) {
		this.variable = variable;
	}

	public String getVariable() {
		return variable;
	}

	@Override
	public <T, E extends Throwable> T accept(FlowStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FlowGrow that = (FlowGrow) o;
		return Objects.equals(variable, that.variable);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variable);
	}
}
