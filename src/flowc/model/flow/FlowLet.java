package flowc.model.flow;

import java.util.Objects;

/**
 * let name = value
 *
 */
public class FlowLet extends FlowStatement {
	private final String name;
	private final String value;

	public FlowLet(String name, String value) {
		this.name = name;
		this.value = value;
	}

	public String getName() {
		return name;
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
		FlowLet flowLet = (FlowLet) o;
		return Objects.equals(name, flowLet.name) &&
				Objects.equals(value, flowLet.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}
}
