package flowc.model.flow;

import java.util.List;
import java.util.Objects;

/**
 * define name(p1, p2, ...)
 *
 * Parameters are already trimmed, with empty entries removed.
 */
public class FlowFunctionDefinition extends FlowStatement {
	private final String name;
	private final List<String> params;

	public FlowFunctionDefinition(String name, List<String> params) {
		this.name = name;
		this.params = params;
	}

	public String getName() {
		return name;
	}

	public List<String> getParams() {
		return params;
	}

	@Override
	public <T, E extends Throwable> T accept(FlowStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FlowFunctionDefinition that = (FlowFunctionDefinition) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(params, that.params);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, params);
	}
}
