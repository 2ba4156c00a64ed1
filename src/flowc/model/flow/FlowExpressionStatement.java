package flowc.model.flow;

import java.util.Objects;

/**
 * Any line no other statement form recognises
 *
 */
public class FlowExpressionStatement extends FlowStatement {
	private final String expression;

	public FlowExpressionStatement(String expression) {
		this.expression = expression;
	}

	public String getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(FlowStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FlowExpressionStatement that = (FlowExpressionStatement) o;
		return Objects.equals(expression, that.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression);
	}
}
