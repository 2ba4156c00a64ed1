package flowc.model.flow;

public class FlowContinue extends FlowStatement {

	@Override
	public <T, E extends Throwable> T accept(FlowStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof FlowContinue;
	}

	@Override
	public int hashCode() {
		return 3;
	}

}
