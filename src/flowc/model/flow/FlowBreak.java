package flowc.model.flow;

public class FlowBreak extends FlowStatement {

	@Override
	public <T, E extends Throwable> T accept(FlowStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof FlowBreak;
	}

	@Override
	public int hashCode() {
		return 2;
	}

}
