package flowc.model.flow;

/**
 * The literal line "end"
 */
public class FlowEnd extends FlowStatement {

	@Override
	public <T, E extends Throwable> T accept(FlowStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof FlowEnd;
	}

	@Override
	public int hashCode() {
		return 0;
	}

}
