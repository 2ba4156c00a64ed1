package flowc.model.flow;

public abstract class FlowStatementVisitor<T, E extends Throwable> {

	public abstract T visit(FlowComment comment) throws E;
	public abstract T visit(FlowEnd end) throws E;
	public abstract T visit(FlowFunctionDefinition functionDefinition) throws E;
	public abstract T visit(FlowReturn flowReturn) throws E;
	public abstract T visit(FlowSay say) throws E;
	public abstract T visit(FlowLet let) throws E;
	public abstract T visit(FlowIncompleteLet incompleteLet) throws E;
	public abstract T visit(FlowIf flowIf) throws E;
	public abstract T visit(FlowElse flowElse) throws E;
	public abstract T visit(FlowLoop loop) throws E;
	public abstract T visit(FlowWhile flowWhile) throws E;
	public abstract T visit(FlowGrow grow) throws E;
	public abstract T visit(FlowBreak flowBreak) throws E;
	public abstract T visit(FlowContinue flowContinue) throws E;
	public abstract T visit(FlowExpressionStatement expressionStatement) throws E;

}
