package flowc.formatters;

import flowc.model.flow.*;

import java.io.IOException;

/**
 * Prints a statement back in Flow surface syntax.
 */
public class FlowStatementFormattingVisitor extends FlowStatementVisitor<Void, IOException> {

	private final IndentingWriter out;

	public FlowStatementFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(FlowComment comment) throws IOException {
		out.write("-- ");
		out.write(comment.getText());
		return null;
	}

	@Override
	public Void visit(FlowEnd end) throws IOException {
		out.write("end");
		return null;
	}

	@Override
	public Void visit(FlowFunctionDefinition functionDefinition) throws IOException {
		out.write("define ");
		out.write(functionDefinition.getName());
		out.write("(");
		out.write(String.join(", ", functionDefinition.getParams()));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(FlowReturn flowReturn) throws IOException {
		out.write("return ");
		out.write(flowReturn.getValue());
		return null;
	}

	@Override
	public Void visit(FlowSay say) throws IOException {
		out.write("say ");
		out.write(say.getValue());
		return null;
	}

	@Override
	public Void visit(FlowLet let) throws IOException {
		out.write("let ");
		out.write(let.getName());
		out.write(" = ");
		out.write(let.getValue());
		return null;
	}

	@Override
	public Void visit(FlowIncompleteLet incompleteLet) throws IOException {
		out.write("let ");
		out.write(incompleteLet.getText());
		return null;
	}

	@Override
	public Void visit(FlowIf flowIf) throws IOException {
		out.write("if ");
		out.write(flowIf.getCondition());
		out.write(" then");
		return null;
	}

	@Override
	public Void visit(FlowElse flowElse) throws IOException {
		out.write("else");
		return null;
	}

	@Override
	public Void visit(FlowLoop loop) throws IOException {
		out.write("loop ");
		out.write(loop.getCount());
		out.write(" times");
		return null;
	}

	@Override
	public Void visit(FlowWhile flowWhile) throws IOException {
		out.write("while ");
		out.write(flowWhile.getCondition());
		out.write(" do");
		return null;
	}

	@Override
	public Void visit(FlowGrow grow) throws IOException {
		out.write("grow ");
		out.write(grow.getVariable());
		return null;
	}

	@Override
	public Void visit(FlowBreak flowBreak) throws IOException {
		out.write("break");
		return null;
	}

	@Override
	public Void visit(FlowContinue flowContinue) throws IOException {
		out.write("continue");
		return null;
	}

	@Override
	public Void visit(FlowExpressionStatement expressionStatement) throws IOException {
		out.write(expressionStatement.getExpression());
		return null;
	}
}
