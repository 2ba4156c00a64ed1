package flowc.trans.passes.codegen.cpp;

import flowc.model.cpp.CppHeader;
import flowc.model.flow.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes the C++ for each statement into the scope tracker.
 */
public class CppStatementEmitter extends FlowStatementVisitor<Void, RuntimeException> {

	/**
	 * Multiplier used by {@code grow}. Deliberately not the same literal as {@link ExpressionTranslator#PHI}.
	 */
	public static final String GROW_FACTOR = "1.618033988749895";

	private final ScopeTracker scope;
	private final IncludeSet includes;
	private final ExpressionTranslator expressions;

	public CppStatementEmitter(ScopeTracker scope, IncludeSet includes) {
		this.scope = scope;
		this.includes = includes;
		this.expressions = new ExpressionTranslator(includes);
	}

	@Override
	public Void visit(FlowComment comment) {
		scope.emit("// " + comment.getText());
		return null;
	}

	@Override
	public Void visit(FlowEnd end) {
		scope.close("}");
		return null;
	}

	@Override
	public Void visit(FlowFunctionDefinition functionDefinition) {
		List<String> params = new ArrayList<>();
		for (String param : functionDefinition.getParams()) {
			params.add("auto " + param);
		}
		scope.openFunction("auto " + functionDefinition.getName() + "(" + String.join(", ", params) + ") {");
		return null;
	}

	@Override
	public Void visit(FlowReturn flowReturn) {
		scope.emit("return " + expressions.translate(flowReturn.getValue()) + ";");
		return null;
	}

	@Override
	public Void visit(FlowSay say) {
		includes.require(CppHeader.IOSTREAM);
		scope.emit("std::cout << " + expressions.translate(say.getValue()) + " << std::endl;");
		return null;
	}

	@Override
	public Void visit(FlowLet let) {
		scope.emit("auto " + let.getName() + " = " + expressions.translate(let.getValue()) + ";");
		return null;
	}

	@Override
	public Void visit(FlowIncompleteLet incompleteLet) {
		return null;
	}

	@Override
	public Void visit(FlowIf flowIf) {
		scope.open("if (" + expressions.translate(flowIf.getCondition()) + ") {");
		return null;
	}

	@Override
	public Void visit(FlowElse flowElse) {
		scope.reopen("} else {");
		return null;
	}

	@Override
	public Void visit(FlowLoop loop) {
		scope.open("for (int _i = 0; _i < " + expressions.translate(loop.getCount()) + "; _i++) {");
		return null;
	}

	@Override
	public Void visit(FlowWhile flowWhile) {
		scope.open("while (" + expressions.translate(flowWhile.getCondition()) + ") {");
		return null;
	}

	@Override
	public Void visit(FlowGrow grow) {
		scope.emit(grow.getVariable() + " *= " + GROW_FACTOR + ";");
		return null;
	}

	@Override
	public Void visit(FlowBreak flowBreak) {
		scope.emit("break;");
		return null;
	}

	@Override
	public Void visit(FlowContinue flowContinue) {
		scope.emit("continue;");
		return null;
	}

	@Override
	public Void visit(FlowExpressionStatement expressionStatement) {
		scope.emit(expressions.translate(expressionStatement.getExpression()) + ";");
		return null;
	}
}
