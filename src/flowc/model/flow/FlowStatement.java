package flowc.model.flow;

import flowc.formatters.FlowStatementFormattingVisitor;
import flowc.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 * One classified line of a Flow program.
 *
 * Statements are produced by the line classifier and consumed immediately by code generation; nothing keeps them
 * around once they have been emitted.
 */
public abstract class FlowStatement {

	public abstract <T, E extends Throwable> T accept(FlowStatementVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new FlowStatementFormattingVisitor(out));
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

}
