package flowc.errors;

import flowc.Unreachable;
import flowc.formatters.IndentingWriter;
import flowc.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem reported to the user of the command line tool or the service, as opposed to a bug.
 */
public abstract class Issue {

	public String format() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	@Override
	public String toString() {
		return format();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
