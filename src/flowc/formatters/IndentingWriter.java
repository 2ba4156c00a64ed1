package flowc.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * Writer that prefixes every line with the current indentation.
 *
 * Lines are always separated by '\n' so that generated programs are byte-identical across platforms.
 */
public class IndentingWriter extends Writer {

	public static final String LINE_SEPARATOR = "\n";

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean shouldIndent = false;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public IndentingWriter(Writer out) {
		this(out, 4);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	public void unindent(int spaces) {
		if (spaces > indent) {
			throw new RuntimeException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public int getIndent() {
		return indent;
	}

	public void newLine() throws IOException {
		write(LINE_SEPARATOR);
	}

	/**
	 * Writes text that is already indented, bypassing the current indentation.
	 */
	public void writeVerbatimLine(String line) throws IOException {
		out.write(line);
		out.write(LINE_SEPARATOR);
		shouldIndent = true;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while (start < data.length()) {
			int next = data.indexOf(LINE_SEPARATOR, start);
			// blank lines stay blank
			if (shouldIndent && next != start) {
				for (int i = 0; i < indent; ++i) {
					out.write(" ");
				}
			}
			shouldIndent = false;
			if (next == -1) {
				out.write(data.substring(start));
				break;
			}
			out.write(data.substring(start, next + LINE_SEPARATOR.length()));
			start = next + LINE_SEPARATOR.length();
			shouldIndent = true;
		}
	}

}
