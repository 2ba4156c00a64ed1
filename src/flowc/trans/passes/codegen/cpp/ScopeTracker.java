package flowc.trans.passes.codegen.cpp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the stack of open blocks for one translation and writes indented lines into the function buffer or the main
 * buffer.
 *
 * The stack decides which buffer a line goes to and when a function ends. Indentation is a separate counter: it
 * starts at 1 inside the synthesized entry point, goes up by one for each opened block, down by one (never below 0)
 * for each {@code end}, and restarts at 0 in the main block once a function closes. Unbalanced input never fails.
 */
public class ScopeTracker {
	private static final String INDENT = "    ";

	private final List<String> functionLines = new ArrayList<>();
	private final List<String> mainLines = new ArrayList<>();
	private final Deque<ScopeFrame> frames = new ArrayDeque<>();
	private int indent = 1;

	public ScopeTracker() {
		frames.push(new ScopeFrame(ScopeKind.MAIN, mainLines));
	}

	public int getIndent() {
		return indent;
	}

	public boolean isInFunction() {
		for (ScopeFrame frame : frames) {
			if (frame.getKind() == ScopeKind.FUNCTION) {
				return true;
			}
		}
		return false;
	}

	private List<String> activeLines() {
		return isInFunction() ? functionLines : mainLines;
	}

	public void emit(String text) {
		append(activeLines(), indent, text);
	}

	/**
	 * Writes a block header at the current indentation and opens a block beneath it.
	 */
	public void open(String header) {
		List<String> lines = activeLines();
		append(lines, indent, header);
		indent++;
		frames.push(new ScopeFrame(ScopeKind.BLOCK, lines));
	}

	/**
	 * Starts a function. A function that is still open is abandoned, along with any blocks inside it, without
	 * writing their closing braces.
	 */
	public void openFunction(String header) {
		if (isInFunction()) {
			ScopeFrame dropped;
			do {
				dropped = frames.pop();
			} while (dropped.getKind() != ScopeKind.FUNCTION);
		}
		append(functionLines, 0, header);
		frames.push(new ScopeFrame(ScopeKind.FUNCTION, functionLines));
		indent = 1;
	}

	/**
	 * Closes the innermost block. Closing a function separates it from the next one with a blank line.
	 */
	public void close(String footer) {
		decrement();
		ScopeFrame frame = frames.poll();
		append(frame == null ? mainLines : frame.getLines(), indent, footer);
		if (frame != null && frame.getKind() == ScopeKind.FUNCTION) {
			functionLines.add("");
		}
	}

	/**
	 * Ends the current branch and starts another one level deeper than the divider.
	 */
	public void reopen(String divider) {
		decrement();
		append(activeLines(), indent, divider);
		indent++;
	}

	public List<String> getFunctionLines() {
		return Collections.unmodifiableList(functionLines);
	}

	public List<String> getMainLines() {
		return Collections.unmodifiableList(mainLines);
	}

	/**
	 * @return the kinds of the open frames, innermost first
	 */
	public List<ScopeKind> getOpenKinds() {
		List<ScopeKind> kinds = new ArrayList<>();
		for (ScopeFrame frame : frames) {
			kinds.add(frame.getKind());
		}
		return kinds;
	}

	private void decrement() {
		if (indent > 0) {
			indent--;
		}
	}

	private static void append(List<String> lines, int indent, String text) {
		StringBuilder line = new StringBuilder();
		for (int i = 0; i < indent; i++) {
			line.append(INDENT);
		}
		line.append(text);
		lines.add(line.toString());
	}
}
