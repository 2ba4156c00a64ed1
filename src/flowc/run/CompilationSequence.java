package flowc.run;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out compilation ids, starting at 1. Owned by whoever runs compilations and passed to the parts that need it.
 */
public class CompilationSequence {
	private final AtomicLong count = new AtomicLong();

	public long next() {
		return count.incrementAndGet();
	}

	/**
	 * @return how many ids have been handed out so far
	 */
	public long current() {
		return count.get();
	}
}
