package works.mongobridge.testing;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.mongobridge.reactor.Loop;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * A {@link Loop} that runs tasks only when a test asks it to,
 * on the test's own thread.
 * <p>
 * Unlike a real loop, exceptions thrown by tasks propagate to the caller
 * of {@link #runPending()} or {@link #runUntil}, so failed assertions
 * inside reactions fail the test.
 */
public class ManualLoop implements Loop {
	private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();

	@Override
	public void submit(Runnable task) {
		queue.add(task);
	}

	/**
	 * Runs tasks until the queue is empty, including tasks submitted by the tasks themselves.
	 *
	 * @return the number of tasks run
	 */
	public int runPending() {
		int count = 0;
		Runnable task;
		while ((task = queue.poll()) != null) {
			task.run();
			++count;
		}
		return count;
	}

	/**
	 * Runs tasks as they arrive, waiting for more if necessary,
	 * until <code>condition</code> becomes true.
	 *
	 * @throws AssertionError if the condition is still false after <code>timeout</code>
	 */
	public void runUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
		long deadline = System.nanoTime() + timeout.toNanos();
		while (!condition.getAsBoolean()) {
			long remaining = deadline - System.nanoTime();
			if (remaining <= 0) {
				throw new AssertionError("Timed out after " + timeout + " waiting for loop condition");
			}
			Runnable task = queue.poll(remaining, NANOSECONDS);
			if (task != null) {
				task.run();
			}
		}
		LOGGER.trace("Loop condition satisfied");
	}

	public boolean isIdle() {
		return queue.isEmpty();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ManualLoop.class);
}
