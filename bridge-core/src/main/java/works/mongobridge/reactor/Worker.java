package works.mongobridge.reactor;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * An {@link ExecutionContext} with a dedicated thread, for running blocking calls
 * without holding up the caller's {@link Loop}.
 * <p>
 * Because tasks run one at a time, in order, state touched only by tasks
 * of one worker needs no locking.
 * <p>
 * Tasks are expected to handle their own errors.
 * Any exception that escapes a task is logged, and the worker moves on to the next task.
 */
public final class Worker implements ExecutionContext, AutoCloseable {
	private final String name;
	private final ExecutorService executor;
	private volatile Thread thread;

	public Worker(String name) {
		this.name = name;
		this.executor = Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, name);
			t.setDaemon(true);
			thread = t;
			return t;
		});
	}

	public String name() {
		return name;
	}

	@Override
	public void submit(Runnable task) throws RejectedExecutionException {
		executor.execute(() -> {
			try {
				task.run();
			} catch (RuntimeException | Error e) {
				LOGGER.error("Unhandled exception in worker task", e);
			}
		});
	}

	/**
	 * @return true if called from a task running on this worker.
	 */
	public boolean isWorkerThread() {
		return Thread.currentThread() == thread;
	}

	public boolean isShutdown() {
		return executor.isShutdown();
	}

	/**
	 * Stops accepting tasks. Tasks already submitted still run.
	 */
	@Override
	public void close() {
		LOGGER.debug("Shutting down worker {}", name);
		executor.shutdown();
	}

	/**
	 * @return true if all tasks finished within the given time.
	 */
	public boolean awaitTermination(Duration timeout) throws InterruptedException {
		return executor.awaitTermination(timeout.toMillis(), MILLISECONDS);
	}

	@Override
	public String toString() {
		return "Worker{" + name + '}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);
}
