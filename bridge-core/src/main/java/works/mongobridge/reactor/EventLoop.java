package works.mongobridge.reactor;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Loop} whose tasks run on whichever thread calls {@link #run()}.
 * <p>
 * Applications typically dedicate a thread to it with {@link #startThread},
 * or call {@link #run()} from their main thread.
 * An exception thrown by a task is logged and does not stop the loop.
 */
public final class EventLoop implements Loop {
	private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
	private volatile boolean isStopping = false;
	private volatile Thread loopThread;

	private static final Runnable STOP = () -> { };

	public static EventLoop startThread(String threadName) {
		EventLoop result = new EventLoop();
		Thread thread = new Thread(result::run, threadName);
		thread.setDaemon(true);
		thread.start();
		return result;
	}

	@Override
	public void submit(Runnable task) throws RejectedExecutionException {
		if (isStopping) {
			throw new RejectedExecutionException("Event loop is stopped");
		}
		queue.add(task);
	}

	/**
	 * Runs tasks on the calling thread until {@link #stop()} is called
	 * and all tasks submitted before that have run.
	 */
	public void run() {
		loopThread = Thread.currentThread();
		LOGGER.debug("Event loop started");
		try {
			while (true) {
				Runnable task = queue.take();
				if (task == STOP) {
					break;
				}
				try {
					task.run();
				} catch (RuntimeException e) {
					LOGGER.error("Exception from event loop task; continuing", e);
				}
			}
		} catch (InterruptedException e) {
			LOGGER.debug("Event loop interrupted", e);
			Thread.currentThread().interrupt();
		} finally {
			loopThread = null;
			LOGGER.debug("Event loop exited");
		}
	}

	/**
	 * @return true if called from the thread currently running this loop.
	 */
	public boolean isLoopThread() {
		return Thread.currentThread() == loopThread;
	}

	/**
	 * Lets already-submitted tasks run, then causes {@link #run()} to return.
	 */
	public void stop() {
		isStopping = true;
		queue.add(STOP);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EventLoop.class);
}
