package works.mongobridge.reactor;

import java.util.concurrent.RejectedExecutionException;

/**
 * A serial execution context: tasks submitted to the same context
 * run one at a time, in submission order.
 */
public interface ExecutionContext {
	/**
	 * May be called from any thread.
	 *
	 * @throws RejectedExecutionException if the context has been shut down
	 */
	void submit(Runnable task);
}
