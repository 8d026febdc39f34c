package works.mongobridge.mongo.internal;

import works.mongobridge.Outcome;
import works.mongobridge.mongo.BlockingDriver;
import works.mongobridge.mongo.exceptions.DriverException;

/**
 * One blocking operation, run on the worker thread.
 * When <code>requiresStatus</code> is false, the call should skip
 * any work needed only to determine success or failure, and return {@link Outcome#unobserved()}.
 */
@FunctionalInterface
public interface DriverCall<T> {
	Outcome<T> run(BlockingDriver driver, boolean requiresStatus) throws DriverException;
}
