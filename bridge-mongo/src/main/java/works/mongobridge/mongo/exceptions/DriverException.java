package works.mongobridge.mongo.exceptions;

import works.mongobridge.mongo.BlockingDriver;

/**
 * Thrown by {@link BlockingDriver} operations when the driver call fails.
 * <p>
 * These never reach the caller of a {@code Connection} method:
 * they are converted into a failure outcome on the worker thread.
 */
public class DriverException extends Exception {
	public DriverException(String message) {
		super(message);
	}

	public DriverException(String message, Throwable cause) {
		super(message, cause);
	}
}
