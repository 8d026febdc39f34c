package works.mongobridge.mongo.exceptions;

/**
 * Thrown from {@link works.mongobridge.mongo.BlockingDriver} methods
 * if we've lost the ability to talk to the database,
 * or never had it in the first place.
 */
public class DisconnectedException extends DriverException {
	public DisconnectedException(String message) {
		super(message);
	}

	public DisconnectedException(String message, Throwable cause) {
		super(message, cause);
	}
}
