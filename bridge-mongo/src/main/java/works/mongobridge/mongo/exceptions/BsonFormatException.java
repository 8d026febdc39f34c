package works.mongobridge.mongo.exceptions;

/**
 * Thrown by a {@link works.mongobridge.mongo.BsonConverter} using the
 * {@link works.mongobridge.mongo.ConversionPolicy#STRICT STRICT} policy
 * when a value cannot be converted without losing information.
 */
public class BsonFormatException extends IllegalArgumentException {
	public BsonFormatException(String s) { super(s); }
	public BsonFormatException(String message, Throwable cause) { super(message, cause); }
}
