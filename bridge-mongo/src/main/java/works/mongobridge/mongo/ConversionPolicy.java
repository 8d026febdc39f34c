package works.mongobridge.mongo;

/**
 * What {@link BsonConverter} does with values it can't represent faithfully.
 */
public enum ConversionPolicy {
	/**
	 * Unsupported BSON types decode as {@link works.mongobridge.DynamicValue#NULL NULL},
	 * keeping their key or position, and a scalar root encodes as an empty document.
	 */
	LENIENT,

	/**
	 * Both of those situations throw {@link works.mongobridge.mongo.exceptions.BsonFormatException}.
	 */
	STRICT,
}
