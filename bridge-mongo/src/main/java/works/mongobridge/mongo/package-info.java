/**
 * Asynchronous access to MongoDB.
 * <p>
 * Start with {@link works.mongobridge.mongo.Connection#connect}.
 * Documents, filters, commands and results are all {@link works.mongobridge.DynamicValue}s,
 * converted to and from BSON by {@link works.mongobridge.mongo.BsonConverter}.
 */
package works.mongobridge.mongo;
