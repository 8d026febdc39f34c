/**
 * Implementation details of {@link works.mongobridge.mongo.Connection}.
 * Not intended for direct use.
 */
package works.mongobridge.mongo.internal;
