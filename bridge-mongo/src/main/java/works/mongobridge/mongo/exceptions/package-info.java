/**
 * Exceptions that can reach the user of {@link works.mongobridge.mongo.Connection}
 * or of a {@link works.mongobridge.mongo.BlockingDriver} implementation.
 * <p>
 * Failures of asynchronous operations are reported as error messages on the
 * {@link works.mongobridge.Deferred}, not as exceptions.
 */
package works.mongobridge.mongo.exceptions;
