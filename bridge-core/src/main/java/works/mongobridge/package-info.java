/**
 * The core asynchronous API: {@link works.mongobridge.DynamicValue} for documents and results,
 * {@link works.mongobridge.Deferred} for results that are not yet available,
 * and {@link works.mongobridge.Outcome} for carrying a finished result between threads.
 * <p>
 * Execution contexts live in {@link works.mongobridge.reactor}.
 */
package works.mongobridge;
