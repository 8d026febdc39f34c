/**
 * Serial execution contexts.
 * <p>
 * A {@link works.mongobridge.reactor.Worker} runs blocking calls on a dedicated thread;
 * a {@link works.mongobridge.reactor.Loop} runs the caller's code, including reactions to finished operations.
 */
package works.mongobridge.reactor;
