package works.mongobridge.reactor;

/**
 * The caller's own {@link ExecutionContext}.
 * <p>
 * Results of asynchronous operations are delivered by submitting tasks to the loop,
 * so reactions never race with other code that runs on the loop,
 * and state owned by the loop needs no locking.
 */
public interface Loop extends ExecutionContext {
}
