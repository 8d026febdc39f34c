package works.mongobridge.mongo.internal;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.mongobridge.Delivery;
import works.mongobridge.Outcome;
import works.mongobridge.logging.MappedDiagnosticContext.MDCScope;
import works.mongobridge.mongo.BlockingDriver;
import works.mongobridge.mongo.exceptions.DriverException;
import works.mongobridge.reactor.Loop;
import works.mongobridge.reactor.Worker;

import static works.mongobridge.logging.MappedDiagnosticContext.setupMDC;

/**
 * Runs {@link DriverCall}s on a dedicated {@link Worker} and delivers their outcomes
 * back on the caller's {@link Loop}.
 * <p>
 * Each operation takes three hops:
 * <ol>
 *     <li>
 *         a task on the loop, which runs after the caller has had its chance to
 *         register reactions, and reads {@link Delivery#requiresStatus()};
 *     </li>
 *     <li>
 *         a task on the worker, which makes the blocking call inside a failure boundary; and
 *     </li>
 *     <li>
 *         a task on the loop, which delivers the outcome.
 *     </li>
 * </ol>
 * Calls start in the order they were dispatched, and each finishes before the next starts.
 * No exception from the driver ever reaches the caller.
 */
public final class Dispatcher implements AutoCloseable {
	private final String connectionName;
	private final Loop notifier;
	private final Worker worker;
	private final BlockingDriver driver;

	public static final String CLOSED_MESSAGE = "Connection is closed";

	public Dispatcher(String connectionName, Loop notifier, BlockingDriver driver) {
		this.connectionName = connectionName;
		this.notifier = notifier;
		this.driver = driver;
		this.worker = new Worker("mongo-worker-" + connectionName);
	}

	public <T> void dispatch(String operation, Delivery<T> delivery, DriverCall<T> call) {
		submitToNotifier(operation, () -> {
			boolean requiresStatus = delivery.requiresStatus();
			try {
				worker.submit(() -> {
					Outcome<T> outcome = runGuarded(operation, requiresStatus, call);
					if (delivery != Delivery.DISCARD) {
						notify(operation, delivery, outcome);
					}
				});
			} catch (RejectedExecutionException e) {
				LOGGER.debug("{} rejected: connection {} is closed", operation, connectionName);
				if (requiresStatus) {
					delivery.deliver(Outcome.failure(CLOSED_MESSAGE));
				} else {
					delivery.deliver(Outcome.unobserved());
				}
			}
		});
	}

	private void submitToNotifier(String operation, Runnable hop) {
		try {
			notifier.submit(hop);
		} catch (RejectedExecutionException e) {
			LOGGER.warn("{} on connection {} dropped: the loop is no longer running", operation, connectionName, e);
		}
	}

	private <T> Outcome<T> runGuarded(String operation, boolean requiresStatus, DriverCall<T> call) {
		try (MDCScope __ = setupMDC(connectionName, operation)) {
			LOGGER.debug("Running {}", operation);
			Outcome<T> outcome;
			try {
				outcome = call.run(driver, requiresStatus);
			} catch (DriverException | RuntimeException e) {
				if (requiresStatus) {
					LOGGER.debug("{} failed", operation, e);
				} else {
					LOGGER.warn("{} failed; nobody is waiting for the result", operation, e);
					return Outcome.unobserved();
				}
				return Outcome.failure(messageOf(e));
			}
			if (!requiresStatus && outcome instanceof Outcome.Failure<T> f) {
				LOGGER.warn("{} failed; nobody is waiting for the result: {}", operation, f.message());
				return Outcome.unobserved();
			}
			return outcome;
		}
	}

	private <T> void notify(String operation, Delivery<T> delivery, Outcome<T> outcome) {
		try {
			notifier.submit(() -> delivery.deliver(outcome));
		} catch (RejectedExecutionException e) {
			LOGGER.warn("Unable to deliver outcome of {}: the loop is no longer running", operation, e);
		}
	}

	/**
	 * Closes the driver after all previously dispatched calls have finished,
	 * and rejects any operations dispatched afterward.
	 * <p>
	 * Like {@link #dispatch}, this takes effect when the loop next runs,
	 * so operations dispatched earlier in the same turn still reach the driver.
	 * If the loop is no longer running, the driver is closed right away instead.
	 */
	@Override
	public void close() {
		try {
			notifier.submit(this::shutDownWorker);
		} catch (RejectedExecutionException e) {
			LOGGER.debug("Loop is no longer running; closing connection {} now", connectionName, e);
			shutDownWorker();
		}
	}

	private void shutDownWorker() {
		try {
			worker.submit(() -> {
				try (MDCScope __ = setupMDC(connectionName, "close")) {
					driver.close();
				}
			});
		} catch (RejectedExecutionException e) {
			LOGGER.debug("Connection {} already closed", connectionName);
			return;
		}
		worker.close();
	}

	/**
	 * @return true if the worker finished its last task within the given time.
	 * Closing begins only once the loop has run the task queued by {@link #close()}.
	 */
	public boolean awaitTermination(Duration timeout) throws InterruptedException {
		return worker.awaitTermination(timeout);
	}

	static String messageOf(Exception e) {
		return (e.getMessage() == null)? e.getClass().getSimpleName() : e.getMessage();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Dispatcher.class);
}
