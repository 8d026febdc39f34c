package works.mongobridge;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * A handle on the eventual result of an asynchronous operation.
 * <p>
 * The caller registers up to three reactions:
 * {@link #onSuccess}, {@link #onFailure}, and {@link #onComplete}.
 * Registering a reaction again replaces the previous one for that slot;
 * reactions do not accumulate.
 * <p>
 * When the operation finishes, exactly one of the following happens, once:
 * <ul>
 *     <li>
 *         the success reaction runs, then the completion reaction;
 *     </li>
 *     <li>
 *         the failure reaction runs with an error message, then the completion reaction; or
 *     </li>
 *     <li>
 *         if neither a success nor failure reaction was registered in time
 *         (see {@link #requiresStatus()}), only the completion reaction runs.
 *     </li>
 * </ul>
 * The completion reaction runs even if the success or failure reaction throws.
 * <p>
 * Reactions registered after the Deferred has been resolved never run.
 * There is no cached outcome to replay.
 * <p>
 * Only the holder of the {@link Resolver} created alongside a Deferred can resolve it;
 * callers only ever see the Deferred itself.
 * Reactions run on whichever thread calls the resolver,
 * which for a {@code Connection} is always the caller's own loop.
 */
public final class Deferred<T> {
	private volatile Consumer<? super T> successReaction;
	private volatile Consumer<String> failureReaction;
	private volatile Runnable completeReaction;
	private final AtomicBoolean isResolved = new AtomicBoolean(false);

	private Deferred() { }

	/**
	 * @return a new {@link Resolver}, from which the corresponding Deferred
	 * can be obtained via {@link Resolver#deferred()}.
	 */
	public static <T> Resolver<T> newResolver() {
		return new Resolver<>(new Deferred<>());
	}

	public Deferred<T> onSuccess(@NotNull Consumer<? super T> reaction) {
		warnIfResolved("success");
		successReaction = requireNonNull(reaction);
		return this;
	}

	public Deferred<T> onFailure(@NotNull Consumer<String> reaction) {
		warnIfResolved("failure");
		failureReaction = requireNonNull(reaction);
		return this;
	}

	public Deferred<T> onComplete(@NotNull Runnable reaction) {
		warnIfResolved("completion");
		completeReaction = requireNonNull(reaction);
		return this;
	}

	/**
	 * Status is only relevant if someone wants to know about success or failure.
	 * When this returns false, the operation can save itself the trouble
	 * (often a round trip to the server) of finding out.
	 * <p>
	 * Operations typically check this once, shortly after they are submitted,
	 * so reactions should be registered promptly: on the same loop turn
	 * that initiated the operation.
	 */
	public boolean requiresStatus() {
		return successReaction != null || failureReaction != null;
	}

	public boolean isResolved() {
		return isResolved.get();
	}

	private void warnIfResolved(String slot) {
		if (isResolved.get()) {
			LOGGER.debug("Registering {} reaction on a Deferred that is already resolved; it will never run", slot);
		}
	}

	private void markResolved() {
		if (!isResolved.compareAndSet(false, true)) {
			throw new IllegalStateException("Deferred is already resolved");
		}
	}

	// Reactions are read once, at resolution time, so any registered later never run
	private void fireSuccess(T value) {
		markResolved();
		Consumer<? super T> success = successReaction;
		Runnable complete = completeReaction;
		try {
			if (success != null) {
				success.accept(value);
			}
		} finally {
			runIfPresent(complete);
		}
	}

	private void fireFailure(String error) {
		markResolved();
		Consumer<String> failure = failureReaction;
		Runnable complete = completeReaction;
		try {
			if (failure != null) {
				failure.accept(error);
			}
		} finally {
			runIfPresent(complete);
		}
	}

	private void fireComplete() {
		markResolved();
		runIfPresent(completeReaction);
	}

	private static void runIfPresent(Runnable reaction) {
		if (reaction != null) {
			reaction.run();
		}
	}

	@Override
	public String toString() {
		return "Deferred{" +
			"resolved=" + isResolved.get() +
			", success=" + (successReaction != null) +
			", failure=" + (failureReaction != null) +
			", complete=" + (completeReaction != null) +
			'}';
	}

	/**
	 * The writing end of a {@link Deferred}.
	 * Each Deferred can be resolved at most once; subsequent attempts throw {@link IllegalStateException}.
	 */
	public static final class Resolver<T> implements Delivery<T> {
		private final Deferred<T> deferred;

		private Resolver(Deferred<T> deferred) {
			this.deferred = deferred;
		}

		public Deferred<T> deferred() {
			return deferred;
		}

		@Override
		public boolean requiresStatus() {
			return deferred.requiresStatus();
		}

		public void succeed(T value) {
			deferred.fireSuccess(value);
		}

		public void fail(@NotNull String error) {
			deferred.fireFailure(requireNonNull(error));
		}

		/**
		 * Signals that the operation finished without saying whether it succeeded.
		 */
		public void complete() {
			deferred.fireComplete();
		}

		@Override
		public void deliver(Outcome<T> outcome) {
			if (outcome instanceof Outcome.Success<T> s) {
				succeed(s.value());
			} else if (outcome instanceof Outcome.Failure<T> f) {
				fail(f.message());
			} else {
				complete();
			}
		}

		@Override
		public String toString() {
			return "Resolver{" + deferred + '}';
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Deferred.class);
}
