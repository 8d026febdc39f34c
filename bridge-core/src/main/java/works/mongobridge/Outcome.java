package works.mongobridge;

import static java.util.Objects.requireNonNull;

/**
 * The result of running one operation, as an explicit value rather than an exception,
 * so it can be handed from the thread that ran the operation to the thread that reports it.
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure, Outcome.Unobserved {

	static <T> Outcome<T> success(T value) {
		return new Success<>(value);
	}

	static <T> Outcome<T> failure(String message) {
		return new Failure<>(message);
	}

	@SuppressWarnings("unchecked")
	static <T> Outcome<T> unobserved() {
		return (Outcome<T>) Unobserved.INSTANCE;
	}

	/**
	 * @param value may be null for operations that produce nothing
	 */
	record Success<T>(T value) implements Outcome<T> { }

	record Failure<T>(String message) implements Outcome<T> {
		public Failure {
			requireNonNull(message);
		}
	}

	/**
	 * The operation ran, but nobody asked whether it succeeded,
	 * so the status was never determined.
	 */
	record Unobserved<T>() implements Outcome<T> {
		static final Unobserved<?> INSTANCE = new Unobserved<>();
	}
}
