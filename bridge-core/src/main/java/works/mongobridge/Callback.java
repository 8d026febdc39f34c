package works.mongobridge;

import org.jetbrains.annotations.Nullable;

/**
 * Receives the result of an operation in a single call,
 * as an alternative to registering reactions on a {@link Deferred}.
 * Exactly one of the two arguments is meaningful:
 * <code>error</code> is null if and only if the operation succeeded.
 */
@FunctionalInterface
public interface Callback<T> {
	void onResult(@Nullable T result, @Nullable String error);
}
