package org.mergebot.automerge.statuscheck.fetch;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a call to a remote collaborator: a value, or the failure that prevented it.
 *
 * @param <T> the fetched value type
 */
public final class FetchResult<T> {

    private final T value;
    private final Exception failure;

    private FetchResult(T value, Exception failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> FetchResult<T> success(T value) {
        return new FetchResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> FetchResult<T> failure(Exception failure) {
        return new FetchResult<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public T get() {
        if (failure != null) {
            throw new IllegalStateException("Fetch failed", failure);
        }
        return value;
    }

    public Exception getFailure() {
        return failure;
    }

    public <R> FetchResult<R> map(Function<? super T, ? extends R> mapper) {
        if (failure != null) {
            return failure(failure);
        }
        return success(mapper.apply(value));
    }

    /**
     * Chain a dependent fetch. The first failure short-circuits the rest of the chain.
     */
    public <R> FetchResult<R> flatMap(Function<? super T, FetchResult<R>> mapper) {
        if (failure != null) {
            return failure(failure);
        }
        return mapper.apply(value);
    }

    public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<Exception, ? extends R> onFailure) {
        return failure == null ? onSuccess.apply(value) : onFailure.apply(failure);
    }

    @Override
    public String toString() {
        return failure == null ? "FetchResult[success=" + value + "]" : "FetchResult[failure=" + failure + "]";
    }
}
