package com.ifblock.engine;

import com.ifblock.exception.ConditionalError;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an engine operation: a value, or the structured errors that prevented it.
 *
 * @param <T> Type of the success value
 */
public final class ConditionalResult<T> {

    private final T value;
    private final List<ConditionalError> errors;

    private ConditionalResult(T value, List<ConditionalError> errors) {
        this.value = value;
        this.errors = errors;
    }

    /**
     * Create a successful result.
     */
    public static <T> ConditionalResult<T> success(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Success value cannot be null");
        }
        return new ConditionalResult<>(value, List.of());
    }

    /**
     * Create a failed result from a single error.
     */
    public static <T> ConditionalResult<T> failure(ConditionalError error) {
        return failure(List.of(error));
    }

    /**
     * Create a failed result.
     */
    public static <T> ConditionalResult<T> failure(List<ConditionalError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("Failed result must have errors");
        }
        return new ConditionalResult<>(null, List.copyOf(errors));
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    /**
     * Get the success value.
     *
     * @throws IllegalStateException if the result is a failure
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("Cannot get value from failed result: " + errors);
        }
        return value;
    }

    /**
     * Get the errors; empty on success.
     */
    public List<ConditionalError> getErrors() {
        return errors;
    }

    /**
     * Get the first error, if this is a failure.
     */
    public Optional<ConditionalError> getError() {
        return errors.stream().findFirst();
    }

    /**
     * Map the success value, passing failures through unchanged.
     */
    public <R> ConditionalResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return new ConditionalResult<>(null, errors);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ConditionalResult{success, value=" + value + '}'
                : "ConditionalResult{failure, errors=" + errors + '}';
    }
}
