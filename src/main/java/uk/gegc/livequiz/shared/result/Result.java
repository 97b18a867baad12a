package uk.gegc.livequiz.shared.result;

import java.util.Objects;

/**
 * Outcome of an operation that can fail for an expected, typed reason.
 * Failures carry an {@link ErrorKind} and a caller-facing message.
 *
 * @param <T> type of the success value
 */
public final class Result<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String message;

    private Result(T value, ErrorKind errorKind, String message) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null, null);
    }

    public static <T> Result<T> failure(ErrorKind errorKind, String message) {
        Objects.requireNonNull(errorKind, "errorKind");
        return new Result<>(null, errorKind, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isFailure() {
        return errorKind != null;
    }

    public T getValue() {
        if (isFailure()) {
            throw new IllegalStateException("Result is a failure: " + errorKind + " " + message);
        }
        return value;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Re-types a failure so it can be returned from a method with a different success type.
     */
    public <R> Result<R> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("Only failures can be propagated");
        }
        return failure(errorKind, message);
    }

    /**
     * Unwraps the value or throws the exception that corresponds to the failure kind.
     */
    public T orElseThrow() {
        if (isFailure()) {
            throw errorKind.toException(message);
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "Result.success(" + value + ")"
                : "Result.failure(" + errorKind + ", " + message + ")";
    }
}
