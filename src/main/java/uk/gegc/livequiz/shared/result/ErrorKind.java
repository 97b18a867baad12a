package uk.gegc.livequiz.shared.result;

import uk.gegc.livequiz.shared.exception.AnswerCommitException;
import uk.gegc.livequiz.shared.exception.PreconditionFailedException;
import uk.gegc.livequiz.shared.exception.RateLimitExceededException;
import uk.gegc.livequiz.shared.exception.ResourceNotFoundException;
import uk.gegc.livequiz.shared.exception.ValidationException;

/**
 * Typed failure categories returned through the validation, scoring and commit chain.
 * Each kind maps onto exactly one exception at the service boundary.
 */
public enum ErrorKind {
    INVALID_ARGUMENT("invalid-argument"),
    NOT_FOUND("not-found"),
    FAILED_PRECONDITION("failed-precondition"),
    RESOURCE_EXHAUSTED("resource-exhausted"),
    INTERNAL("internal");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public RuntimeException toException(String message) {
        return switch (this) {
            case INVALID_ARGUMENT -> new ValidationException(message);
            case NOT_FOUND -> new ResourceNotFoundException(message);
            case FAILED_PRECONDITION -> new PreconditionFailedException(message);
            case RESOURCE_EXHAUSTED -> new RateLimitExceededException(message);
            case INTERNAL -> new AnswerCommitException(message);
        };
    }
}
