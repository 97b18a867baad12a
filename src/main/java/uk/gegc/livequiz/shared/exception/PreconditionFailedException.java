package uk.gegc.livequiz.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The request is well formed but the session is not in a state that allows it,
 * e.g. a duplicate answer or a submission outside the question window.
 * Clients must not retry these.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class PreconditionFailedException extends RuntimeException {
    public PreconditionFailedException(String message) {
        super(message);
    }
}
