package uk.gegc.livequiz.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class AnswerCommitException extends RuntimeException {
    public AnswerCommitException(String message) {
        super(message);
    }

    public AnswerCommitException(String message, Throwable cause) {
        super(message, cause);
    }
}
