package uk.gegc.livequiz.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authorization.AuthorizationDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.livequiz.shared.api.problem.ErrorTypes;
import uk.gegc.livequiz.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.livequiz.shared.exception.AnswerCommitException;
import uk.gegc.livequiz.shared.exception.PreconditionFailedException;
import uk.gegc.livequiz.shared.exception.RateLimitExceededException;
import uk.gegc.livequiz.shared.exception.ResourceNotFoundException;
import uk.gegc.livequiz.shared.exception.ValidationException;
import uk.gegc.livequiz.shared.result.ErrorKind;

import java.util.List;

import static uk.gegc.livequiz.shared.api.problem.ProblemDetailBuilder.pathOf;

/**
 * Maps engine failures onto problem responses.
 * Every body carries the {@code errorCode} of its {@link ErrorKind} or of the security layer.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    static final String GENERIC_INTERNAL_MESSAGE = "An unexpected error occurred";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleInvalidArgument(ValidationException ex, HttpServletRequest request) {
        return respond(ProblemDetailBuilder.forKind(ErrorKind.INVALID_ARGUMENT, ex.getMessage(), pathOf(request)));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return respond(ProblemDetailBuilder.forKind(ErrorKind.NOT_FOUND, ex.getMessage(), pathOf(request)));
    }

    @ExceptionHandler(PreconditionFailedException.class)
    public ResponseEntity<ProblemDetail> handleFailedPrecondition(PreconditionFailedException ex,
                                                                  HttpServletRequest request) {
        log.debug("Precondition failed on {}: {}", request.getRequestURI(), ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.forKind(ErrorKind.FAILED_PRECONDITION, ex.getMessage(), pathOf(request));
        problem.setProperty("retryable", false);
        return respond(problem);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ProblemDetail> handleResourceExhausted(RateLimitExceededException ex,
                                                                 HttpServletRequest request) {
        long retryAfter = ex.getRetryAfterSeconds();
        ProblemDetail problem = ProblemDetailBuilder.forKind(ErrorKind.RESOURCE_EXHAUSTED, ex.getMessage(), pathOf(request));
        problem.setProperty("retryAfterSeconds", retryAfter);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, Long.toString(retryAfter))
                .body(problem);
    }

    @ExceptionHandler({AccessDeniedException.class, AuthorizationDeniedException.class})
    public ResponseEntity<ProblemDetail> handlePermissionDenied(RuntimeException ex, HttpServletRequest request) {
        String detail = ex.getMessage() == null ? "Only the session host can perform this action" : ex.getMessage();
        return respond(ProblemDetailBuilder.build(HttpStatus.FORBIDDEN, ErrorTypes.PERMISSION_DENIED,
                "Permission Denied", detail, "permission-denied", pathOf(request)));
    }

    // Lost a race against a host transition or a leaderboard write; the client may resend.
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ProblemDetail> handleConcurrentUpdate(OptimisticLockingFailureException ex,
                                                                HttpServletRequest request) {
        log.warn("Concurrent update on {}: {}", request.getRequestURI(), ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.build(HttpStatus.CONFLICT, ErrorTypes.DATA_CONFLICT, "Conflict",
                "Session data changed while the request was processed. Please try again.",
                ErrorKind.FAILED_PRECONDITION.code(), pathOf(request));
        problem.setProperty("retryable", true);
        return respond(problem);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex,
                                                                   HttpServletRequest request) {
        List<FieldProblem> violations = ex.getConstraintViolations().stream()
                .map(v -> new FieldProblem(v.getPropertyPath().toString(), v.getMessage(), v.getInvalidValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.build(HttpStatus.BAD_REQUEST, ErrorTypes.CONSTRAINT_VIOLATION,
                "Constraint Violation", "One or more validation constraints were violated",
                ErrorKind.INVALID_ARGUMENT.code(), pathOf(request));
        problem.setProperty("violations", violations);
        return respond(problem);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        String expected = ex.getRequiredType() == null ? "unknown" : ex.getRequiredType().getSimpleName();
        ProblemDetail problem = ProblemDetailBuilder.build(HttpStatus.BAD_REQUEST, ErrorTypes.TYPE_MISMATCH,
                "Type Mismatch", "Invalid value for parameter '" + ex.getName() + "'. Expected type: " + expected + ".",
                ErrorKind.INVALID_ARGUMENT.code(), pathOf(request));
        problem.setProperty("parameter", ex.getName());
        return respond(problem);
    }

    @ExceptionHandler(AnswerCommitException.class)
    public ResponseEntity<ProblemDetail> handleCommitFailure(AnswerCommitException ex, HttpServletRequest request) {
        log.error("Answer commit failed on {}", request.getRequestURI(), ex);
        return respond(internalError(request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception on {}", request.getRequestURI(), ex);
        return respond(internalError(request));
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(@NonNull HttpMessageNotReadableException ex,
                                                                  @NonNull HttpHeaders headers,
                                                                  @NonNull HttpStatusCode status,
                                                                  @NonNull WebRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.build(HttpStatus.BAD_REQUEST, ErrorTypes.MALFORMED_JSON,
                "Malformed JSON", "Request body is malformed or cannot be read",
                ErrorKind.INVALID_ARGUMENT.code(), pathOf(request));
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(@NonNull MethodArgumentNotValidException ex,
                                                                  @NonNull HttpHeaders headers,
                                                                  @NonNull HttpStatusCode status,
                                                                  @NonNull WebRequest request) {
        List<FieldProblem> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> new FieldProblem(error.getField(), error.getDefaultMessage(), error.getRejectedValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.build(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED,
                "Validation Failed", "Validation failed for one or more fields",
                ErrorKind.INVALID_ARGUMENT.code(), pathOf(request));
        problem.setProperty("fieldErrors", fieldErrors);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    private static ProblemDetail internalError(HttpServletRequest request) {
        return ProblemDetailBuilder.forKind(ErrorKind.INTERNAL, GENERIC_INTERNAL_MESSAGE, pathOf(request));
    }

    private static ResponseEntity<ProblemDetail> respond(ProblemDetail problem) {
        return ResponseEntity.status(problem.getStatus()).body(problem);
    }

    private record FieldProblem(String field, String message, Object rejectedValue) {
    }
}
