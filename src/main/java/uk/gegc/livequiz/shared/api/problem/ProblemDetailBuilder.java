package uk.gegc.livequiz.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.context.request.WebRequest;
import uk.gegc.livequiz.shared.result.ErrorKind;

import java.net.URI;
import java.time.Instant;

/**
 * Builds the RFC 7807 bodies returned by the API.
 * Every problem carries an {@code errorCode} and a {@code timestamp}; the instance is the request path.
 */
public final class ProblemDetailBuilder {

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Problem for an engine failure. Status, type and title are derived from the kind.
     */
    public static ProblemDetail forKind(ErrorKind kind, String detail, String path) {
        return build(statusOf(kind), ErrorTypes.of(kind), titleOf(kind), detail, kind.code(), path);
    }

    public static ProblemDetail build(HttpStatus status,
                                      URI type,
                                      String title,
                                      String detail,
                                      String errorCode,
                                      String path) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        if (path != null && !path.isBlank()) {
            problem.setInstance(URI.create(path));
        }
        problem.setProperty("errorCode", errorCode);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    public static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FAILED_PRECONDITION -> HttpStatus.CONFLICT;
            case RESOURCE_EXHAUSTED -> HttpStatus.TOO_MANY_REQUESTS;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static String titleOf(ErrorKind kind) {
        return switch (kind) {
            case INVALID_ARGUMENT -> "Invalid Argument";
            case NOT_FOUND -> "Resource Not Found";
            case FAILED_PRECONDITION -> "Failed Precondition";
            case RESOURCE_EXHAUSTED -> "Rate Limit Exceeded";
            case INTERNAL -> "Internal Server Error";
        };
    }

    public static String pathOf(HttpServletRequest request) {
        return request == null ? null : request.getRequestURI();
    }

    /**
     * Path for Spring MVC override hooks, which only expose a {@link WebRequest}.
     */
    public static String pathOf(WebRequest request) {
        if (request == null) {
            return null;
        }
        String description = request.getDescription(false);
        return description.startsWith("uri=") ? description.substring(4) : description;
    }
}
