package uk.gegc.livequiz.shared.api.problem;

import uk.gegc.livequiz.shared.result.ErrorKind;

import java.net.URI;

/**
 * RFC 7807 {@code type} URIs served by the engine.
 * Engine failures use the slug of their {@link ErrorKind}; the constants cover
 * failures raised by the web and security layers before a service is reached.
 *
 * @see ProblemDetailBuilder
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://livequiz.gegc.uk/problems/";

    // request shape
    public static final URI VALIDATION_FAILED = type("validation-failed");
    public static final URI CONSTRAINT_VIOLATION = type("constraint-violation");
    public static final URI TYPE_MISMATCH = type("type-mismatch");
    public static final URI MALFORMED_JSON = type("malformed-json");

    // security
    public static final URI UNAUTHENTICATED = type("unauthenticated");
    public static final URI PERMISSION_DENIED = type("permission-denied");

    public static final URI DATA_CONFLICT = type("data-conflict");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static URI of(ErrorKind kind) {
        return type(kind.code());
    }

    private static URI type(String slug) {
        return URI.create(BASE_URL + slug);
    }
}
