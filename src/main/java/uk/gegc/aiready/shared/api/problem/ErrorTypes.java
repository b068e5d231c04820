package uk.gegc.aiready.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://ai-ready-converter.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI UNSUPPORTED_FORMAT = URI.create(BASE_URL + "/unsupported-format");

    // ==================== Limit Errors ====================
    public static final URI FILE_TOO_LARGE = URI.create(BASE_URL + "/file-too-large");
    public static final URI SESSION_QUOTA_EXCEEDED = URI.create(BASE_URL + "/session-quota-exceeded");

    // ==================== State Errors ====================
    public static final URI INVALID_STATE_TRANSITION = URI.create(BASE_URL + "/invalid-state-transition");
    public static final URI NOTHING_TO_ARCHIVE = URI.create(BASE_URL + "/nothing-to-archive");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
