package co.fanki.specsync.shared;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Error body returned by the REST controllers.
 *
 * @param code the {@link DomainException} error code
 * @param message the error message
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ErrorResponse(String code, String message) {

    /**
     * Maps a domain exception to a response, 404 for unknown ids, 400 for
     * invalid input and 500 otherwise.
     *
     * @param e the exception
     * @return the response entity
     */
    public static ResponseEntity<ErrorResponse> of(final DomainException e) {
        final HttpStatus status = switch (e.getErrorCode()) {
            case "PROJECT_NOT_FOUND", "FEATURE_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "INVALID_PROJECT_ROOT" -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

}
