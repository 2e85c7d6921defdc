package ch.minigolf.minigolfbackend.web.api.controller;

import ch.minigolf.minigolfbackend.web.api.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions escaping the controllers to {@link ApiResponse} bodies.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionAdvice {

    /**
     * Malformed or missing JSON body.
     *
     * @param e parse failure
     * @return HTTP 400
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> unreadableBody(HttpMessageNotReadableException e) {
        log.debug("Rejected unreadable request body: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.failure("Invalid request body"));
    }

    /**
     * Anything else is an internal fault, except framework exceptions that carry their own status
     * (unknown path, wrong method).
     *
     * @param e unexpected exception
     * @return HTTP 500 with the exception message
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> internalError(Exception e) {
        if (e instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) e).getStatusCode();
            return ResponseEntity.status(status).body(ApiResponse.failure(e.getMessage()));
        }

        log.error("Unhandled exception in room API", e);
        String message = e.getMessage() != null ? e.getMessage() : "Unknown error";
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.failure(message));
    }
}
