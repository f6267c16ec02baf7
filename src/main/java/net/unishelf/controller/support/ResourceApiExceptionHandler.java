package net.unishelf.controller.support;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.unishelf.exception.InvalidCandidateException;
import net.unishelf.exception.InvalidResourceException;
import net.unishelf.exception.InvalidSearchRequestException;
import net.unishelf.exception.LocalStoreFailureException;
import net.unishelf.exception.MissingCallerIdentityException;
import net.unishelf.exception.ResourceAccessDeniedException;
import net.unishelf.exception.ResourceNotFoundException;
import net.unishelf.exception.SearchTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps resource API exceptions to the shared error envelope.
 */
@Slf4j
@RestControllerAdvice
public class ResourceApiExceptionHandler {

    @ExceptionHandler(InvalidSearchRequestException.class)
    public ResponseEntity<Map<String, Object>> invalidSearch(InvalidSearchRequestException ex) {
        return ErrorResponseUtils.error(HttpStatus.BAD_REQUEST, "Invalid search request", ex.getMessage());
    }

    @ExceptionHandler(InvalidCandidateException.class)
    public ResponseEntity<Map<String, Object>> invalidCandidate(InvalidCandidateException ex) {
        return ErrorResponseUtils.error(HttpStatus.BAD_REQUEST, "Resource cannot be imported", ex.getMessage());
    }

    @ExceptionHandler(InvalidResourceException.class)
    public ResponseEntity<Map<String, Object>> invalidResource(InvalidResourceException ex) {
        return ErrorResponseUtils.error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> unreadable(Exception ex) {
        return ErrorResponseUtils.error(HttpStatus.BAD_REQUEST, "Malformed request", ex.getMessage());
    }

    @ExceptionHandler(MissingCallerIdentityException.class)
    public ResponseEntity<Map<String, Object>> unauthenticated(MissingCallerIdentityException ex) {
        return ErrorResponseUtils.error(HttpStatus.UNAUTHORIZED, ex.getMessage());
    }

    @ExceptionHandler(ResourceAccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> accessDenied(ResourceAccessDeniedException ex) {
        return ErrorResponseUtils.error(HttpStatus.FORBIDDEN, ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(ResourceNotFoundException ex) {
        return ErrorResponseUtils.error(HttpStatus.NOT_FOUND, "Resource not found", ex.getMessage());
    }

    @ExceptionHandler(SearchTimeoutException.class)
    public ResponseEntity<Map<String, Object>> searchTimeout(SearchTimeoutException ex) {
        log.warn("Search timed out: {}", ex.getMessage());
        return ErrorResponseUtils.error(HttpStatus.GATEWAY_TIMEOUT, "Search timed out", ex.getMessage());
    }

    @ExceptionHandler(LocalStoreFailureException.class)
    public ResponseEntity<Map<String, Object>> localStoreFailure(LocalStoreFailureException ex) {
        // Already logged with its cause by the repository
        return ErrorResponseUtils.error(HttpStatus.INTERNAL_SERVER_ERROR, "Local store failure", ex.getMessage());
    }
}
