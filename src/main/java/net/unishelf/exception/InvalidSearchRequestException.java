package net.unishelf.exception;

/**
 * A search request carries neither a free-text query nor any structured filter.
 */
public class InvalidSearchRequestException extends RuntimeException {
    public InvalidSearchRequestException(String message) {
        super(message);
    }
}
