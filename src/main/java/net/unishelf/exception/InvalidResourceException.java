package net.unishelf.exception;

/**
 * Upload, rating or share payload failed validation.
 */
public class InvalidResourceException extends RuntimeException {
    public InvalidResourceException(String message) {
        super(message);
    }
}
