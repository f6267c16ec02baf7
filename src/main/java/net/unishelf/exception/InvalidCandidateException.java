package net.unishelf.exception;

/**
 * An external candidate cannot be imported because it has no title or no usable link.
 */
public class InvalidCandidateException extends RuntimeException {
    public InvalidCandidateException(String message) {
        super(message);
    }
}
