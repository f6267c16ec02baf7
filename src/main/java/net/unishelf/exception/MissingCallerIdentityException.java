package net.unishelf.exception;

/**
 * A mutating endpoint was called without the gateway identity headers.
 */
public class MissingCallerIdentityException extends RuntimeException {
    public MissingCallerIdentityException() {
        super("Caller identity is required for this operation");
    }
}
