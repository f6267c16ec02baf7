package net.unishelf.exception;

/**
 * The local resource store could not answer a query or apply a write.
 * Fatal for the request: local results are the system of record.
 */
public class LocalStoreFailureException extends RuntimeException {
    public LocalStoreFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
