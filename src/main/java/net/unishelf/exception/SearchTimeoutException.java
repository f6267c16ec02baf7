package net.unishelf.exception;

import java.time.Duration;

/**
 * The search as a whole did not settle within the request-level deadline.
 */
public class SearchTimeoutException extends RuntimeException {
    public SearchTimeoutException(Duration deadline, Throwable cause) {
        super("Search did not complete within " + deadline.toMillis() + "ms", cause);
    }
}
