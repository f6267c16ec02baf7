package net.unishelf.util;

import org.slf4j.Logger;

/**
 * Centralized console logging for calls to external bibliographic providers
 * and for the search fan-out around them.
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String query, int maxResults, boolean authenticated) {
        String authType = authenticated ? "AUTHENTICATED" : "UNAUTHENTICATED";
        log.info(String.format("%s [%s] %s ATTEMPT: search for query='%s', maxResults=%d",
            PREFIX, apiName, authType, query, maxResults));
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String query, int resultCount) {
        log.info(String.format("%s [%s] SUCCESS: search returned %d result(s) for query='%s'",
            PREFIX, apiName, resultCount, query));
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String query, String reason) {
        log.warn(String.format("%s [%s] FAILURE: search failed for query='%s' - %s",
            PREFIX, apiName, query, reason));
    }

    /**
     * Log a provider skipped because it is switched off or has no credential
     */
    public static void logProviderDisabled(Logger log, String apiName, String query, String reason) {
        log.debug(String.format("%s [%s] DISABLED: skipped query='%s' (%s)",
            PREFIX, apiName, query, reason));
    }

    /**
     * Log the start of a search fan-out
     */
    public static void logFanOutStart(Logger log, String query, Iterable<String> sources) {
        log.info(String.format("%s [FAN-OUT] START: query='%s', sources=%s", PREFIX, query, sources));
    }

    /**
     * Log the completion of a search fan-out
     */
    public static void logFanOutComplete(Logger log, String query, long localTotal, int externalResults) {
        log.info(String.format("%s [FAN-OUT] COMPLETE: query='%s', localTotal=%d, externalResults=%d",
            PREFIX, query, localTotal, externalResults));
    }
}
