package net.unishelf.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Small helper for producing consistent error payloads across controllers.
 * Every body has {@code success=false} and a human readable {@code message};
 * {@code error} carries the detail when there is one.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, Object> errorBody(String message) {
        return errorBody(message, null);
    }

    public static Map<String, Object> errorBody(String message, String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", message);
        if (detail != null && !detail.isBlank()) {
            body.put("error", detail);
        }
        return body;
    }

    public static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return error(status, message, null);
    }

    public static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, String detail) {
        return ResponseEntity.status(status).body(errorBody(message, detail));
    }
}
