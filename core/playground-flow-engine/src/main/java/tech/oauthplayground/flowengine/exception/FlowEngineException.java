package tech.oauthplayground.flowengine.exception;

import java.util.Map;

/**
 * Base exception for flow engine errors.
 */
public class FlowEngineException extends RuntimeException {

    private final int statusCode;
    private final Map<String, Object> context;

    public FlowEngineException(String message) {
        this(message, 0, null, Map.of());
    }

    public FlowEngineException(String message, int statusCode) {
        this(message, statusCode, null, Map.of());
    }

    public FlowEngineException(String message, Throwable cause) {
        this(message, 0, cause, Map.of());
    }

    public FlowEngineException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.context = context != null ? context : Map.of();
    }

    /**
     * HTTP status of the response that caused this error, 0 when no response was involved.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
