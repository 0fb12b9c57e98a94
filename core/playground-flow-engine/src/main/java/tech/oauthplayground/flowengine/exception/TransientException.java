package tech.oauthplayground.flowengine.exception;

/**
 * Network-level failure or a server-side (5xx) error. Retried by the device poller,
 * surfaced directly everywhere else.
 */
public class TransientException extends FlowEngineException {

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientException(String message, int statusCode) {
        super(message, statusCode);
    }

    public static TransientException network(String endpoint, Throwable cause) {
        return new TransientException("Request to " + endpoint + " failed: " + cause.getMessage(), cause);
    }

    public static TransientException serverError(String endpoint, int statusCode) {
        return new TransientException("Authorization server error from " + endpoint + ": HTTP " + statusCode, statusCode);
    }
}
