package tech.oauthplayground.flowengine.exception;

/**
 * Persisted flow data is inconsistent, e.g. a PKCE challenge stored without its verifier.
 */
public class FlowStateCorruptionException extends FlowEngineException {

    public FlowStateCorruptionException(String message) {
        super(message);
    }

    public FlowStateCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static FlowStateCorruptionException halfPkcePair(String flowId) {
        return new FlowStateCorruptionException(
            "Stored PKCE data for flow " + flowId + " has a verifier or challenge without its counterpart");
    }
}
