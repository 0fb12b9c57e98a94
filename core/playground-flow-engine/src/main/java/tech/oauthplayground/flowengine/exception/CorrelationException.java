package tech.oauthplayground.flowengine.exception;

/**
 * A returned correlation value (state or nonce) did not match the one the engine generated.
 * The extracted data must be discarded.
 */
public class CorrelationException extends FlowEngineException {

    public CorrelationException(String message) {
        super(message);
    }

    public static CorrelationException stateMismatch() {
        return new CorrelationException("State parameter does not match the authorization request");
    }

    public static CorrelationException stateMissing() {
        return new CorrelationException("Authorization response did not include a state parameter");
    }

    public static CorrelationException noRequestInProgress() {
        return new CorrelationException("No authorization request state is recorded for this flow");
    }

    public static CorrelationException nonceMismatch() {
        return new CorrelationException("ID token nonce does not match the authorization request");
    }

    public static CorrelationException nonceMissing() {
        return new CorrelationException("ID token does not carry the expected nonce claim");
    }
}
