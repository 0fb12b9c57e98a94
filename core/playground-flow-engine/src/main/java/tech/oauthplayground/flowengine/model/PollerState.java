package tech.oauthplayground.flowengine.model;

/**
 * Lifecycle of a device authorization polling run.
 *
 * <pre>
 * IDLE -> AUTHORIZING -> POLLING -> SUCCEEDED | EXPIRED | CANCELLED | FAILED
 * </pre>
 */
public enum PollerState {
    IDLE,
    AUTHORIZING,
    POLLING,
    SUCCEEDED,
    EXPIRED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXPIRED || this == CANCELLED || this == FAILED;
    }
}
