package tech.oauthplayground.flowengine.server;

import tech.oauthplayground.flowengine.exception.ProtocolException;
import tech.oauthplayground.flowengine.model.TokenSet;

/**
 * Outcome of one token endpoint call: tokens, or an OAuth error.
 *
 * @param status HTTP status
 * @param tokens tokens on success, otherwise null
 * @param error OAuth error code on failure, otherwise null
 * @param errorDescription server supplied description, if any
 * @param interval polling interval the server asked for with {@code slow_down}, if any
 */
public record TokenEndpointResponse(
    int status,
    TokenSet tokens,
    String error,
    String errorDescription,
    Long interval
) {

    public static final String AUTHORIZATION_PENDING = "authorization_pending";
    public static final String SLOW_DOWN = "slow_down";

    public boolean isSuccess() {
        return tokens != null;
    }

    public boolean isError(String code) {
        return code.equals(error);
    }

    public ProtocolException toException() {
        return new ProtocolException(error, errorDescription, status);
    }
}
