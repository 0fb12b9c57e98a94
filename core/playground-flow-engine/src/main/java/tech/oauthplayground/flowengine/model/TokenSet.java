package tech.oauthplayground.flowengine.model;

import java.time.Instant;

/**
 * Tokens received from the authorization server for one grant.
 *
 * @param accessToken the access token
 * @param tokenType usually {@code Bearer}
 * @param idToken OIDC ID token, if any
 * @param refreshToken refresh token, if any
 * @param expiresIn access token lifetime in seconds, if reported
 * @param scope granted scope, if reported
 * @param receivedAt when the engine received the tokens
 */
public record TokenSet(
    String accessToken,
    String tokenType,
    String idToken,
    String refreshToken,
    Long expiresIn,
    String scope,
    Instant receivedAt
) {

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    public boolean hasIdToken() {
        return idToken != null && !idToken.isBlank();
    }
}
