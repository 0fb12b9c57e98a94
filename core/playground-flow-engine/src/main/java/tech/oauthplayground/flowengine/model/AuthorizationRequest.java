package tech.oauthplayground.flowengine.model;

/**
 * A built authorization redirect together with its correlation values.
 * Nothing is stored by the builder; the caller records state and nonce.
 *
 * @param url full authorization endpoint URL including query parameters
 * @param state CSRF correlation value
 * @param nonce ID token replay protection value, null when no ID token is requested
 * @param responseType the {@code response_type} sent
 */
public record AuthorizationRequest(String url, String state, String nonce, String responseType) {
}
