package tech.oauthplayground.flowengine.model;

/**
 * Normalized outcome of an authorization redirect, taken from the query
 * string, the fragment, or both depending on the flow type.
 */
public record CallbackResult(
    String code,
    String state,
    String accessToken,
    String idToken,
    String tokenType,
    Long expiresIn,
    String scope,
    String error,
    String errorDescription
) {

    public static CallbackResult empty() {
        return new CallbackResult(null, null, null, null, null, null, null, null, null);
    }

    public boolean isError() {
        return error != null && !error.isBlank();
    }

    public boolean hasCode() {
        return code != null && !code.isBlank();
    }

    public boolean hasTokens() {
        return (accessToken != null && !accessToken.isBlank()) || (idToken != null && !idToken.isBlank());
    }

    public boolean isEmpty() {
        return !hasCode() && !hasTokens() && !isError() && state == null;
    }
}
