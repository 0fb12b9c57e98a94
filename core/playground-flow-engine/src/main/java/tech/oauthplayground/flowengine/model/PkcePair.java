package tech.oauthplayground.flowengine.model;

/**
 * A PKCE code verifier and its derived challenge (RFC 7636).
 * The two values only ever travel together.
 *
 * @param codeVerifier high-entropy random verifier, 43-128 unreserved characters
 * @param codeChallenge BASE64URL(SHA256(codeVerifier))
 * @param method challenge method, always {@code S256}
 */
public record PkcePair(String codeVerifier, String codeChallenge, String method) {

    public static final String METHOD_S256 = "S256";

    public PkcePair {
        if (codeVerifier == null || codeVerifier.isBlank() || codeChallenge == null || codeChallenge.isBlank()) {
            throw new IllegalArgumentException("PKCE verifier and challenge must both be present");
        }
        if (method == null) {
            method = METHOD_S256;
        }
    }

    public PkcePair(String codeVerifier, String codeChallenge) {
        this(codeVerifier, codeChallenge, METHOD_S256);
    }
}
