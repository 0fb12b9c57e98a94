package tech.oauthplayground.flowengine.server;

/**
 * Authorization server endpoints for one environment.
 */
public record ServerEndpoints(
    String issuer,
    String authorizationEndpoint,
    String tokenEndpoint,
    String deviceAuthorizationEndpoint,
    String introspectionEndpoint,
    String userinfoEndpoint,
    boolean discovered
) {

    /**
     * Conventional endpoint paths appended to the issuer.
     */
    public static ServerEndpoints conventional(String issuer) {
        String base = issuer.endsWith("/") ? issuer.substring(0, issuer.length() - 1) : issuer;
        return new ServerEndpoints(
            base,
            base + "/authorize",
            base + "/token",
            base + "/device_authorization",
            base + "/introspect",
            base + "/userinfo",
            false);
    }

    ServerEndpoints mergeMissing(ServerEndpoints fallback) {
        return new ServerEndpoints(
            issuer != null ? issuer : fallback.issuer,
            authorizationEndpoint != null ? authorizationEndpoint : fallback.authorizationEndpoint,
            tokenEndpoint != null ? tokenEndpoint : fallback.tokenEndpoint,
            deviceAuthorizationEndpoint != null ? deviceAuthorizationEndpoint : fallback.deviceAuthorizationEndpoint,
            introspectionEndpoint != null ? introspectionEndpoint : fallback.introspectionEndpoint,
            userinfoEndpoint != null ? userinfoEndpoint : fallback.userinfoEndpoint,
            discovered);
    }
}
