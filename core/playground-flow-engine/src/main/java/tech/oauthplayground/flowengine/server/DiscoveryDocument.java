package tech.oauthplayground.flowengine.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The parts of an OpenID Provider configuration document the engine uses.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiscoveryDocument(
    @JsonProperty("issuer") String issuer,
    @JsonProperty("authorization_endpoint") String authorizationEndpoint,
    @JsonProperty("token_endpoint") String tokenEndpoint,
    @JsonProperty("device_authorization_endpoint") String deviceAuthorizationEndpoint,
    @JsonProperty("introspection_endpoint") String introspectionEndpoint,
    @JsonProperty("userinfo_endpoint") String userinfoEndpoint
) {

    ServerEndpoints toEndpoints() {
        return new ServerEndpoints(issuer, authorizationEndpoint, tokenEndpoint,
            deviceAuthorizationEndpoint, introspectionEndpoint, userinfoEndpoint, true);
    }
}
