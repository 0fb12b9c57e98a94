package tech.oauthplayground.flowengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * OAuth 2.0 / OpenID Connect grant flows the engine can walk through.
 *
 * <p>A flow run's type never changes once the run has started.
 */
public enum FlowType {
    AUTHORIZATION_CODE("authorization_code"),
    IMPLICIT("implicit"),
    CLIENT_CREDENTIALS("client_credentials"),
    DEVICE_CODE("device_code"),
    ROPC("ropc"),
    HYBRID("hybrid");

    private final String value;

    FlowType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Flows whose result comes back through a browser redirect.
     */
    public boolean isRedirectBased() {
        return this == AUTHORIZATION_CODE || this == IMPLICIT || this == HYBRID;
    }

    /**
     * Flows that receive an authorization code and redeem it at the token endpoint.
     */
    public boolean usesAuthorizationCode() {
        return this == AUTHORIZATION_CODE || this == HYBRID;
    }

    /**
     * PKCE only applies where an authorization code is redeemed.
     */
    public boolean supportsPkce() {
        return usesAuthorizationCode();
    }

    /**
     * Flows that obtain tokens with a single direct call to the token endpoint.
     */
    public boolean isDirectGrant() {
        return this == CLIENT_CREDENTIALS || this == ROPC;
    }

    @JsonCreator
    public static FlowType fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown flow type: " + value));
    }
}
