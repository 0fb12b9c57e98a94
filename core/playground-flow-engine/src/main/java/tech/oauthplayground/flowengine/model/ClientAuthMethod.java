package tech.oauthplayground.flowengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Token endpoint client authentication methods (RFC 6749 §2.3, OIDC Core §9).
 */
public enum ClientAuthMethod {
    NONE("none"),
    CLIENT_SECRET_BASIC("client_secret_basic"),
    CLIENT_SECRET_POST("client_secret_post"),
    CLIENT_SECRET_JWT("client_secret_jwt"),
    PRIVATE_KEY_JWT("private_key_jwt");

    private final String value;

    ClientAuthMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean requiresClientSecret() {
        return this == CLIENT_SECRET_BASIC || this == CLIENT_SECRET_POST || this == CLIENT_SECRET_JWT;
    }

    @JsonCreator
    public static ClientAuthMethod fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CLIENT_SECRET_POST;
        }
        return Arrays.stream(values())
            .filter(method -> method.value.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown client authentication method: " + value));
    }
}
