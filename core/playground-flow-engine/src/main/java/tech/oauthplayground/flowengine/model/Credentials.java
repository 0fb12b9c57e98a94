package tech.oauthplayground.flowengine.model;

import java.util.Arrays;
import java.util.List;

/**
 * Client configuration supplied by the credential provider. Read-only to the engine.
 *
 * @param environmentId authorization server environment (tenant) identifier
 * @param clientId OAuth client identifier
 * @param clientSecret client secret, null for public clients
 * @param redirectUri registered redirect URI
 * @param scopes space separated scopes
 * @param usePkce whether the authorization code is protected with PKCE
 * @param clientAuthMethod token endpoint authentication method
 * @param responseType hybrid response type override, null for the flow default
 */
public record Credentials(
    String environmentId,
    String clientId,
    String clientSecret,
    String redirectUri,
    String scopes,
    boolean usePkce,
    ClientAuthMethod clientAuthMethod,
    String responseType
) {

    public Credentials {
        if (clientAuthMethod == null) {
            clientAuthMethod = clientSecret == null || clientSecret.isBlank()
                ? ClientAuthMethod.NONE
                : ClientAuthMethod.CLIENT_SECRET_POST;
        }
    }

    public List<String> scopeList() {
        if (scopes == null || scopes.isBlank()) {
            return List.of();
        }
        return Arrays.stream(scopes.trim().split("[\\s,]+")).toList();
    }

    public boolean hasScope(String scope) {
        return scopeList().contains(scope);
    }

    public boolean hasClientSecret() {
        return clientSecret != null && !clientSecret.isBlank();
    }

    public Credentials withUsePkce(boolean enabled) {
        return new Credentials(environmentId, clientId, clientSecret, redirectUri, scopes,
            enabled, clientAuthMethod, responseType);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String environmentId;
        private String clientId;
        private String clientSecret;
        private String redirectUri;
        private String scopes;
        private boolean usePkce;
        private ClientAuthMethod clientAuthMethod;
        private String responseType;

        private Builder() {
        }

        public Builder environmentId(String environmentId) {
            this.environmentId = environmentId;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder redirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
            return this;
        }

        public Builder scopes(String scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder usePkce(boolean usePkce) {
            this.usePkce = usePkce;
            return this;
        }

        public Builder clientAuthMethod(ClientAuthMethod clientAuthMethod) {
            this.clientAuthMethod = clientAuthMethod;
            return this;
        }

        public Builder responseType(String responseType) {
            this.responseType = responseType;
            return this;
        }

        public Credentials build() {
            return new Credentials(environmentId, clientId, clientSecret, redirectUri, scopes,
                usePkce, clientAuthMethod, responseType);
        }
    }
}
