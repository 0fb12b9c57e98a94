package tech.oauthplayground.flowengine.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.oauthplayground.flowengine.exception.ConfigurationException;
import tech.oauthplayground.flowengine.exception.ValidationException;
import tech.oauthplayground.flowengine.model.ClientAuthMethod;
import tech.oauthplayground.flowengine.model.Credentials;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ClientAuthenticatorTest {

    private static final String TOKEN_ENDPOINT = "https://auth.example.test/env-1/as/token";
    private static final String SECRET = "a-client-secret-that-is-at-least-32-bytes-long";

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    private final ClientAuthenticator authenticator = new ClientAuthenticator(clock);

    private final Map<String, String> form = new HashMap<>();
    private final Map<String, String> headers = new HashMap<>();

    private static Credentials withMethod(ClientAuthMethod method, String secret) {
        return Credentials.builder().environmentId("env-1").clientId("client 1")
            .clientSecret(secret).clientAuthMethod(method).build();
    }

    @Test
    @DisplayName("none should send only the client id")
    void authenticate_shouldSendClientIdOnly_whenNone() {
        authenticator.authenticate(withMethod(ClientAuthMethod.NONE, SECRET), TOKEN_ENDPOINT, form, headers);

        assertThat(form).containsOnly(entry("client_id", "client 1"));
        assertThat(headers).isEmpty();
    }

    @Test
    @DisplayName("client_secret_post should put the secret in the body")
    void authenticate_shouldPostSecret_whenClientSecretPost() {
        authenticator.authenticate(withMethod(ClientAuthMethod.CLIENT_SECRET_POST, SECRET), TOKEN_ENDPOINT, form, headers);

        assertThat(form).containsEntry("client_id", "client 1").containsEntry("client_secret", SECRET);
    }

    @Test
    @DisplayName("client_secret_basic should send form-encoded credentials in the Authorization header")
    void authenticate_shouldUseBasicHeader_whenClientSecretBasic() {
        authenticator.authenticate(withMethod(ClientAuthMethod.CLIENT_SECRET_BASIC, SECRET), TOKEN_ENDPOINT, form, headers);

        String expected = Base64.getEncoder()
            .encodeToString(("client+1:" + SECRET).getBytes(StandardCharsets.UTF_8));
        assertThat(headers).containsEntry("Authorization", "Basic " + expected);
        assertThat(form).doesNotContainKey("client_secret");
    }

    @Test
    @DisplayName("client_secret_jwt should send a five minute HS256 assertion for the token endpoint")
    @SuppressWarnings("unchecked")
    void authenticate_shouldSendAssertion_whenClientSecretJwt() throws Exception {
        authenticator.authenticate(withMethod(ClientAuthMethod.CLIENT_SECRET_JWT, SECRET), TOKEN_ENDPOINT, form, headers);

        assertThat(form).containsEntry("client_assertion_type", ClientAuthenticator.JWT_BEARER_ASSERTION);
        String[] parts = form.get("client_assertion").split("\\.");
        assertThat(parts).hasSize(3);
        ObjectMapper mapper = new ObjectMapper();
        Map<String, Object> header = mapper.readValue(Base64.getUrlDecoder().decode(parts[0]), Map.class);
        Map<String, Object> claims = mapper.readValue(Base64.getUrlDecoder().decode(parts[1]), Map.class);
        assertThat(header).containsEntry("alg", "HS256");
        assertThat(claims)
            .containsEntry("iss", "client 1")
            .containsEntry("sub", "client 1")
            .containsKey("jti");
        assertThat(claims.get("aud").toString()).contains(TOKEN_ENDPOINT);
        long iat = ((Number) claims.get("iat")).longValue();
        long exp = ((Number) claims.get("exp")).longValue();
        assertThat(exp - iat).isEqualTo(300);
    }

    @Test
    @DisplayName("secret-based methods should require a secret")
    void authenticate_shouldThrowValidation_whenSecretMissing() {
        assertThatThrownBy(() -> authenticator.authenticate(
            withMethod(ClientAuthMethod.CLIENT_SECRET_BASIC, null), TOKEN_ENDPOINT, form, headers))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.hasCode("MISSING_CLIENT_SECRET")).isTrue());
    }

    @Test
    @DisplayName("private_key_jwt should be rejected as unsupported")
    void authenticate_shouldThrowConfiguration_whenPrivateKeyJwt() {
        assertThatThrownBy(() -> authenticator.authenticate(
            withMethod(ClientAuthMethod.PRIVATE_KEY_JWT, SECRET), TOKEN_ENDPOINT, form, headers))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("public client identification never sends the secret")
    void identifyPublicClient_shouldOmitSecret() {
        authenticator.identifyPublicClient(withMethod(ClientAuthMethod.CLIENT_SECRET_POST, SECRET), form);

        assertThat(form).containsOnly(entry("client_id", "client 1"));
    }
}
