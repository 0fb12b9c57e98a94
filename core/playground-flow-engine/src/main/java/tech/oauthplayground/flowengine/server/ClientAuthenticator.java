package tech.oauthplayground.flowengine.server;

import io.smallrye.jwt.build.Jwt;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.oauthplayground.flowengine.exception.ConfigurationException;
import tech.oauthplayground.flowengine.exception.ValidationException;
import tech.oauthplayground.flowengine.model.ClientAuthMethod;
import tech.oauthplayground.flowengine.model.Credentials;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.UUID;

/**
 * Adds client authentication to a token endpoint request.
 *
 * <ul>
 *   <li>none - client_id in the body</li>
 *   <li>client_secret_post - client_id and client_secret in the body</li>
 *   <li>client_secret_basic - HTTP Basic header (RFC 6749 §2.3.1)</li>
 *   <li>client_secret_jwt - HS256 client assertion (RFC 7523)</li>
 * </ul>
 */
@ApplicationScoped
public class ClientAuthenticator {

    static final String JWT_BEARER_ASSERTION = "urn:ietf:params:oauth:client-assertion-type:jwt-bearer";
    static final Duration ASSERTION_LIFETIME = Duration.ofMinutes(5);

    private final Clock clock;

    @Inject
    public ClientAuthenticator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Authenticate with the client's configured method.
     *
     * @param form request body parameters, mutated
     * @param headers request headers, mutated
     */
    public void authenticate(Credentials credentials, String tokenEndpoint,
                             Map<String, String> form, Map<String, String> headers) {
        ClientAuthMethod method = credentials.clientAuthMethod();
        if (method.requiresClientSecret() && !credentials.hasClientSecret()) {
            throw ValidationException.single("clientSecret",
                "Client secret is required for " + method.value(), "MISSING_CLIENT_SECRET");
        }

        switch (method) {
            case NONE -> form.put("client_id", credentials.clientId());
            case CLIENT_SECRET_POST -> {
                form.put("client_id", credentials.clientId());
                form.put("client_secret", credentials.clientSecret());
            }
            case CLIENT_SECRET_BASIC -> headers.put("Authorization", basic(credentials));
            case CLIENT_SECRET_JWT -> {
                form.put("client_id", credentials.clientId());
                form.put("client_assertion_type", JWT_BEARER_ASSERTION);
                form.put("client_assertion", clientAssertion(credentials, tokenEndpoint));
            }
            case PRIVATE_KEY_JWT -> throw ConfigurationException.unsupportedClientAuth(method.value());
        }
    }

    /**
     * Public client identification: client_id only, never the secret.
     */
    public void identifyPublicClient(Credentials credentials, Map<String, String> form) {
        form.put("client_id", credentials.clientId());
    }

    private static String basic(Credentials credentials) {
        String pair = ServerHttpClient.encode(credentials.clientId()) + ":" + ServerHttpClient.encode(credentials.clientSecret());
        return "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
    }

    String clientAssertion(Credentials credentials, String tokenEndpoint) {
        Instant now = clock.instant();
        return Jwt.issuer(credentials.clientId())
            .subject(credentials.clientId())
            .audience(tokenEndpoint)
            .claim("jti", UUID.randomUUID().toString())
            .issuedAt(now)
            .expiresAt(now.plus(ASSERTION_LIFETIME))
            .jws()
            .signWithSecret(credentials.clientSecret());
    }
}
