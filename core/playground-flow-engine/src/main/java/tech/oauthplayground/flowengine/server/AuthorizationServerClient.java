package tech.oauthplayground.flowengine.server;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.exception.ProtocolException;
import tech.oauthplayground.flowengine.model.Credentials;
import tech.oauthplayground.flowengine.model.DeviceAuthorization;
import tech.oauthplayground.flowengine.model.TokenSet;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Protocol calls against the authorization server: token, device authorization,
 * introspection and userinfo endpoints.
 */
@ApplicationScoped
public class AuthorizationServerClient {

    private static final Logger LOG = Logger.getLogger(AuthorizationServerClient.class);

    private final ServerHttpClient http;
    private final EndpointResolver endpointResolver;
    private final ClientAuthenticator clientAuthenticator;
    private final Clock clock;

    @Inject
    public AuthorizationServerClient(ServerHttpClient http, EndpointResolver endpointResolver,
                                     ClientAuthenticator clientAuthenticator, Clock clock) {
        this.http = http;
        this.endpointResolver = endpointResolver;
        this.clientAuthenticator = clientAuthenticator;
        this.clock = clock;
    }

    public EndpointResolver endpoints() {
        return endpointResolver;
    }

    /**
     * Call the token endpoint.
     *
     * @param grantParameters grant_type and the grant specific parameters
     * @param publicClient send only client_id regardless of the configured auth method
     * @return tokens or the server's OAuth error
     * @throws ProtocolException if the response is neither a token body nor an OAuth error
     */
    public TokenEndpointResponse requestToken(Credentials credentials, Map<String, String> grantParameters,
                                              boolean publicClient) {
        String tokenEndpoint = endpointResolver.resolve(credentials.environmentId()).tokenEndpoint();
        Map<String, String> form = new LinkedHashMap<>(grantParameters);
        Map<String, String> headers = new LinkedHashMap<>();
        if (publicClient) {
            clientAuthenticator.identifyPublicClient(credentials, form);
        } else {
            clientAuthenticator.authenticate(credentials, tokenEndpoint, form, headers);
        }

        HttpResult result = http.postForm(tokenEndpoint, form, headers);
        String error = result.string("error");
        if (result.isSuccess() && error == null) {
            String accessToken = result.string("access_token");
            if (accessToken == null || accessToken.isBlank()) {
                throw ProtocolException.unexpectedResponse(result.status(), result.rawBody());
            }
            return new TokenEndpointResponse(result.status(), toTokenSet(result), null, null, null);
        }
        if (error == null) {
            throw ProtocolException.unexpectedResponse(result.status(), result.rawBody());
        }
        return new TokenEndpointResponse(result.status(), null, error,
            result.string("error_description"), result.number("interval"));
    }

    /**
     * Start a device authorization (RFC 8628 §3.1). Always sent as a public client.
     */
    public DeviceAuthorization requestDeviceAuthorization(Credentials credentials) {
        String endpoint = endpointResolver.resolve(credentials.environmentId()).deviceAuthorizationEndpoint();
        Map<String, String> form = new LinkedHashMap<>();
        clientAuthenticator.identifyPublicClient(credentials, form);
        if (!credentials.scopeList().isEmpty()) {
            form.put("scope", String.join(" ", credentials.scopeList()));
        }

        HttpResult result = http.postForm(endpoint, form, Map.of());
        if (!result.isSuccess()) {
            throw errorFrom(result);
        }

        String deviceCode = result.string("device_code");
        String userCode = result.string("user_code");
        String verificationUri = result.string("verification_uri");
        Long expiresIn = result.number("expires_in");
        if (deviceCode == null || userCode == null || verificationUri == null || expiresIn == null) {
            throw ProtocolException.unexpectedResponse(result.status(), result.rawBody());
        }
        Long interval = result.number("interval");
        Instant now = clock.instant();
        return new DeviceAuthorization(deviceCode, userCode, verificationUri,
            result.string("verification_uri_complete"), expiresIn,
            interval != null ? interval.intValue() : null,
            now.plusSeconds(expiresIn));
    }

    /**
     * Token introspection (RFC 7662) authenticated with the client's configured method.
     */
    public Map<String, Object> introspect(Credentials credentials, String token) {
        String endpoint = endpointResolver.resolve(credentials.environmentId()).introspectionEndpoint();
        Map<String, String> form = new LinkedHashMap<>();
        Map<String, String> headers = new LinkedHashMap<>();
        form.put("token", token);
        form.put("token_type_hint", "access_token");
        clientAuthenticator.authenticate(credentials, endpoint, form, headers);

        HttpResult result = http.postForm(endpoint, form, headers);
        if (!result.isSuccess()) {
            throw errorFrom(result);
        }
        return result.body();
    }

    public Map<String, Object> userInfo(Credentials credentials, String accessToken) {
        String endpoint = endpointResolver.resolve(credentials.environmentId()).userinfoEndpoint();
        HttpResult result = http.get(endpoint, Map.of("Authorization", "Bearer " + accessToken));
        if (!result.isSuccess()) {
            throw errorFrom(result);
        }
        return result.body();
    }

    private TokenSet toTokenSet(HttpResult result) {
        return new TokenSet(
            result.string("access_token"),
            result.string("token_type"),
            result.string("id_token"),
            result.string("refresh_token"),
            result.number("expires_in"),
            result.string("scope"),
            clock.instant());
    }

    private static ProtocolException errorFrom(HttpResult result) {
        String error = result.string("error");
        if (error == null) {
            return ProtocolException.unexpectedResponse(result.status(), result.rawBody());
        }
        LOG.debugf("Authorization server error %s (HTTP %d)", error, result.status());
        return new ProtocolException(error, result.string("error_description"), result.status());
    }
}
