package tech.oauthplayground.flowengine.authorize;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.exception.ConfigurationException;
import tech.oauthplayground.flowengine.exception.ValidationException;
import tech.oauthplayground.flowengine.exception.ValidationException.ValidationError;
import tech.oauthplayground.flowengine.model.AuthorizationRequest;
import tech.oauthplayground.flowengine.model.Credentials;
import tech.oauthplayground.flowengine.model.FlowType;
import tech.oauthplayground.flowengine.model.PkcePair;
import tech.oauthplayground.flowengine.server.EndpointResolver;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the authorization redirect URL with its correlation values.
 *
 * <p>Returns the request only; recording state and nonce on the flow is the caller's job.
 */
@ApplicationScoped
public class AuthorizationRequestBuilder {

    private static final Logger LOG = Logger.getLogger(AuthorizationRequestBuilder.class);

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final int CORRELATION_BYTES = 32;

    static final String DEFAULT_HYBRID_RESPONSE_TYPE = "code id_token";
    static final Set<String> HYBRID_RESPONSE_TYPES = Set.of("code id_token", "code token", "code token id_token");

    private final EndpointResolver endpointResolver;

    @Inject
    public AuthorizationRequestBuilder(EndpointResolver endpointResolver) {
        this.endpointResolver = endpointResolver;
    }

    /**
     * @param pkce the flow's PKCE pair, or null when none has been generated
     * @throws ConfigurationException if PKCE is enabled without a pair, or the flow has no redirect
     * @throws ValidationException if client id or redirect URI is missing
     */
    public AuthorizationRequest build(FlowType flowType, Credentials credentials, PkcePair pkce) {
        if (!flowType.isRedirectBased()) {
            throw ConfigurationException.unsupportedFlow("Authorization request", flowType.value());
        }
        if (flowType.supportsPkce() && credentials.usePkce() && pkce == null) {
            throw ConfigurationException.pkceRequiredButMissing();
        }
        validate(credentials);

        String responseType = responseType(flowType, credentials);
        String state = randomToken();
        String nonce = needsNonce(flowType, credentials) ? randomToken() : null;

        List<String> scopes = new ArrayList<>(credentials.scopeList());
        if (flowType == FlowType.HYBRID && !scopes.contains("openid")) {
            scopes.add(0, "openid");
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", credentials.clientId());
        params.put("response_type", responseType);
        params.put("redirect_uri", credentials.redirectUri());
        params.put("scope", String.join(" ", scopes));
        params.put("state", state);
        if (nonce != null) {
            params.put("nonce", nonce);
        }
        if (flowType != FlowType.AUTHORIZATION_CODE) {
            params.put("response_mode", "fragment");
        }
        if (flowType.supportsPkce() && pkce != null) {
            params.put("code_challenge", pkce.codeChallenge());
            params.put("code_challenge_method", pkce.method());
        }

        String endpoint = endpointResolver.resolve(credentials.environmentId()).authorizationEndpoint();
        String url = endpoint + (endpoint.contains("?") ? "&" : "?") + encode(params);
        LOG.infof("Built %s authorization request (response_type=%s, pkce=%s)",
            flowType.value(), responseType, pkce != null && flowType.supportsPkce());
        return new AuthorizationRequest(url, state, nonce, responseType);
    }

    static String responseType(FlowType flowType, Credentials credentials) {
        return switch (flowType) {
            case AUTHORIZATION_CODE -> "code";
            case IMPLICIT -> credentials.hasScope("openid") ? "token id_token" : "token";
            case HYBRID -> {
                String requested = credentials.responseType();
                if (requested == null || requested.isBlank()) {
                    yield DEFAULT_HYBRID_RESPONSE_TYPE;
                }
                String normalized = requested.trim().replaceAll("\\s+", " ");
                if (!HYBRID_RESPONSE_TYPES.contains(normalized)) {
                    throw new ConfigurationException("Unsupported hybrid response_type: " + requested);
                }
                yield normalized;
            }
            default -> throw ConfigurationException.unsupportedFlow("Authorization request", flowType.value());
        };
    }

    private static boolean needsNonce(FlowType flowType, Credentials credentials) {
        return flowType == FlowType.IMPLICIT
            || flowType == FlowType.HYBRID
            || credentials.hasScope("openid");
    }

    private static void validate(Credentials credentials) {
        List<ValidationError> errors = new ArrayList<>();
        if (isBlank(credentials.clientId())) {
            errors.add(new ValidationError("clientId", "Client ID is required", "MISSING_CLIENT_ID"));
        }
        if (isBlank(credentials.redirectUri())) {
            errors.add(new ValidationError("redirectUri", "Redirect URI is required", "MISSING_REDIRECT_URI"));
        }
        if (!errors.isEmpty()) {
            throw ValidationException.of(errors);
        }
    }

    /**
     * 256 bits of randomness, base64url encoded.
     */
    static String randomToken() {
        byte[] bytes = new byte[CORRELATION_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static String encode(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8).replace("+", "%20"))
            .collect(Collectors.joining("&"));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
