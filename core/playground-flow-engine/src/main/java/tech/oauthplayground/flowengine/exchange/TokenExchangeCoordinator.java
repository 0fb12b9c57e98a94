package tech.oauthplayground.flowengine.exchange;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.exception.ConfigurationException;
import tech.oauthplayground.flowengine.exception.FlowEngineException;
import tech.oauthplayground.flowengine.exception.ValidationException;
import tech.oauthplayground.flowengine.exception.ValidationException.ValidationError;
import tech.oauthplayground.flowengine.metrics.FlowMetrics;
import tech.oauthplayground.flowengine.model.Credentials;
import tech.oauthplayground.flowengine.model.FlowState;
import tech.oauthplayground.flowengine.model.FlowType;
import tech.oauthplayground.flowengine.model.TokenSet;
import tech.oauthplayground.flowengine.pkce.PkceCodeManager;
import tech.oauthplayground.flowengine.server.AuthorizationServerClient;
import tech.oauthplayground.flowengine.server.TokenEndpointResponse;
import tech.oauthplayground.flowengine.support.Masking;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redeems an authorization code, or performs a direct grant, exactly once per flow.
 * Also refreshes the tokens a flow already holds.
 *
 * <p>All preconditions are checked before any network call. Once a flow holds an
 * access token a repeat call returns those tokens without contacting the server.
 */
@ApplicationScoped
public class TokenExchangeCoordinator {

    private static final Logger LOG = Logger.getLogger(TokenExchangeCoordinator.class);

    public static final String AUTHORIZATION_CODE_ALREADY_USED = "AUTHORIZATION_CODE_ALREADY_USED";
    public static final String MISSING_REFRESH_TOKEN = "MISSING_REFRESH_TOKEN";

    private final AuthorizationServerClient serverClient;
    private final PkceCodeManager pkceCodeManager;
    private final FlowMetrics metrics;

    @Inject
    public TokenExchangeCoordinator(AuthorizationServerClient serverClient,
                                    PkceCodeManager pkceCodeManager,
                                    FlowMetrics metrics) {
        this.serverClient = serverClient;
        this.pkceCodeManager = pkceCodeManager;
        this.metrics = metrics;
    }

    /**
     * Exchange the flow's authorization code for tokens.
     *
     * <p>With PKCE enabled and no verifier on the flow, the stored pair is loaded first.
     *
     * @throws ValidationException if a precondition fails, or the code was already submitted
     */
    public TokenSet exchange(FlowState flow, Credentials credentials) {
        if (!flow.getFlowType().usesAuthorizationCode()) {
            throw ConfigurationException.unsupportedFlow("Authorization code exchange", flow.getFlowType().value());
        }
        if (flow.hasAccessToken()) {
            LOG.debugf("Flow [%s] already holds tokens, exchange skipped", flow.getFlowId());
            return flow.getTokens();
        }
        if (credentials.usePkce() && !flow.hasPkcePair()) {
            pkceCodeManager.load(flow.getFlowId()).ifPresent(pair -> {
                LOG.debugf("Restored PKCE pair for flow [%s] from the flow state store", flow.getFlowId());
                flow.setPkcePair(pair);
            });
        }

        List<ValidationError> errors = ExchangeReadiness.check(flow, credentials);
        if (!errors.isEmpty()) {
            throw ValidationException.of(errors);
        }
        if (!flow.markAuthorizationCodeRedeemed()) {
            throw ValidationException.single("authorizationCode",
                "This authorization code has already been submitted; authorize again to obtain a new one",
                AUTHORIZATION_CODE_ALREADY_USED);
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", flow.getAuthorizationCode());
        if (!ExchangeReadiness.isBlank(credentials.redirectUri())) {
            form.put("redirect_uri", credentials.redirectUri());
        }
        if (credentials.usePkce()) {
            form.put("code_verifier", flow.getCodeVerifier());
        }

        LOG.infof("Exchanging authorization code %s for flow [%s] (pkce=%s)",
            Masking.mask(flow.getAuthorizationCode()), flow.getFlowId(), credentials.usePkce());
        TokenSet tokens = call(credentials, form, "authorization_code");
        flow.setTokens(tokens);
        return tokens;
    }

    /**
     * Client credentials or resource owner password grant. The password is held on the
     * flow only for the duration of the call.
     *
     * @param username resource owner username, ignored for client credentials
     * @param password resource owner password, ignored for client credentials
     */
    public TokenSet requestDirect(FlowState flow, Credentials credentials, String username, String password) {
        FlowType flowType = flow.getFlowType();
        if (!flowType.isDirectGrant()) {
            throw ConfigurationException.unsupportedFlow("Direct token request", flowType.value());
        }
        if (flow.hasAccessToken()) {
            LOG.debugf("Flow [%s] already holds tokens, request skipped", flow.getFlowId());
            return flow.getTokens();
        }

        List<ValidationError> errors = new ArrayList<>();
        if (ExchangeReadiness.isBlank(credentials.clientId())) {
            errors.add(new ValidationError("clientId", "Client ID is required", ExchangeReadiness.MISSING_CLIENT_ID));
        }
        if (ExchangeReadiness.isBlank(credentials.environmentId())) {
            errors.add(new ValidationError("environmentId", "Environment ID is required",
                ExchangeReadiness.MISSING_ENVIRONMENT_ID));
        }
        if (flowType == FlowType.CLIENT_CREDENTIALS && !credentials.hasClientSecret()) {
            errors.add(new ValidationError("clientSecret",
                "Client secret is required for client credentials", "MISSING_CLIENT_SECRET"));
        }
        if (flowType == FlowType.ROPC) {
            if (ExchangeReadiness.isBlank(username)) {
                errors.add(new ValidationError("username", "Username is required", "MISSING_USERNAME"));
            }
            if (password == null || password.isEmpty()) {
                errors.add(new ValidationError("password", "Password is required", "MISSING_PASSWORD"));
            }
        }
        if (!errors.isEmpty()) {
            throw ValidationException.of(errors);
        }

        Map<String, String> form = new LinkedHashMap<>();
        if (!credentials.scopeList().isEmpty()) {
            form.put("scope", String.join(" ", credentials.scopeList()));
        }

        if (flowType == FlowType.CLIENT_CREDENTIALS) {
            form.put("grant_type", "client_credentials");
            LOG.infof("Requesting client credentials token for flow [%s]", flow.getFlowId());
            TokenSet tokens = call(credentials, form, "client_credentials");
            flow.setTokens(tokens);
            return tokens;
        }

        flow.setResourceOwnerCredentials(username, password);
        try {
            form.put("grant_type", "password");
            form.put("username", flow.getUsername());
            form.put("password", flow.getPassword());
            LOG.infof("Requesting resource owner password token for flow [%s]", flow.getFlowId());
            TokenSet tokens = call(credentials, form, "password");
            flow.setTokens(tokens);
            return tokens;
        } finally {
            flow.clearResourceOwnerCredentials();
        }
    }

    /**
     * Trade the flow's refresh token for a new access token. The client authenticates
     * with its configured method. A response without a refresh token keeps the current one.
     *
     * @throws ValidationException if the flow holds no refresh token or the client is not configured
     */
    public TokenSet refresh(FlowState flow, Credentials credentials) {
        TokenSet current = flow.getTokens();
        List<ValidationError> errors = new ArrayList<>();
        if (current == null || ExchangeReadiness.isBlank(current.refreshToken())) {
            errors.add(new ValidationError("refreshToken", "No refresh token available", MISSING_REFRESH_TOKEN));
        }
        if (ExchangeReadiness.isBlank(credentials.clientId())) {
            errors.add(new ValidationError("clientId", "Client ID is required", ExchangeReadiness.MISSING_CLIENT_ID));
        }
        if (ExchangeReadiness.isBlank(credentials.environmentId())) {
            errors.add(new ValidationError("environmentId", "Environment ID is required",
                ExchangeReadiness.MISSING_ENVIRONMENT_ID));
        }
        if (!errors.isEmpty()) {
            throw ValidationException.of(errors);
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", current.refreshToken().trim());

        LOG.infof("Refreshing tokens for flow [%s], refreshToken=%s",
            flow.getFlowId(), Masking.mask(current.refreshToken()));
        TokenSet received = call(credentials, form, "refresh_token");
        TokenSet tokens = received.refreshToken() != null
            ? received
            : new TokenSet(received.accessToken(), received.tokenType(), received.idToken(),
                current.refreshToken(), received.expiresIn(), received.scope(), received.receivedAt());
        flow.setTokens(tokens);
        return tokens;
    }

    private TokenSet call(Credentials credentials, Map<String, String> form, String grant) {
        TokenEndpointResponse response;
        try {
            response = serverClient.requestToken(credentials, form, false);
        } catch (FlowEngineException e) {
            metrics.recordTokenRequest(grant, "failure");
            LOG.errorf("Token request (%s) failed: %s", grant, e.getMessage());
            throw e;
        }
        if (!response.isSuccess()) {
            metrics.recordTokenRequest(grant, "error");
            LOG.errorf("Token request (%s) rejected: %s", grant, response.error());
            throw response.toException();
        }
        metrics.recordTokenRequest(grant, "success");
        LOG.infof("Tokens received (%s): accessToken=%s, idToken=%s, refreshToken=%s", grant,
            Masking.mask(response.tokens().accessToken()),
            response.tokens().hasIdToken(), response.tokens().refreshToken() != null);
        return response.tokens();
    }
}
