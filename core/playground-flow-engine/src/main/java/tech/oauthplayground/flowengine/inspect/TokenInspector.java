package tech.oauthplayground.flowengine.inspect;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.exception.ValidationException;
import tech.oauthplayground.flowengine.model.Credentials;
import tech.oauthplayground.flowengine.model.FlowState;
import tech.oauthplayground.flowengine.server.AuthorizationServerClient;

import java.util.Map;

/**
 * Introspection and userinfo calls for the flow's access token.
 */
@ApplicationScoped
public class TokenInspector {

    private static final Logger LOG = Logger.getLogger(TokenInspector.class);

    private final AuthorizationServerClient serverClient;

    @Inject
    public TokenInspector(AuthorizationServerClient serverClient) {
        this.serverClient = serverClient;
    }

    public Map<String, Object> introspect(FlowState flow, Credentials credentials) {
        requireAccessToken(flow);
        Map<String, Object> claims = serverClient.introspect(credentials, flow.getTokens().accessToken());
        LOG.infof("Introspected access token for flow [%s]: active=%s", flow.getFlowId(), claims.get("active"));
        return claims;
    }

    public Map<String, Object> fetchUserInfo(FlowState flow, Credentials credentials) {
        requireAccessToken(flow);
        Map<String, Object> claims = serverClient.userInfo(credentials, flow.getTokens().accessToken());
        LOG.infof("Fetched userinfo for flow [%s] (%d claims)", flow.getFlowId(), claims.size());
        return claims;
    }

    private static void requireAccessToken(FlowState flow) {
        if (!flow.hasAccessToken()) {
            throw ValidationException.single("accessToken", "An access token is required", "MISSING_ACCESS_TOKEN");
        }
    }
}
