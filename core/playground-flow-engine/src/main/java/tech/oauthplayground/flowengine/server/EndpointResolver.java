package tech.oauthplayground.flowengine.server;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.config.FlowEngineConfig;
import tech.oauthplayground.flowengine.exception.FlowEngineException;
import tech.oauthplayground.flowengine.exception.ValidationException;

import java.util.Map;

/**
 * Resolves the authorization server endpoints for an environment.
 *
 * <p>The issuer comes from the configured template. When discovery is enabled the
 * OpenID configuration document is fetched and cached; a failed fetch falls back to
 * conventional paths and is retried on the next call.
 */
@ApplicationScoped
public class EndpointResolver {

    private static final Logger LOG = Logger.getLogger(EndpointResolver.class);

    static final String ENVIRONMENT_PLACEHOLDER = "{environmentId}";
    static final String DISCOVERY_PATH = "/.well-known/openid-configuration";

    private final FlowEngineConfig config;
    private final ServerHttpClient http;
    private final Cache<String, ServerEndpoints> discovered;

    @Inject
    public EndpointResolver(FlowEngineConfig config, ServerHttpClient http) {
        this.config = config;
        this.http = http;
        this.discovered = Caffeine.newBuilder()
            .expireAfterWrite(config.discovery().cacheTtl())
            .maximumSize(100)
            .build();
    }

    public String issuer(String environmentId) {
        if (environmentId == null || environmentId.isBlank()) {
            throw ValidationException.single("environmentId", "Environment ID is required", "MISSING_ENVIRONMENT_ID");
        }
        String issuer = config.issuerBaseUrl().replace(ENVIRONMENT_PLACEHOLDER, environmentId.trim());
        return issuer.endsWith("/") ? issuer.substring(0, issuer.length() - 1) : issuer;
    }

    public ServerEndpoints resolve(String environmentId) {
        String issuer = issuer(environmentId);
        ServerEndpoints fallback = ServerEndpoints.conventional(issuer);
        if (!config.discovery().enabled()) {
            return fallback;
        }

        ServerEndpoints cached = discovered.getIfPresent(issuer);
        if (cached != null) {
            return cached;
        }

        try {
            HttpResult result = http.get(issuer + DISCOVERY_PATH, Map.of());
            if (!result.isSuccess() || result.body().isEmpty()) {
                LOG.warnf("Discovery for [%s] returned HTTP %d, using conventional endpoints", issuer, result.status());
                return fallback;
            }
            DiscoveryDocument document = http.objectMapper().convertValue(result.body(), DiscoveryDocument.class);
            ServerEndpoints endpoints = document.toEndpoints().mergeMissing(fallback);
            discovered.put(issuer, endpoints);
            LOG.infof("Discovered endpoints for issuer [%s]", issuer);
            return endpoints;
        } catch (FlowEngineException | IllegalArgumentException e) {
            LOG.warnf("Discovery for [%s] failed (%s), using conventional endpoints", issuer, e.getMessage());
            return fallback;
        }
    }

    public void invalidate(String environmentId) {
        discovered.invalidate(issuer(environmentId));
    }
}
