package tech.oauthplayground.flowengine.server;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.oauthplayground.flowengine.exception.ValidationException;
import tech.oauthplayground.flowengine.support.TestFlowEngineConfig;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.*;

class EndpointResolverTest {

    private static final String DISCOVERY = "/env-1/as/.well-known/openid-configuration";

    private WireMockServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(wireMockConfig().dynamicPort());
        server.start();
        baseUrl = "http://localhost:" + server.port();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private EndpointResolver resolver(boolean discovery) {
        TestFlowEngineConfig config = TestFlowEngineConfig.forServer(baseUrl).discoveryEnabled(discovery);
        return new EndpointResolver(config, new ServerHttpClient(config));
    }

    @Test
    @DisplayName("issuer should substitute the environment id into the template")
    void issuer_shouldSubstituteEnvironmentId() {
        assertThat(resolver(false).issuer("env-1")).isEqualTo(baseUrl + "/env-1/as");
    }

    @Test
    @DisplayName("issuer should reject a blank environment id")
    void issuer_shouldThrowValidation_whenEnvironmentBlank() {
        assertThatThrownBy(() -> resolver(false).issuer(" "))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.hasCode("MISSING_ENVIRONMENT_ID")).isTrue());
    }

    @Test
    @DisplayName("resolve should use conventional paths when discovery is disabled")
    void resolve_shouldUseConventionalPaths_whenDiscoveryDisabled() {
        ServerEndpoints endpoints = resolver(false).resolve("env-1");

        assertThat(endpoints.discovered()).isFalse();
        assertThat(endpoints.tokenEndpoint()).isEqualTo(baseUrl + "/env-1/as/token");
        assertThat(endpoints.deviceAuthorizationEndpoint()).isEqualTo(baseUrl + "/env-1/as/device_authorization");
        server.verify(0, getRequestedFor(anyUrl()));
    }

    @Test
    @DisplayName("resolve should use and cache the discovery document")
    void resolve_shouldUseDiscoveryDocument_andCacheIt() {
        server.stubFor(get(urlEqualTo(DISCOVERY)).willReturn(okJson("""
            {
              "issuer": "%1$s/env-1/as",
              "authorization_endpoint": "%1$s/env-1/as/authz",
              "token_endpoint": "%1$s/env-1/as/oauth2/token",
              "userinfo_endpoint": "%1$s/env-1/as/me",
              "jwks_uri": "%1$s/env-1/as/jwks"
            }
            """.formatted(baseUrl))));
        EndpointResolver resolver = resolver(true);

        ServerEndpoints first = resolver.resolve("env-1");
        ServerEndpoints second = resolver.resolve("env-1");

        assertThat(first.discovered()).isTrue();
        assertThat(first.tokenEndpoint()).isEqualTo(baseUrl + "/env-1/as/oauth2/token");
        assertThat(first.userinfoEndpoint()).isEqualTo(baseUrl + "/env-1/as/me");
        assertThat(first.deviceAuthorizationEndpoint())
            .as("missing entries fall back to conventional paths")
            .isEqualTo(baseUrl + "/env-1/as/device_authorization");
        assertThat(second).isEqualTo(first);
        server.verify(1, getRequestedFor(urlEqualTo(DISCOVERY)));
    }

    @Test
    @DisplayName("resolve should fall back and retry later when discovery fails")
    void resolve_shouldFallBack_whenDiscoveryFails() {
        server.stubFor(get(urlEqualTo(DISCOVERY)).willReturn(serverError()));
        EndpointResolver resolver = resolver(true);

        ServerEndpoints endpoints = resolver.resolve("env-1");
        resolver.resolve("env-1");

        assertThat(endpoints.discovered()).isFalse();
        assertThat(endpoints.authorizationEndpoint()).isEqualTo(baseUrl + "/env-1/as/authorize");
        server.verify(2, getRequestedFor(urlEqualTo(DISCOVERY)));
    }

    @Test
    @DisplayName("resolve should fall back when the document is not found")
    void resolve_shouldFallBack_whenDiscoveryNotFound() {
        server.stubFor(get(urlEqualTo(DISCOVERY)).willReturn(notFound()));

        assertThat(resolver(true).resolve("env-1").discovered()).isFalse();
    }
}
