package tech.oauthplayground.flowengine.server;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.config.FlowEngineConfig;
import tech.oauthplayground.flowengine.exception.TransientException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thin HTTP layer over {@link HttpClient} for form posts and JSON reads against the
 * authorization server.
 *
 * <p>Transport failures and 5xx responses raise {@link TransientException}; every
 * other response is returned to the caller to interpret.
 */
@ApplicationScoped
public class ServerHttpClient {

    private static final Logger LOG = Logger.getLogger(ServerHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    @Inject
    public ServerHttpClient(FlowEngineConfig config) {
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(config.http().connectTimeout())
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.requestTimeout = config.http().requestTimeout();
    }

    public HttpResult postForm(String url, Map<String, String> form, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .timeout(requestTimeout)
            .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)));
        headers.forEach(builder::header);
        return send(builder.build(), url);
    }

    public HttpResult get(String url, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Accept", "application/json")
            .timeout(requestTimeout)
            .GET();
        headers.forEach(builder::header);
        return send(builder.build(), url);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private HttpResult send(HttpRequest request, String url) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw TransientException.network(url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientException("Interrupted while calling " + url, e);
        }

        int status = response.statusCode();
        LOG.debugf("%s %s -> %d", request.method(), url, status);
        if (status >= 500) {
            throw TransientException.serverError(url, status);
        }
        return new HttpResult(status, parseBody(response.body()), response.body());
    }

    private Map<String, Object> parseBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            LOG.debugf("Response body is not a JSON object: %s", e.getMessage());
            return Map.of();
        }
    }

    static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
            .filter(e -> e.getValue() != null)
            .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&"));
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
