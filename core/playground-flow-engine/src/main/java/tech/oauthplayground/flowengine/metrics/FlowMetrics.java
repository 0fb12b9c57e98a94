package tech.oauthplayground.flowengine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Counters for device polling and token requests.
 */
@ApplicationScoped
public class FlowMetrics {

    static final String POLL_ATTEMPTS = "oauth_playground.device.poll.attempts";
    static final String TOKEN_REQUESTS = "oauth_playground.token.requests";

    private final MeterRegistry meterRegistry;

    @Inject
    public FlowMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param outcome pending, slow_down, success, error or transient
     */
    public void recordPollAttempt(String outcome) {
        Counter.builder(POLL_ATTEMPTS)
            .tag("outcome", outcome)
            .description("Device code token endpoint poll attempts")
            .register(meterRegistry)
            .increment();
    }

    public void recordTokenRequest(String grant, String outcome) {
        Counter.builder(TOKEN_REQUESTS)
            .tag("grant", grant)
            .tag("outcome", outcome)
            .description("Token endpoint requests by grant type")
            .register(meterRegistry)
            .increment();
    }

    public double pollAttempts(String outcome) {
        Counter counter = meterRegistry.find(POLL_ATTEMPTS).tag("outcome", outcome).counter();
        return counter != null ? counter.count() : 0;
    }

    public double tokenRequests(String grant, String outcome) {
        Counter counter = meterRegistry.find(TOKEN_REQUESTS).tag("grant", grant).tag("outcome", outcome).counter();
        return counter != null ? counter.count() : 0;
    }
}
