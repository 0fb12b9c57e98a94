package tech.oauthplayground.flowengine.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import tech.oauthplayground.flowengine.store.FlowStateStore;

import java.time.Duration;

/**
 * Configuration for the flow engine.
 *
 * <pre>
 * oauth-playground.issuer-base-url=https://auth.pingone.com/{environmentId}/as
 * oauth-playground.device.poll-interval=5s
 * oauth-playground.store.type=MEMORY|FILE
 * </pre>
 */
@ConfigMapping(prefix = "oauth-playground")
public interface FlowEngineConfig {

    /**
     * Issuer URL template. {@code {environmentId}} is replaced per flow.
     */
    @WithDefault("https://auth.pingone.com/{environmentId}/as")
    String issuerBaseUrl();

    Discovery discovery();

    Http http();

    Device device();

    Store store();

    interface Discovery {
        /**
         * Fetch the OpenID discovery document. When false, or when the fetch fails,
         * conventional endpoint paths are appended to the issuer.
         */
        @WithDefault("true")
        boolean enabled();

        @WithDefault("1h")
        Duration cacheTtl();
    }

    interface Http {
        @WithDefault("10s")
        Duration connectTimeout();

        @WithDefault("30s")
        Duration requestTimeout();
    }

    interface Device {
        /**
         * Base interval between token endpoint polls.
         */
        @WithDefault("5s")
        Duration pollInterval();

        /**
         * Hard cap on poll attempts per run.
         */
        @WithDefault("120")
        int maxAttempts();

        /**
         * Added to the interval on {@code slow_down} when the server does not name one.
         */
        @WithDefault("5s")
        Duration slowDownIncrement();

        @WithDefault("5")
        int maxConsecutiveTransientFailures();
    }

    interface Store {
        @WithDefault("MEMORY")
        FlowStateStore.StoreType type();

        /**
         * Directory for the FILE durable tier.
         */
        @WithDefault("./flow-state")
        String directory();

        @WithDefault("30m")
        Duration fastTierTtl();

        @WithDefault("1000")
        long fastTierMaxSize();

        /**
         * Idle time after which the MEMORY durable tier drops an entry.
         */
        @WithDefault("24h")
        Duration durableTtl();
    }
}
