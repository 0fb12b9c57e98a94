package tech.oauthplayground.flowengine.support;

import tech.oauthplayground.flowengine.config.FlowEngineConfig;
import tech.oauthplayground.flowengine.store.FlowStateStore;

import java.time.Duration;

/**
 * Hand-built configuration for unit tests, defaults match the production defaults
 * except that discovery is off.
 */
public class TestFlowEngineConfig implements FlowEngineConfig {

    private String issuerBaseUrl = "https://auth.example.test/{environmentId}/as";
    private boolean discoveryEnabled = false;
    private Duration pollInterval = Duration.ofSeconds(5);
    private int maxAttempts = 120;
    private Duration slowDownIncrement = Duration.ofSeconds(5);
    private int maxConsecutiveTransientFailures = 5;
    private FlowStateStore.StoreType storeType = FlowStateStore.StoreType.MEMORY;
    private String storeDirectory = "./flow-state";

    public static TestFlowEngineConfig forServer(String baseUrl) {
        return new TestFlowEngineConfig().issuerBaseUrl(baseUrl + "/{environmentId}/as");
    }

    public TestFlowEngineConfig issuerBaseUrl(String value) {
        this.issuerBaseUrl = value;
        return this;
    }

    public TestFlowEngineConfig discoveryEnabled(boolean value) {
        this.discoveryEnabled = value;
        return this;
    }

    public TestFlowEngineConfig pollInterval(Duration value) {
        this.pollInterval = value;
        return this;
    }

    public TestFlowEngineConfig maxAttempts(int value) {
        this.maxAttempts = value;
        return this;
    }

    public TestFlowEngineConfig maxConsecutiveTransientFailures(int value) {
        this.maxConsecutiveTransientFailures = value;
        return this;
    }

    public TestFlowEngineConfig storeType(FlowStateStore.StoreType type, String directory) {
        this.storeType = type;
        this.storeDirectory = directory;
        return this;
    }

    @Override
    public String issuerBaseUrl() {
        return issuerBaseUrl;
    }

    @Override
    public Discovery discovery() {
        return new Discovery() {
            @Override
            public boolean enabled() {
                return discoveryEnabled;
            }

            @Override
            public Duration cacheTtl() {
                return Duration.ofHours(1);
            }
        };
    }

    @Override
    public Http http() {
        return new Http() {
            @Override
            public Duration connectTimeout() {
                return Duration.ofSeconds(2);
            }

            @Override
            public Duration requestTimeout() {
                return Duration.ofSeconds(5);
            }
        };
    }

    @Override
    public Device device() {
        return new Device() {
            @Override
            public Duration pollInterval() {
                return pollInterval;
            }

            @Override
            public int maxAttempts() {
                return maxAttempts;
            }

            @Override
            public Duration slowDownIncrement() {
                return slowDownIncrement;
            }

            @Override
            public int maxConsecutiveTransientFailures() {
                return maxConsecutiveTransientFailures;
            }
        };
    }

    @Override
    public Store store() {
        return new Store() {
            @Override
            public FlowStateStore.StoreType type() {
                return storeType;
            }

            @Override
            public String directory() {
                return storeDirectory;
            }

            @Override
            public Duration fastTierTtl() {
                return Duration.ofMinutes(30);
            }

            @Override
            public long fastTierMaxSize() {
                return 1000;
            }

            @Override
            public Duration durableTtl() {
                return Duration.ofHours(24);
            }
        };
    }
}
