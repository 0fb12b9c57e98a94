package tech.oauthplayground.flowengine.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import tech.oauthplayground.flowengine.config.FlowEngineConfig;

import java.time.Duration;
import java.util.Optional;

/**
 * Flow state store whose durable tier lives in process memory.
 *
 * <p>Good for development and single-process use. Durable entries expire after
 * {@code store.durable-ttl} without access, so abandoned flows do not accumulate.
 * @Typed keeps FlowStateStore out of the bean types so only {@link FlowStateStoreProducer}
 * provides the interface.
 */
@Singleton
@Typed(InMemoryFlowStateStore.class)
public class InMemoryFlowStateStore extends TieredFlowStateStore {

    static final Duration DEFAULT_DURABLE_TTL = Duration.ofHours(24);

    private final Cache<String, String> durableTier;

    @Inject
    public InMemoryFlowStateStore(FlowEngineConfig config) {
        this(config.store().fastTierTtl(), config.store().fastTierMaxSize(),
            config.store().durableTtl(), Ticker.systemTicker());
    }

    public InMemoryFlowStateStore(Duration fastTierTtl, long fastTierMaxSize) {
        this(fastTierTtl, fastTierMaxSize, DEFAULT_DURABLE_TTL, Ticker.systemTicker());
    }

    InMemoryFlowStateStore(Duration fastTierTtl, long fastTierMaxSize, Duration durableTtl, Ticker ticker) {
        super(fastTierTtl, fastTierMaxSize);
        this.durableTier = Caffeine.newBuilder()
            .expireAfterAccess(durableTtl)
            .ticker(ticker)
            .build();
    }

    @Override
    protected Optional<String> readDurable(String key) {
        return Optional.ofNullable(durableTier.getIfPresent(key));
    }

    @Override
    protected void writeDurable(String key, String value) {
        durableTier.put(key, value);
    }

    @Override
    protected void deleteDurable(String key) {
        durableTier.invalidate(key);
    }

    long durableSize() {
        durableTier.cleanUp();
        return durableTier.estimatedSize();
    }
}
