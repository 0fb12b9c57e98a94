package tech.oauthplayground.flowengine.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine fast tier in front of a durable tier supplied by the subclass.
 * A durable hit is promoted back into the fast tier.
 */
public abstract class TieredFlowStateStore implements FlowStateStore {

    private static final Logger LOG = Logger.getLogger(TieredFlowStateStore.class);

    private final Cache<String, String> fastTier;

    protected TieredFlowStateStore(Duration fastTierTtl, long fastTierMaxSize) {
        this.fastTier = Caffeine.newBuilder()
            .expireAfterWrite(fastTierTtl)
            .maximumSize(fastTierMaxSize)
            .build();
    }

    protected abstract Optional<String> readDurable(String key);

    protected abstract void writeDurable(String key, String value);

    protected abstract void deleteDurable(String key);

    @Override
    public void put(String key, String value) {
        writeDurable(key, value);
        fastTier.put(key, value);
    }

    @Override
    public Optional<String> getFast(String key) {
        return Optional.ofNullable(fastTier.getIfPresent(key));
    }

    @Override
    public Optional<String> getDurable(String key) {
        return readDurable(key);
    }

    @Override
    public Optional<String> get(String key) {
        Optional<String> fast = getFast(key);
        if (fast.isPresent()) {
            return fast;
        }
        Optional<String> durable = readDurable(key);
        durable.ifPresent(value -> {
            LOG.debugf("Fast tier miss for [%s], promoted from durable tier", key);
            fastTier.put(key, value);
        });
        return durable;
    }

    @Override
    public void remove(String key) {
        fastTier.invalidate(key);
        deleteDurable(key);
    }

    /**
     * Drop the fast tier, as happens when a redirect lands in a fresh process.
     */
    public void evictFastTier() {
        fastTier.invalidateAll();
    }
}
