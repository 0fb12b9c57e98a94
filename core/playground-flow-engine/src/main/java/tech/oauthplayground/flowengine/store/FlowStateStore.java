package tech.oauthplayground.flowengine.store;

import java.util.Optional;

/**
 * Key-value store for data that must survive a redirect round-trip.
 *
 * <p>Reads go through two tiers: a fast local read first, then a slower durable
 * read if the fast tier misses. A redirect can land in a different execution
 * context from the one that wrote the value, so the fast tier alone is never
 * authoritative.
 *
 * <p>Configure via:
 * <pre>
 * oauth-playground.store.type=MEMORY|FILE
 * oauth-playground.store.fast-tier-ttl=30m
 * </pre>
 */
public interface FlowStateStore {

    /**
     * Write a value to both tiers.
     */
    void put(String key, String value);

    /**
     * Read from the fast tier only.
     */
    Optional<String> getFast(String key);

    /**
     * Read from the durable tier only.
     */
    Optional<String> getDurable(String key);

    /**
     * Fast read, falling back to the durable tier on a miss.
     */
    Optional<String> get(String key);

    /**
     * Remove a value from both tiers.
     */
    void remove(String key);

    /**
     * Durable tier backend.
     */
    enum StoreType {
        MEMORY,
        FILE
    }
}
