package tech.oauthplayground.flowengine.store;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.config.FlowEngineConfig;

/**
 * CDI producer that selects the durable tier based on configuration.
 */
@ApplicationScoped
public class FlowStateStoreProducer {

    private static final Logger LOG = Logger.getLogger(FlowStateStoreProducer.class);

    private final FlowEngineConfig config;
    private final Instance<InMemoryFlowStateStore> inMemoryStore;
    private final Instance<FileFlowStateStore> fileStore;

    @Inject
    public FlowStateStoreProducer(FlowEngineConfig config,
                                  Instance<InMemoryFlowStateStore> inMemoryStore,
                                  Instance<FileFlowStateStore> fileStore) {
        this.config = config;
        this.inMemoryStore = inMemoryStore;
        this.fileStore = fileStore;
    }

    @Produces
    @ApplicationScoped
    public FlowStateStore flowStateStore() {
        FlowStateStore.StoreType type = config.store().type();
        LOG.infof("Initializing flow state store: type=%s, fastTierTtl=%s", type, config.store().fastTierTtl());

        return switch (type) {
            case MEMORY -> {
                LOG.info("Using in-memory durable tier");
                yield inMemoryStore.get();
            }
            case FILE -> {
                LOG.infof("Using file durable tier at %s", config.store().directory());
                yield fileStore.get();
            }
        };
    }
}
