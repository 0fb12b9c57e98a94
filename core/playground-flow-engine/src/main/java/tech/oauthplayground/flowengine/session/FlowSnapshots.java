package tech.oauthplayground.flowengine.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.exception.FlowEngineException;
import tech.oauthplayground.flowengine.exception.FlowStateCorruptionException;
import tech.oauthplayground.flowengine.model.FlowState;
import tech.oauthplayground.flowengine.store.FlowStateStore;

import java.util.Optional;

/**
 * JSON snapshots of flow state in the {@link FlowStateStore}, keyed {@code flow:{flowId}}.
 * Resource owner credentials are never part of a snapshot.
 */
@ApplicationScoped
public class FlowSnapshots {

    private static final Logger LOG = Logger.getLogger(FlowSnapshots.class);

    private final FlowStateStore store;
    private final ObjectMapper objectMapper;

    @Inject
    public FlowSnapshots(FlowStateStore store) {
        this.store = store;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void save(FlowState flow) {
        try {
            store.put(key(flow.getFlowId()), objectMapper.writeValueAsString(flow));
        } catch (JsonProcessingException e) {
            throw new FlowEngineException("Cannot serialize flow " + flow.getFlowId(), e);
        }
    }

    /**
     * @throws FlowStateCorruptionException if a snapshot exists but cannot be read
     */
    public Optional<FlowState> load(String flowId) {
        Optional<String> json = store.get(key(flowId));
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), FlowState.class));
        } catch (JsonProcessingException e) {
            LOG.errorf("Unreadable snapshot for flow [%s]: %s", flowId, e.getOriginalMessage());
            throw new FlowStateCorruptionException("Stored state for flow " + flowId + " cannot be read", e);
        }
    }

    public void remove(String flowId) {
        store.remove(key(flowId));
    }

    static String key(String flowId) {
        return "flow:" + flowId;
    }
}
