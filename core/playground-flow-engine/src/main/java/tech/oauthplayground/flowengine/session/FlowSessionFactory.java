package tech.oauthplayground.flowengine.session;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.authorize.AuthorizationRequestBuilder;
import tech.oauthplayground.flowengine.callback.CallbackExtractor;
import tech.oauthplayground.flowengine.device.DeviceAuthorizationPoller;
import tech.oauthplayground.flowengine.exchange.TokenExchangeCoordinator;
import tech.oauthplayground.flowengine.inspect.TokenInspector;
import tech.oauthplayground.flowengine.model.Credentials;
import tech.oauthplayground.flowengine.model.FlowState;
import tech.oauthplayground.flowengine.model.FlowType;
import tech.oauthplayground.flowengine.pkce.PkceCodeManager;

import java.time.Clock;
import java.util.Optional;

/**
 * Creates flow sessions, and restores them from the flow state store after a redirect.
 */
@ApplicationScoped
public class FlowSessionFactory {

    private static final Logger LOG = Logger.getLogger(FlowSessionFactory.class);

    private final FlowEngineServices services;

    @Inject
    public FlowSessionFactory(PkceCodeManager pkceCodeManager,
                              AuthorizationRequestBuilder authorizationRequestBuilder,
                              CallbackExtractor callbackExtractor,
                              DeviceAuthorizationPoller devicePoller,
                              TokenExchangeCoordinator tokenExchangeCoordinator,
                              TokenInspector tokenInspector,
                              FlowSnapshots snapshots,
                              Clock clock) {
        this.services = new FlowEngineServices(pkceCodeManager, authorizationRequestBuilder, callbackExtractor,
            devicePoller, tokenExchangeCoordinator, tokenInspector, snapshots, clock);
    }

    public FlowSession create(FlowType flowType, Credentials credentials) {
        FlowState flow = FlowState.start(flowType);
        services.snapshots().save(flow);
        LOG.infof("Created %s flow [%s]", flowType.value(), flow.getFlowId());
        return new FlowSession(services, flow, credentials);
    }

    /**
     * Restore a flow run. The PKCE pair is reloaded from its own keys when the snapshot
     * lacks it, and the session resumes at the first incomplete step.
     *
     * @return the session, or empty if nothing is stored for the flow
     */
    public Optional<FlowSession> resume(String flowId, Credentials credentials) {
        Optional<FlowState> stored = services.snapshots().load(flowId);
        if (stored.isEmpty()) {
            LOG.debugf("No stored state for flow [%s]", flowId);
            return Optional.empty();
        }
        FlowState flow = stored.get();
        if (flow.getFlowType().supportsPkce() && credentials.usePkce() && !flow.hasPkcePair()) {
            services.pkceCodeManager().load(flowId).ifPresent(flow::setPkcePair);
        }

        FlowSession session = new FlowSession(services, flow, credentials);
        int total = session.steps().totalSteps();
        int resumeAt = 0;
        while (resumeAt < total - 1 && session.steps().isComplete(resumeAt)) {
            resumeAt++;
        }
        session.steps().goTo(resumeAt);
        LOG.infof("Resumed %s flow [%s] at step %d of %d", flow.getFlowType().value(), flowId, resumeAt + 1, total);
        return Optional.of(session);
    }
}
