package tech.oauthplayground.flowengine.session;

import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.authorize.AuthorizationRequestBuilder;
import tech.oauthplayground.flowengine.callback.CallbackExtractor;
import tech.oauthplayground.flowengine.device.DeviceAuthorizationPoller;
import tech.oauthplayground.flowengine.device.PollEvent;
import tech.oauthplayground.flowengine.exception.ConfigurationException;
import tech.oauthplayground.flowengine.model.AuthorizationRequest;
import tech.oauthplayground.flowengine.model.CallbackResult;
import tech.oauthplayground.flowengine.model.Credentials;
import tech.oauthplayground.flowengine.model.DeviceAuthorization;
import tech.oauthplayground.flowengine.model.FlowState;
import tech.oauthplayground.flowengine.model.FlowType;
import tech.oauthplayground.flowengine.model.PkcePair;
import tech.oauthplayground.flowengine.model.PollerState;
import tech.oauthplayground.flowengine.model.TokenSet;
import tech.oauthplayground.flowengine.session.FlowEvent.AuthorizationRequestBuilt;
import tech.oauthplayground.flowengine.session.FlowEvent.CallbackExtracted;
import tech.oauthplayground.flowengine.session.FlowEvent.CredentialsChanged;
import tech.oauthplayground.flowengine.session.FlowEvent.DeviceAuthorizationReceived;
import tech.oauthplayground.flowengine.session.FlowEvent.FlowReset;
import tech.oauthplayground.flowengine.session.FlowEvent.IntrospectionReceived;
import tech.oauthplayground.flowengine.session.FlowEvent.PkceCleared;
import tech.oauthplayground.flowengine.session.FlowEvent.PkceGenerated;
import tech.oauthplayground.flowengine.session.FlowEvent.PollingUpdated;
import tech.oauthplayground.flowengine.session.FlowEvent.TokensReceived;
import tech.oauthplayground.flowengine.session.FlowEvent.TokensRefreshed;
import tech.oauthplayground.flowengine.session.FlowEvent.UserInfoReceived;
import tech.oauthplayground.flowengine.step.StepStateMachine;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One flow run: the entry point the UI drives.
 *
 * <p>Every user action calls an engine component, turns the result into a
 * {@link FlowEvent}, applies it through {@link FlowTransitions} and runs the side
 * effects. Errors from the components propagate unchanged and leave the state as
 * it was.
 *
 * <p>A session is driven from one logical context. Device polling events arrive on
 * the poller's thread and only touch the fields the poller owns. {@link #reset()}
 * stops polling before it replaces the state.
 */
public class FlowSession {

    private static final Logger LOG = Logger.getLogger(FlowSession.class);

    private final FlowEngineServices services;
    private final List<FlowSessionListener> listeners = new CopyOnWriteArrayList<>();

    private volatile FlowState flow;
    private Credentials credentials;
    private StepStateMachine steps;

    FlowSession(FlowEngineServices services, FlowState flow, Credentials credentials) {
        this.services = services;
        this.flow = flow;
        this.credentials = credentials;
        this.steps = new StepStateMachine(flow, credentials, services.clock());
    }

    public String flowId() {
        return flow.getFlowId();
    }

    public FlowType flowType() {
        return flow.getFlowType();
    }

    public FlowState state() {
        return flow;
    }

    public Credentials credentials() {
        return credentials;
    }

    public StepStateMachine steps() {
        return steps;
    }

    public void addListener(FlowSessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(FlowSessionListener listener) {
        listeners.remove(listener);
    }

    public void updateCredentials(Credentials updated) {
        this.credentials = updated;
        steps.updateCredentials(updated);
        dispatch(new CredentialsChanged(updated));
    }

    public PkcePair generatePkce() {
        if (!flow.getFlowType().supportsPkce()) {
            throw ConfigurationException.unsupportedFlow("PKCE", flow.getFlowType().value());
        }
        PkcePair pair = services.pkceCodeManager().generate();
        LOG.infof("Generated PKCE pair for flow [%s]", flowId());
        dispatch(new PkceGenerated(pair));
        return pair;
    }

    public void clearPkce() {
        dispatch(new PkceCleared());
    }

    public AuthorizationRequest buildAuthorizationRequest() {
        PkcePair pair = null;
        if (flow.hasPkcePair()) {
            pair = new PkcePair(flow.getCodeVerifier(), flow.getCodeChallenge());
        } else if (credentials.usePkce() && flow.getFlowType().supportsPkce()) {
            pair = services.pkceCodeManager().load(flowId()).orElse(null);
            if (pair != null) {
                flow.setPkcePair(pair);
            }
        }
        AuthorizationRequest request = services.authorizationRequestBuilder().build(flow.getFlowType(), credentials, pair);
        dispatch(new AuthorizationRequestBuilt(request));
        return request;
    }

    /**
     * Apply the redirect the browser landed on. A correlation failure propagates
     * and nothing from the redirect is applied.
     */
    public CallbackResult handleCallback(String redirectUrl) {
        CallbackResult result = services.callbackExtractor()
            .extract(flow.getFlowType(), redirectUrl, flow.getState(), flow.getNonce());
        dispatch(new CallbackExtracted(result, services.clock().instant()));
        return result;
    }

    public TokenSet exchangeAuthorizationCode() {
        TokenSet tokens = services.tokenExchangeCoordinator().exchange(flow, credentials);
        dispatch(new TokensReceived(tokens));
        return tokens;
    }

    /**
     * Client credentials or resource owner password grant.
     */
    public TokenSet requestToken(String username, String password) {
        TokenSet tokens = services.tokenExchangeCoordinator().requestDirect(flow, credentials, username, password);
        dispatch(new TokensReceived(tokens));
        return tokens;
    }

    public TokenSet refreshTokens() {
        TokenSet tokens = services.tokenExchangeCoordinator().refresh(flow, credentials);
        dispatch(new TokensRefreshed(tokens));
        return tokens;
    }

    /**
     * Request a device code. Polling starts automatically once it arrives.
     */
    public DeviceAuthorization requestDeviceAuthorization() {
        if (flow.getFlowType() != FlowType.DEVICE_CODE) {
            throw ConfigurationException.unsupportedFlow("Device authorization", flow.getFlowType().value());
        }
        flow.setPollingStatus(flow.getPollingStatus().withState(PollerState.AUTHORIZING));
        DeviceAuthorization authorization;
        try {
            authorization = services.devicePoller().requestAuthorization(credentials);
        } catch (RuntimeException e) {
            flow.setPollingStatus(flow.getPollingStatus().finished(PollerState.FAILED, e.getMessage()));
            throw e;
        }
        dispatch(new DeviceAuthorizationReceived(authorization));
        return authorization;
    }

    /**
     * Manual start. A no-op when polling is already running.
     */
    public boolean startPolling() {
        FlowState polled = flow;
        return services.devicePoller().start(polled, credentials, event -> onPollEvent(polled, event));
    }

    public boolean stopPolling() {
        return services.devicePoller().stop(flowId());
    }

    public boolean isPolling() {
        return services.devicePoller().isRunning(flowId());
    }

    /**
     * One manual status check, only while no polling loop runs.
     */
    public Optional<PollEvent> checkDeviceStatus() {
        Optional<PollEvent> outcome = services.devicePoller().checkOnce(flow, credentials);
        outcome.ifPresent(event -> {
            if (event instanceof PollEvent.Succeeded succeeded) {
                dispatch(new TokensReceived(succeeded.tokens()));
            } else {
                dispatch(new PollingUpdated(flow.getPollingStatus()));
            }
        });
        return outcome;
    }

    public Map<String, Object> introspect() {
        Map<String, Object> claims = services.tokenInspector().introspect(flow, credentials);
        dispatch(new IntrospectionReceived(claims));
        return claims;
    }

    public Map<String, Object> fetchUserInfo() {
        Map<String, Object> claims = services.tokenInspector().fetchUserInfo(flow, credentials);
        dispatch(new UserInfoReceived(claims));
        return claims;
    }

    /**
     * Discard the run's state and start over from the first step.
     */
    public void reset() {
        // Once stop returns the poller delivers nothing more for the old state.
        stopPolling();
        dispatch(new FlowReset());
        steps = new StepStateMachine(flow, credentials, services.clock());
        LOG.infof("Flow [%s] reset", flowId());
    }

    Transition dispatch(FlowEvent event) {
        Transition transition = FlowTransitions.apply(flow, credentials, event);
        this.flow = transition.state();
        for (SideEffect effect : transition.sideEffects()) {
            execute(effect);
        }
        for (FlowSessionListener listener : listeners) {
            listener.onTransition(event, flow);
        }
        return transition;
    }

    private void execute(SideEffect effect) {
        if (effect instanceof SideEffect.PersistFlowState) {
            services.snapshots().save(flow);
        } else if (effect instanceof SideEffect.PersistPkcePair persist) {
            services.pkceCodeManager().persist(persist.flowId(), persist.pair());
        } else if (effect instanceof SideEffect.ClearPersistedPkcePair clear) {
            services.pkceCodeManager().clear(clear.flowId());
        } else if (effect instanceof SideEffect.ClearPersistedState clear) {
            services.snapshots().remove(clear.flowId());
            services.pkceCodeManager().clear(clear.flowId());
        } else if (effect instanceof SideEffect.StartDevicePolling) {
            startPolling();
        } else if (effect instanceof SideEffect.StopDevicePolling stop) {
            services.devicePoller().stop(stop.flowId());
        }
    }

    /**
     * Poll events are bound to the state instance the run was started for. Events
     * for a state that has since been replaced are dropped.
     */
    void onPollEvent(FlowState polled, PollEvent event) {
        if (polled != flow) {
            LOG.debugf("Dropping %s for a replaced state of flow [%s]",
                event.getClass().getSimpleName(), event.flowId());
            return;
        }
        for (FlowSessionListener listener : listeners) {
            listener.onPollEvent(event);
        }
        if (event instanceof PollEvent.Succeeded succeeded) {
            dispatch(new TokensReceived(succeeded.tokens()));
        } else if (event.isTerminal()) {
            dispatch(new PollingUpdated(flow.getPollingStatus()));
        }
    }
}
