package tech.oauthplayground.flowengine.session;

import tech.oauthplayground.flowengine.model.CallbackResult;
import tech.oauthplayground.flowengine.model.Credentials;
import tech.oauthplayground.flowengine.model.FlowState;
import tech.oauthplayground.flowengine.model.FlowType;
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
import tech.oauthplayground.flowengine.session.SideEffect.ClearPersistedPkcePair;
import tech.oauthplayground.flowengine.session.SideEffect.ClearPersistedState;
import tech.oauthplayground.flowengine.session.SideEffect.PersistFlowState;
import tech.oauthplayground.flowengine.session.SideEffect.PersistPkcePair;
import tech.oauthplayground.flowengine.session.SideEffect.StartDevicePolling;
import tech.oauthplayground.flowengine.session.SideEffect.StopDevicePolling;

import java.util.ArrayList;
import java.util.List;

/**
 * The flow's state transition function. Deterministic and free of I/O: it updates
 * the flow state in place and names the side effects, the session runs them.
 */
public final class FlowTransitions {

    private FlowTransitions() {
    }

    /**
     * Apply an event to a flow.
     *
     * <p>The given state is updated in place and returned as {@link Transition#state()}.
     * Only {@link FlowReset} returns a new instance; callers holding the old one must
     * treat it as discarded.
     */
    public static Transition apply(FlowState flow, Credentials credentials, FlowEvent event) {
        String flowId = flow.getFlowId();
        List<SideEffect> effects = new ArrayList<>();

        if (event instanceof CredentialsChanged changed) {
            if (!changed.credentials().usePkce() && flow.hasPkcePair()) {
                flow.clearPkcePair();
                effects.add(new ClearPersistedPkcePair(flowId));
            }
            effects.add(new PersistFlowState(flowId));

        } else if (event instanceof PkceGenerated generated) {
            flow.setPkcePair(generated.pair());
            effects.add(new PersistPkcePair(flowId, generated.pair()));
            effects.add(new PersistFlowState(flowId));

        } else if (event instanceof PkceCleared) {
            flow.clearPkcePair();
            effects.add(new ClearPersistedPkcePair(flowId));
            effects.add(new PersistFlowState(flowId));

        } else if (event instanceof AuthorizationRequestBuilt built) {
            flow.applyAuthorizationRequest(built.request());
            flow.setAuthorizationCode(null);
            flow.setCallbackError(null, null);
            effects.add(new PersistFlowState(flowId));

        } else if (event instanceof CallbackExtracted extracted) {
            applyCallback(flow, extracted.result(), extracted);
            effects.add(new PersistFlowState(flowId));

        } else if (event instanceof DeviceAuthorizationReceived received) {
            if (flow.getPollingStatus().polling()) {
                effects.add(new StopDevicePolling(flowId));
            }
            flow.setTokens(null);
            flow.applyDeviceAuthorization(received.authorization());
            effects.add(new PersistFlowState(flowId));
            effects.add(new StartDevicePolling(flowId));

        } else if (event instanceof TokensReceived received) {
            flow.setTokens(received.tokens());
            if (flow.getFlowType() == FlowType.DEVICE_CODE && flow.getPollingStatus().polling()) {
                effects.add(new StopDevicePolling(flowId));
            }
            effects.add(new PersistFlowState(flowId));

        } else if (event instanceof TokensRefreshed refreshed) {
            flow.setTokens(refreshed.tokens());
            flow.setIntrospection(null);
            effects.add(new PersistFlowState(flowId));

        } else if (event instanceof PollingUpdated updated) {
            flow.setPollingStatus(updated.status());
            if (!updated.status().polling()) {
                effects.add(new PersistFlowState(flowId));
            }

        } else if (event instanceof IntrospectionReceived received) {
            flow.setIntrospection(received.claims());
            effects.add(new PersistFlowState(flowId));

        } else if (event instanceof UserInfoReceived received) {
            flow.setUserInfo(received.claims());
            effects.add(new PersistFlowState(flowId));

        } else if (event instanceof FlowReset) {
            if (flow.getPollingStatus().polling()) {
                effects.add(new StopDevicePolling(flowId));
            }
            effects.add(new ClearPersistedState(flowId));
            return new Transition(new FlowState(flowId, flow.getFlowType()), effects);
        }

        return new Transition(flow, effects);
    }

    /**
     * Hybrid front-channel tokens are only kept when no code came back; with a code the
     * token endpoint response supersedes them.
     */
    private static void applyCallback(FlowState flow, CallbackResult result, CallbackExtracted event) {
        if (result.isError()) {
            flow.setCallbackError(result.error(), result.errorDescription());
            return;
        }
        flow.setCallbackError(null, null);
        FlowType flowType = flow.getFlowType();
        if (flowType.usesAuthorizationCode() && result.hasCode()) {
            flow.setAuthorizationCode(result.code());
            return;
        }
        if (result.accessToken() != null && !result.accessToken().isBlank()) {
            flow.setTokens(new TokenSet(result.accessToken(), result.tokenType(), result.idToken(),
                null, result.expiresIn(), result.scope(), event.receivedAt()));
        }
    }
}
