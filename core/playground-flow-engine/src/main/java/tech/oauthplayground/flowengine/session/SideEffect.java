package tech.oauthplayground.flowengine.session;

import tech.oauthplayground.flowengine.model.PkcePair;

/**
 * Work a transition asks the session to carry out after the state has changed.
 */
public sealed interface SideEffect {

    String flowId();

    record PersistFlowState(String flowId) implements SideEffect {}

    record PersistPkcePair(String flowId, PkcePair pair) implements SideEffect {}

    record ClearPersistedPkcePair(String flowId) implements SideEffect {}

    /**
     * Remove the snapshot and the PKCE pair.
     */
    record ClearPersistedState(String flowId) implements SideEffect {}

    record StartDevicePolling(String flowId) implements SideEffect {}

    record StopDevicePolling(String flowId) implements SideEffect {}
}
