package tech.oauthplayground.flowengine.session;

import tech.oauthplayground.flowengine.model.FlowState;

import java.util.List;

/**
 * Result of applying a {@link FlowEvent}: the flow state after the event and the
 * side effects to run, in order.
 */
public record Transition(FlowState state, List<SideEffect> sideEffects) {

    public Transition {
        sideEffects = List.copyOf(sideEffects);
    }

    public boolean has(Class<? extends SideEffect> type) {
        return sideEffects.stream().anyMatch(type::isInstance);
    }
}
