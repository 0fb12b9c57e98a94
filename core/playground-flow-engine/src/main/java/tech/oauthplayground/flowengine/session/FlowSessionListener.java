package tech.oauthplayground.flowengine.session;

import tech.oauthplayground.flowengine.device.PollEvent;
import tech.oauthplayground.flowengine.model.FlowState;

/**
 * Observer for the UI or driver of a flow session.
 */
public interface FlowSessionListener {

    /**
     * Called after an event has been applied and its side effects have run.
     */
    default void onTransition(FlowEvent event, FlowState state) {
    }

    /**
     * Called for every device polling event, on the poller's thread.
     */
    default void onPollEvent(PollEvent event) {
    }
}
