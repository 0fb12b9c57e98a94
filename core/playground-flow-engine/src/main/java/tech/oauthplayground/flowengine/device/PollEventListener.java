package tech.oauthplayground.flowengine.device;

/**
 * Receives the events of a polling run. Called on the poller's thread, or on the
 * caller's thread for start and stop.
 */
@FunctionalInterface
public interface PollEventListener {

    void onEvent(PollEvent event);

    static PollEventListener noop() {
        return event -> { };
    }
}
