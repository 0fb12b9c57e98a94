package tech.oauthplayground.flowengine.device;

import tech.oauthplayground.flowengine.exception.DeviceTimeoutException;
import tech.oauthplayground.flowengine.exception.FlowEngineException;
import tech.oauthplayground.flowengine.exception.TransientException;
import tech.oauthplayground.flowengine.model.TokenSet;

/**
 * Progress of a device polling run, delivered to a {@link PollEventListener}.
 *
 * <p>{@link Succeeded}, {@link Failed}, {@link TimedOut} and {@link Cancelled} are
 * terminal: nothing is delivered for the run after one of them.
 */
public sealed interface PollEvent {

    String flowId();

    default boolean isTerminal() {
        return false;
    }

    record Started(String flowId, long intervalSeconds) implements PollEvent {}

    /**
     * The server answered {@code authorization_pending}. Normal, not a failure.
     */
    record Pending(String flowId, int attempt) implements PollEvent {}

    record SlowDown(String flowId, int attempt, long intervalSeconds) implements PollEvent {}

    /**
     * A network failure or 5xx. The run continues; the attempt still counts.
     */
    record TransientFailure(String flowId, int attempt, TransientException cause) implements PollEvent {}

    record Succeeded(String flowId, int attempt, TokenSet tokens) implements PollEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    /**
     * A terminal error: a {@code ProtocolException} from the server, or a
     * {@code TransientException} once the consecutive failure budget is spent.
     */
    record Failed(String flowId, int attempt, FlowEngineException cause) implements PollEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record TimedOut(String flowId, int attempt, DeviceTimeoutException cause) implements PollEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Cancelled(String flowId, int attempt) implements PollEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
