package tech.oauthplayground.flowengine.model;

import java.time.Instant;

/**
 * Snapshot of device polling progress. Replaced as a whole on every change.
 *
 * @param polling whether a polling loop is currently active
 * @param pollCount attempts made in the current run
 * @param lastPolledAt time of the most recent attempt
 * @param error terminal error message, if the run failed or expired
 * @param state poller lifecycle state
 * @param intervalSeconds interval currently applied between attempts
 */
public record PollingStatus(
    boolean polling,
    int pollCount,
    Instant lastPolledAt,
    String error,
    PollerState state,
    long intervalSeconds
) {

    public static PollingStatus idle() {
        return new PollingStatus(false, 0, null, null, PollerState.IDLE, 0);
    }

    public PollingStatus withState(PollerState newState) {
        return new PollingStatus(
            newState == PollerState.POLLING,
            pollCount, lastPolledAt, error, newState, intervalSeconds);
    }

    public PollingStatus withAttempt(int count, Instant at) {
        return new PollingStatus(polling, count, at, error, state, intervalSeconds);
    }

    public PollingStatus withInterval(long seconds) {
        return new PollingStatus(polling, pollCount, lastPolledAt, error, state, seconds);
    }

    public PollingStatus finished(PollerState terminalState, String errorMessage) {
        return new PollingStatus(false, pollCount, lastPolledAt, errorMessage, terminalState, intervalSeconds);
    }
}
