package tech.oauthplayground.flowengine.device;

import tech.oauthplayground.flowengine.model.FlowState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Display helpers for the device code expiry. Read-only; only the poller decides
 * that a device code has expired.
 */
public final class DeviceCountdown {

    private DeviceCountdown() {
    }

    /**
     * Time left before the device code expires, zero once it has, or zero when no code exists.
     */
    public static Duration remaining(FlowState flowState, Clock clock) {
        Instant expiresAt = flowState.getDeviceCodeExpiresAt();
        if (expiresAt == null) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * {@code M:SS}, e.g. {@code 9:05}.
     */
    public static String format(Duration duration) {
        long totalSeconds = Math.max(0, duration.getSeconds());
        return String.format("%d:%02d", totalSeconds / 60, totalSeconds % 60);
    }
}
