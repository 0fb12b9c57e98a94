package tech.oauthplayground.flowengine.exception;

/**
 * Device polling ran out of attempts, or the device code itself expired.
 * Distinct from {@link ProtocolException} so callers can offer "request a new code".
 */
public class DeviceTimeoutException extends FlowEngineException {

    public enum Reason {
        ATTEMPTS_EXHAUSTED,
        DEVICE_CODE_EXPIRED
    }

    private final Reason reason;
    private final int attempts;

    public DeviceTimeoutException(String message, Reason reason, int attempts, Throwable lastFailure) {
        super(message, lastFailure);
        this.reason = reason;
        this.attempts = attempts;
    }

    public Reason getReason() {
        return reason;
    }

    public int getAttempts() {
        return attempts;
    }

    public static DeviceTimeoutException attemptsExhausted(int attempts, Throwable lastFailure) {
        return new DeviceTimeoutException(
            "Authorization was not completed within " + attempts + " polling attempts",
            Reason.ATTEMPTS_EXHAUSTED, attempts, lastFailure);
    }

    public static DeviceTimeoutException deviceCodeExpired(int attempts) {
        return new DeviceTimeoutException(
            "Device code expired before authorization was completed",
            Reason.DEVICE_CODE_EXPIRED, attempts, null);
    }
}
