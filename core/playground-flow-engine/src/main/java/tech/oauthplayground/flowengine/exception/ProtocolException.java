package tech.oauthplayground.flowengine.exception;

import java.util.Map;
import java.util.Set;

/**
 * The authorization server answered with an OAuth error code. The server's
 * {@code error} and {@code error_description} are kept verbatim.
 */
public class ProtocolException extends FlowEngineException {

    private static final Set<String> DEVICE_CODE_INVALIDATING = Set.of("expired_token", "invalid_grant");

    private final String error;
    private final String errorDescription;

    public ProtocolException(String error, String errorDescription, int statusCode) {
        super(describe(error, errorDescription), statusCode, null,
            Map.of("error", error, "error_description", errorDescription != null ? errorDescription : ""));
        this.error = error;
        this.errorDescription = errorDescription;
    }

    public String getError() {
        return error;
    }

    public String getErrorDescription() {
        return errorDescription;
    }

    /**
     * True when the device code can no longer be used and a new one must be requested.
     */
    public boolean requiresNewDeviceCode() {
        return DEVICE_CODE_INVALIDATING.contains(error);
    }

    public static ProtocolException unexpectedResponse(int statusCode, String body) {
        return new ProtocolException("invalid_response",
            "Unexpected response from authorization server (HTTP " + statusCode + ")"
                + (body != null && !body.isBlank() ? ": " + truncate(body) : ""),
            statusCode);
    }

    private static String describe(String error, String description) {
        return description != null && !description.isBlank() ? error + ": " + description : error;
    }

    private static String truncate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
