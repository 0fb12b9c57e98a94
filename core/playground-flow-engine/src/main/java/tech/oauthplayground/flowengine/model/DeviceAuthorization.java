package tech.oauthplayground.flowengine.model;

import java.time.Instant;

/**
 * Result of a device authorization request (RFC 8628 §3.2).
 *
 * @param deviceCode code the device uses when polling
 * @param userCode code the user enters on the verification page
 * @param verificationUri page where the user enters the code
 * @param verificationUriComplete page URL with the user code embedded, if provided
 * @param expiresIn device code lifetime in seconds
 * @param interval minimum polling interval requested by the server, if provided
 * @param expiresAt absolute expiry computed when the response arrived
 */
public record DeviceAuthorization(
    String deviceCode,
    String userCode,
    String verificationUri,
    String verificationUriComplete,
    long expiresIn,
    Integer interval,
    Instant expiresAt
) {
}
