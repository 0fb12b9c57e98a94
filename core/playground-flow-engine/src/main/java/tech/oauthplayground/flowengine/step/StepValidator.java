package tech.oauthplayground.flowengine.step;

import tech.oauthplayground.flowengine.exception.ValidationException.ValidationError;
import tech.oauthplayground.flowengine.exchange.ExchangeReadiness;
import tech.oauthplayground.flowengine.model.Credentials;
import tech.oauthplayground.flowengine.model.FlowState;
import tech.oauthplayground.flowengine.model.FlowType;
import tech.oauthplayground.flowengine.model.StepKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-step validation rules. A step is complete exactly when its list is empty.
 */
public final class StepValidator {

    private StepValidator() {
    }

    public static List<String> validate(StepKind step, FlowState flow, Credentials credentials, Instant now) {
        FlowType flowType = flow.getFlowType();
        List<String> errors = new ArrayList<>();
        switch (step) {
            case CONFIGURE -> {
                require(errors, credentials.environmentId(), "Environment ID is required");
                require(errors, credentials.clientId(), "Client ID is required");
                if (credentials.scopeList().isEmpty()) {
                    errors.add("At least one scope is required");
                }
                if (flowType.isRedirectBased()) {
                    require(errors, credentials.redirectUri(), "Redirect URI is required");
                }
                if (needsClientSecret(flowType, credentials) && !credentials.hasClientSecret()) {
                    errors.add("Client secret is required");
                }
            }
            case PKCE -> {
                if (isBlank(flow.getCodeVerifier()) || isBlank(flow.getCodeChallenge())) {
                    errors.add("PKCE code verifier and challenge must be generated");
                }
            }
            case AUTHORIZATION_URL -> {
                require(errors, flow.getAuthorizationUrl(), "Authorization URL has not been built");
                require(errors, flow.getState(), "State parameter is missing");
                if (flowType == FlowType.IMPLICIT || flowType == FlowType.HYBRID) {
                    require(errors, flow.getNonce(), "Nonce is missing");
                }
            }
            case CALLBACK -> {
                if (flow.getCallbackError() != null) {
                    errors.add("Authorization failed: " + flow.getCallbackError()
                        + (flow.getCallbackErrorDescription() != null ? " - " + flow.getCallbackErrorDescription() : ""));
                }
                if (flowType == FlowType.IMPLICIT) {
                    if (!flow.hasAccessToken()) {
                        errors.add("No access token received from the authorization server");
                    }
                } else {
                    require(errors, flow.getAuthorizationCode(), "No authorization code received");
                }
            }
            case EXCHANGE -> {
                if (!flow.hasAccessToken()) {
                    ExchangeReadiness.check(flow, credentials).stream()
                        .map(ValidationError::message)
                        .forEach(errors::add);
                }
            }
            case REQUEST_TOKEN -> {
                require(errors, credentials.clientId(), "Client ID is required");
                require(errors, credentials.environmentId(), "Environment ID is required");
                if (flowType == FlowType.CLIENT_CREDENTIALS && !credentials.hasClientSecret()) {
                    errors.add("Client secret is required");
                }
                if (flowType == FlowType.ROPC && !flow.hasAccessToken()) {
                    require(errors, flow.getUsername(), "Username is required");
                    require(errors, flow.getPassword(), "Password is required");
                }
            }
            case DEVICE_AUTHORIZATION -> {
                require(errors, flow.getDeviceCode(), "Device code has not been requested");
                require(errors, flow.getUserCode(), "User code is missing");
                require(errors, flow.getVerificationUri(), "Verification URI is missing");
            }
            case POLLING -> {
                if (!flow.hasAccessToken()) {
                    errors.add(flow.isDeviceCodeExpired(now)
                        ? "Device code has expired; request a new one"
                        : "Waiting for the user to authorize the device");
                }
            }
            case TOKENS -> {
                if (!flow.hasAccessToken()) {
                    errors.add("No access token received");
                }
            }
            case INTROSPECT -> {
                if (flow.getIntrospection() == null && flow.getUserInfo() == null) {
                    errors.add("Introspect the token or fetch userinfo");
                }
            }
        }
        return errors;
    }

    /**
     * Client credentials always authenticate with a secret; other flows only when the
     * configured method uses one. Implicit and device flows never send it.
     */
    static boolean needsClientSecret(FlowType flowType, Credentials credentials) {
        if (flowType == FlowType.CLIENT_CREDENTIALS) {
            return true;
        }
        if (flowType == FlowType.IMPLICIT || flowType == FlowType.DEVICE_CODE) {
            return false;
        }
        return credentials.clientAuthMethod().requiresClientSecret();
    }

    private static void require(List<String> errors, String value, String message) {
        if (isBlank(value)) {
            errors.add(message);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
