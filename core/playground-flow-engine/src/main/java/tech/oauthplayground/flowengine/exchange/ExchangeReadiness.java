package tech.oauthplayground.flowengine.exchange;

import tech.oauthplayground.flowengine.exception.ValidationException.ValidationError;
import tech.oauthplayground.flowengine.model.Credentials;
import tech.oauthplayground.flowengine.model.FlowState;

import java.util.ArrayList;
import java.util.List;

/**
 * Preconditions for redeeming an authorization code. Pure; shared by the exchange
 * coordinator and the step validator so both report the same errors.
 */
public final class ExchangeReadiness {

    public static final String MISSING_AUTHORIZATION_CODE = "MISSING_AUTHORIZATION_CODE";
    public static final String MISSING_CODE_VERIFIER = "MISSING_CODE_VERIFIER";
    public static final String MISSING_CLIENT_ID = "MISSING_CLIENT_ID";
    public static final String MISSING_ENVIRONMENT_ID = "MISSING_ENVIRONMENT_ID";
    public static final String MISSING_REDIRECT_URI = "MISSING_REDIRECT_URI";

    private ExchangeReadiness() {
    }

    /**
     * PKCE-protected clients are not required to repeat the redirect URI at the token endpoint.
     */
    public static List<ValidationError> check(FlowState flow, Credentials credentials) {
        List<ValidationError> errors = new ArrayList<>();
        if (isBlank(flow.getAuthorizationCode())) {
            errors.add(new ValidationError("authorizationCode",
                "Authorization code is required", MISSING_AUTHORIZATION_CODE));
        }
        if (credentials.usePkce() && isBlank(flow.getCodeVerifier())) {
            errors.add(new ValidationError("codeVerifier",
                "PKCE is enabled but the code verifier is missing; generate PKCE parameters first",
                MISSING_CODE_VERIFIER));
        }
        if (isBlank(credentials.clientId())) {
            errors.add(new ValidationError("clientId", "Client ID is required", MISSING_CLIENT_ID));
        }
        if (isBlank(credentials.environmentId())) {
            errors.add(new ValidationError("environmentId", "Environment ID is required", MISSING_ENVIRONMENT_ID));
        }
        if (!credentials.usePkce() && isBlank(credentials.redirectUri())) {
            errors.add(new ValidationError("redirectUri",
                "Redirect URI is required when PKCE is not used", MISSING_REDIRECT_URI));
        }
        return errors;
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
