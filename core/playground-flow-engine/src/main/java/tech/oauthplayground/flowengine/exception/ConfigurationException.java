package tech.oauthplayground.flowengine.exception;

/**
 * The engine was asked to do something its configuration cannot support.
 */
public class ConfigurationException extends FlowEngineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public static ConfigurationException pkceRequiredButMissing() {
        return new ConfigurationException(
            "PKCE is enabled but no code verifier/challenge pair has been generated");
    }

    public static ConfigurationException unsupportedClientAuth(String method) {
        return new ConfigurationException("Client authentication method not supported: " + method);
    }

    public static ConfigurationException unsupportedFlow(String operation, Object flowType) {
        return new ConfigurationException(operation + " is not available for flow type " + flowType);
    }
}
