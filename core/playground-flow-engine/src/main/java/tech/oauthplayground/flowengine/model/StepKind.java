package tech.oauthplayground.flowengine.model;

/**
 * The kinds of step a flow can be made of. The ordering of steps for a given
 * flow lives in {@link tech.oauthplayground.flowengine.definition.FlowDefinitionRegistry}.
 */
public enum StepKind {
    CONFIGURE,
    PKCE,
    AUTHORIZATION_URL,
    CALLBACK,
    EXCHANGE,
    REQUEST_TOKEN,
    DEVICE_AUTHORIZATION,
    POLLING,
    TOKENS,
    INTROSPECT
}
