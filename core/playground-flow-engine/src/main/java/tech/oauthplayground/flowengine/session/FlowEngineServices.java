package tech.oauthplayground.flowengine.session;

import tech.oauthplayground.flowengine.authorize.AuthorizationRequestBuilder;
import tech.oauthplayground.flowengine.callback.CallbackExtractor;
import tech.oauthplayground.flowengine.device.DeviceAuthorizationPoller;
import tech.oauthplayground.flowengine.exchange.TokenExchangeCoordinator;
import tech.oauthplayground.flowengine.inspect.TokenInspector;
import tech.oauthplayground.flowengine.pkce.PkceCodeManager;

import java.time.Clock;

/**
 * The engine components a {@link FlowSession} drives.
 */
record FlowEngineServices(
    PkceCodeManager pkceCodeManager,
    AuthorizationRequestBuilder authorizationRequestBuilder,
    CallbackExtractor callbackExtractor,
    DeviceAuthorizationPoller devicePoller,
    TokenExchangeCoordinator tokenExchangeCoordinator,
    TokenInspector tokenInspector,
    FlowSnapshots snapshots,
    Clock clock
) {
}
