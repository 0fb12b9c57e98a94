package tech.oauthplayground.flowengine.session;

import tech.oauthplayground.flowengine.model.AuthorizationRequest;
import tech.oauthplayground.flowengine.model.CallbackResult;
import tech.oauthplayground.flowengine.model.Credentials;
import tech.oauthplayground.flowengine.model.DeviceAuthorization;
import tech.oauthplayground.flowengine.model.PkcePair;
import tech.oauthplayground.flowengine.model.PollingStatus;
import tech.oauthplayground.flowengine.model.TokenSet;

import java.time.Instant;
import java.util.Map;

/**
 * Something that happened to a flow run. Applied by {@link FlowTransitions}.
 */
public sealed interface FlowEvent {

    record CredentialsChanged(Credentials credentials) implements FlowEvent {}

    record PkceGenerated(PkcePair pair) implements FlowEvent {}

    record PkceCleared() implements FlowEvent {}

    record AuthorizationRequestBuilt(AuthorizationRequest request) implements FlowEvent {}

    record CallbackExtracted(CallbackResult result, Instant receivedAt) implements FlowEvent {}

    record DeviceAuthorizationReceived(DeviceAuthorization authorization) implements FlowEvent {}

    record TokensReceived(TokenSet tokens) implements FlowEvent {}

    record TokensRefreshed(TokenSet tokens) implements FlowEvent {}

    record PollingUpdated(PollingStatus status) implements FlowEvent {}

    record IntrospectionReceived(Map<String, Object> claims) implements FlowEvent {}

    record UserInfoReceived(Map<String, Object> claims) implements FlowEvent {}

    record FlowReset() implements FlowEvent {}
}
