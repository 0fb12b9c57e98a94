package tech.oauthplayground.flowengine.callback;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.oauthplayground.flowengine.exception.CorrelationException;
import tech.oauthplayground.flowengine.model.CallbackResult;
import tech.oauthplayground.flowengine.model.FlowType;
import tech.oauthplayground.flowengine.support.TestJwts;

import static org.assertj.core.api.Assertions.*;

class CallbackExtractorTest {

    private static final String STATE = "state-abc";
    private static final String NONCE = "nonce-xyz";
    private static final String REDIRECT = "https://app.example.test/callback";

    private final CallbackExtractor extractor = new CallbackExtractor();

    // ========================================
    // QUERY CHANNEL TESTS
    // ========================================

    @Test
    @DisplayName("extractFromQuery should return code and state")
    void extractFromQuery_shouldReturnCode() {
        CallbackResult result = extractor.extractFromQuery("code=auth-code-1&state=" + STATE, STATE);

        assertThat(result.code()).isEqualTo("auth-code-1");
        assertThat(result.state()).isEqualTo(STATE);
        assertThat(result.isError()).isFalse();
    }

    @Test
    @DisplayName("extractFromQuery should decode the server's error")
    void extractFromQuery_shouldReturnError() {
        CallbackResult result = extractor.extractFromQuery(
            "?error=access_denied&error_description=User%20cancelled&state=" + STATE, STATE);

        assertThat(result.isError()).isTrue();
        assertThat(result.error()).isEqualTo("access_denied");
        assertThat(result.errorDescription()).isEqualTo("User cancelled");
        assertThat(result.hasCode()).isFalse();
    }

    @Test
    @DisplayName("extractFromQuery should raise a correlation error on state mismatch and return no code")
    void extractFromQuery_shouldThrowCorrelation_whenStateMismatch() {
        assertThatThrownBy(() -> extractor.extractFromQuery("code=stolen&state=other", STATE))
            .isInstanceOf(CorrelationException.class)
            .hasMessageContaining("State");
    }

    @Test
    @DisplayName("extractFromQuery should raise a correlation error when state is absent")
    void extractFromQuery_shouldThrowCorrelation_whenStateMissing() {
        assertThatThrownBy(() -> extractor.extractFromQuery("code=auth-code-1", STATE))
            .isInstanceOf(CorrelationException.class);
    }

    @Test
    @DisplayName("extractFromQuery should raise a correlation error when no request state is held")
    void extractFromQuery_shouldThrowCorrelation_whenNoExpectedState() {
        assertThatThrownBy(() -> extractor.extractFromQuery("code=auth-code-1&state=" + STATE, null))
            .isInstanceOf(CorrelationException.class);
    }

    @Test
    @DisplayName("authorization code flow should ignore fragment contents")
    void extract_shouldIgnoreFragment_whenAuthorizationCode() {
        CallbackResult result = extractor.extract(FlowType.AUTHORIZATION_CODE,
            REDIRECT + "?code=auth-code-1&state=" + STATE + "#access_token=injected&state=other",
            STATE, null);

        assertThat(result.code()).isEqualTo("auth-code-1");
        assertThat(result.accessToken()).isNull();
    }

    // ========================================
    // FRAGMENT CHANNEL TESTS
    // ========================================

    @Test
    @DisplayName("implicit flow should read tokens from the fragment")
    void extractFromFragment_shouldReturnTokens_whenImplicit() {
        String idToken = TestJwts.idTokenWithNonce(NONCE);
        CallbackResult result = extractor.extractFromFragment(FlowType.IMPLICIT,
            "#access_token=at-1&token_type=Bearer&expires_in=3600&id_token=" + idToken + "&state=" + STATE,
            STATE, NONCE);

        assertThat(result.accessToken()).isEqualTo("at-1");
        assertThat(result.tokenType()).isEqualTo("Bearer");
        assertThat(result.expiresIn()).isEqualTo(3600L);
        assertThat(result.idToken()).isEqualTo(idToken);
    }

    @Test
    @DisplayName("implicit flow should ignore an authorization code present in the query")
    void extract_shouldIgnoreQueryCode_whenImplicit() {
        CallbackResult result = extractor.extract(FlowType.IMPLICIT,
            REDIRECT + "?code=sneaky-code&state=" + STATE + "#access_token=at-1&state=" + STATE,
            STATE, null);

        assertThat(result.code()).isNull();
        assertThat(result.accessToken()).isEqualTo("at-1");
    }

    @Test
    @DisplayName("implicit flow should drop a code that appears in the fragment")
    void extractFromFragment_shouldDropCode_whenImplicit() {
        CallbackResult result = extractor.extractFromFragment(FlowType.IMPLICIT,
            "code=c&access_token=at-1&state=" + STATE, STATE, null);

        assertThat(result.code()).isNull();
    }

    @Test
    @DisplayName("extractFromFragment should raise a correlation error on state mismatch")
    void extractFromFragment_shouldThrowCorrelation_whenStateMismatch() {
        assertThatThrownBy(() -> extractor.extractFromFragment(FlowType.IMPLICIT,
            "access_token=at-1&state=forged", STATE, null))
            .isInstanceOf(CorrelationException.class);
    }

    @Test
    @DisplayName("extractFromFragment should reject an ID token with a different nonce")
    void extractFromFragment_shouldThrowCorrelation_whenNonceMismatch() {
        String idToken = TestJwts.idTokenWithNonce("replayed");

        assertThatThrownBy(() -> extractor.extractFromFragment(FlowType.IMPLICIT,
            "access_token=at-1&id_token=" + idToken + "&state=" + STATE, STATE, NONCE))
            .isInstanceOf(CorrelationException.class)
            .hasMessageContaining("nonce");
    }

    @Test
    @DisplayName("extractFromFragment should reject an ID token without a nonce claim when one was sent")
    void extractFromFragment_shouldThrowCorrelation_whenNonceClaimMissing() {
        String idToken = TestJwts.idTokenWithoutNonce();

        assertThatThrownBy(() -> extractor.extractFromFragment(FlowType.IMPLICIT,
            "id_token=" + idToken + "&state=" + STATE, STATE, NONCE))
            .isInstanceOf(CorrelationException.class);
    }

    @Test
    @DisplayName("an empty fragment yields an empty result without a state check")
    void extractFromFragment_shouldReturnEmpty_whenNothingPresent() {
        assertThat(extractor.extractFromFragment(FlowType.IMPLICIT, "", STATE, NONCE).isEmpty()).isTrue();
        assertThat(extractor.extractFromFragment(FlowType.IMPLICIT, null, STATE, NONCE).isEmpty()).isTrue();
    }

    // ========================================
    // HYBRID TESTS
    // ========================================

    @Test
    @DisplayName("hybrid should take the code and ID token from the fragment")
    void extract_shouldMergeFragment_whenHybrid() {
        String idToken = TestJwts.idTokenWithNonce(NONCE);
        CallbackResult result = extractor.extract(FlowType.HYBRID,
            REDIRECT + "#code=hybrid-code&id_token=" + idToken + "&state=" + STATE, STATE, NONCE);

        assertThat(result.code()).isEqualTo("hybrid-code");
        assertThat(result.idToken()).isEqualTo(idToken);
    }

    @Test
    @DisplayName("hybrid should merge a query code with fragment tokens")
    void extract_shouldMergeBothChannels_whenHybrid() {
        CallbackResult result = extractor.extract(FlowType.HYBRID,
            REDIRECT + "?code=query-code&state=" + STATE + "#access_token=at-1&state=" + STATE, STATE, null);

        assertThat(result.code()).isEqualTo("query-code");
        assertThat(result.accessToken()).isEqualTo("at-1");
    }

    @Test
    @DisplayName("hybrid should fail when either channel carries a forged state")
    void extract_shouldThrowCorrelation_whenOneHybridChannelForged() {
        assertThatThrownBy(() -> extractor.extract(FlowType.HYBRID,
            REDIRECT + "?code=query-code&state=forged#access_token=at-1&state=" + STATE, STATE, null))
            .isInstanceOf(CorrelationException.class);
    }
}
