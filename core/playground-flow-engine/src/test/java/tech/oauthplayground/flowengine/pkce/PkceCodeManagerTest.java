package tech.oauthplayground.flowengine.pkce;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.oauthplayground.flowengine.exception.FlowStateCorruptionException;
import tech.oauthplayground.flowengine.model.PkcePair;
import tech.oauthplayground.flowengine.store.InMemoryFlowStateStore;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.Base64;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class PkceCodeManagerTest {

    private InMemoryFlowStateStore store;
    private PkceCodeManager manager;

    @BeforeEach
    void setUp() {
        store = new InMemoryFlowStateStore(Duration.ofMinutes(5), 100);
        manager = new PkceCodeManager(store);
    }

    // ========================================
    // GENERATION TESTS
    // ========================================

    @Test
    @DisplayName("generate should produce a 43-128 character verifier of unreserved characters")
    void generate_shouldProduceRfcCompliantVerifier() {
        PkcePair pair = manager.generate();

        assertThat(pair.codeVerifier()).hasSizeBetween(43, 128);
        assertThat(pair.codeVerifier()).matches("^[A-Za-z0-9\\-._~]+$");
        assertThat(PkceCodeManager.isValidCodeVerifier(pair.codeVerifier())).isTrue();
        assertThat(pair.method()).isEqualTo("S256");
    }

    @Test
    @DisplayName("generate should derive the challenge as base64url SHA-256 of the verifier")
    void generate_shouldDeriveS256Challenge() throws Exception {
        PkcePair pair = manager.generate();

        byte[] hash = MessageDigest.getInstance("SHA-256")
            .digest(pair.codeVerifier().getBytes(StandardCharsets.US_ASCII));
        String expected = Base64.getUrlEncoder().withoutPadding().encodeToString(hash);

        assertThat(pair.codeChallenge()).isEqualTo(expected).hasSize(43);
    }

    @Test
    @DisplayName("deriveChallenge should match the RFC 7636 appendix B example")
    void deriveChallenge_shouldMatchRfcExample() {
        assertThat(PkceCodeManager.deriveChallenge("dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk"))
            .isEqualTo("E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM");
    }

    @Test
    @DisplayName("generate should not repeat verifiers")
    void generate_shouldProduceUniqueVerifiers() {
        Set<String> verifiers = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            verifiers.add(manager.generate().codeVerifier());
        }
        assertThat(verifiers).hasSize(50);
    }

    @Test
    @DisplayName("verify should reject a verifier that does not hash to the challenge")
    void verify_shouldReturnFalse_whenVerifierDoesNotMatch() {
        PkcePair pair = manager.generate();
        PkcePair other = manager.generate();

        assertThat(PkceCodeManager.verify(pair.codeVerifier(), pair.codeChallenge())).isTrue();
        assertThat(PkceCodeManager.verify(other.codeVerifier(), pair.codeChallenge())).isFalse();
        assertThat(PkceCodeManager.verify(null, pair.codeChallenge())).isFalse();
    }

    // ========================================
    // PERSISTENCE TESTS
    // ========================================

    @Test
    @DisplayName("load should return the persisted pair")
    void load_shouldReturnPersistedPair() {
        PkcePair pair = manager.generate();
        manager.persist("flow-1", pair);

        assertThat(manager.load("flow-1")).contains(pair);
    }

    @Test
    @DisplayName("load should fall back to the durable tier when the fast tier was lost")
    void load_shouldUseDurableTier_whenFastTierMisses() {
        PkcePair pair = manager.generate();
        manager.persist("flow-1", pair);
        store.evictFastTier();

        assertThat(manager.load("flow-1")).contains(pair);
        assertThat(store.getFast(PkceCodeManager.pairKey("flow-1"))).isPresent();
    }

    @Test
    @DisplayName("persist should write the pair as one value under one key")
    void persist_shouldWriteSingleJsonValue() {
        PkcePair pair = manager.generate();

        manager.persist("flow-1", pair);

        assertThat(store.get(PkceCodeManager.pairKey("flow-1"))).hasValueSatisfying(json -> assertThat(json)
            .contains("\"codeVerifier\":\"" + pair.codeVerifier() + "\"")
            .contains("\"codeChallenge\":\"" + pair.codeChallenge() + "\"")
            .contains("\"method\":\"S256\""));
        assertThat(store.get("pkce:flow-1:verifier")).isEmpty();
        assertThat(store.get("pkce:flow-1:challenge")).isEmpty();
    }

    @Test
    @DisplayName("load should return empty when nothing was stored")
    void load_shouldReturnEmpty_whenNothingStored() {
        assertThat(manager.load("unknown")).isEqualTo(Optional.empty());
    }

    @Test
    @DisplayName("load should treat a stored challenge without a verifier as corruption")
    void load_shouldThrowCorruption_whenVerifierMissing() {
        PkcePair pair = manager.generate();
        store.put(PkceCodeManager.pairKey("flow-1"), "{\"codeChallenge\":\"" + pair.codeChallenge() + "\"}");

        assertThatThrownBy(() -> manager.load("flow-1"))
            .isInstanceOf(FlowStateCorruptionException.class)
            .hasMessageContaining("flow-1");
    }

    @Test
    @DisplayName("load should treat a verifier without a challenge as corruption")
    void load_shouldThrowCorruption_whenChallengeMissing() {
        PkcePair pair = manager.generate();
        store.put(PkceCodeManager.pairKey("flow-2"),
            "{\"codeVerifier\":\"" + pair.codeVerifier() + "\",\"codeChallenge\":\" \"}");

        assertThatThrownBy(() -> manager.load("flow-2"))
            .isInstanceOf(FlowStateCorruptionException.class);
    }

    @Test
    @DisplayName("load should treat an unreadable stored value as corruption")
    void load_shouldThrowCorruption_whenValueUnreadable() {
        store.put(PkceCodeManager.pairKey("flow-4"), "{not json");

        assertThatThrownBy(() -> manager.load("flow-4"))
            .isInstanceOf(FlowStateCorruptionException.class)
            .hasMessageContaining("cannot be read");
    }

    @Test
    @DisplayName("load should treat halves from different pairs as corruption")
    void load_shouldThrowCorruption_whenHalvesDoNotMatch() {
        store.put(PkceCodeManager.pairKey("flow-3"), "{\"codeVerifier\":\"" + manager.generate().codeVerifier()
            + "\",\"codeChallenge\":\"" + manager.generate().codeChallenge() + "\"}");

        assertThatThrownBy(() -> manager.load("flow-3"))
            .isInstanceOf(FlowStateCorruptionException.class)
            .hasMessageContaining("does not match");
    }

    @Test
    @DisplayName("clear should remove the stored pair")
    void clear_shouldRemovePair() {
        manager.persist("flow-1", manager.generate());
        manager.clear("flow-1");

        assertThat(manager.load("flow-1")).isEmpty();
        assertThat(store.get(PkceCodeManager.pairKey("flow-1"))).isEmpty();
    }
}
