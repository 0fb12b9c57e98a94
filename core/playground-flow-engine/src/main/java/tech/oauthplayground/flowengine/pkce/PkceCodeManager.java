package tech.oauthplayground.flowengine.pkce;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.exception.FlowEngineException;
import tech.oauthplayground.flowengine.exception.FlowStateCorruptionException;
import tech.oauthplayground.flowengine.model.PkcePair;
import tech.oauthplayground.flowengine.store.FlowStateStore;
import tech.oauthplayground.flowengine.support.Masking;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * PKCE verifier/challenge lifecycle: generation, derivation and persistence.
 *
 * <p>The verifier must outlive the authorization redirect, so every generated pair
 * is written to the {@link FlowStateStore} and read back through its fast-then-durable
 * path. The pair is stored as a single JSON value under {@code pkce:{flowId}}, so a
 * write or removal can never leave one half behind.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceCodeManager {

    private static final Logger LOG = Logger.getLogger(PkceCodeManager.class);

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final int VERIFIER_BYTES = 48;

    private static final String CODE_VERIFIER = "codeVerifier";
    private static final String CODE_CHALLENGE = "codeChallenge";
    private static final String METHOD = "method";

    private final FlowStateStore store;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Inject
    public PkceCodeManager(FlowStateStore store) {
        this.store = store;
    }

    /**
     * Generate a new pair. 48 random bytes encode to a 64 character base64url verifier,
     * inside the 43-128 range of unreserved characters RFC 7636 requires.
     */
    public PkcePair generate() {
        byte[] bytes = new byte[VERIFIER_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        String verifier = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return new PkcePair(verifier, deriveChallenge(verifier));
    }

    /**
     * code_challenge = BASE64URL(SHA256(ASCII(code_verifier)))
     */
    public static String deriveChallenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Check a verifier against a challenge in constant time.
     */
    public static boolean verify(String codeVerifier, String codeChallenge) {
        if (codeVerifier == null || codeChallenge == null) {
            return false;
        }
        return MessageDigest.isEqual(
            deriveChallenge(codeVerifier).getBytes(StandardCharsets.US_ASCII),
            codeChallenge.getBytes(StandardCharsets.US_ASCII));
    }

    public static boolean isValidCodeVerifier(String codeVerifier) {
        if (codeVerifier == null || codeVerifier.length() < 43 || codeVerifier.length() > 128) {
            return false;
        }
        return codeVerifier.matches("^[A-Za-z0-9\\-._~]+$");
    }

    public void persist(String flowId, PkcePair pair) {
        ObjectNode json = objectMapper.createObjectNode()
            .put(CODE_VERIFIER, pair.codeVerifier())
            .put(CODE_CHALLENGE, pair.codeChallenge())
            .put(METHOD, pair.method());
        try {
            store.put(pairKey(flowId), objectMapper.writeValueAsString(json));
        } catch (JsonProcessingException e) {
            throw new FlowEngineException("Cannot serialize PKCE pair for flow " + flowId, e);
        }
        LOG.debugf("Persisted PKCE pair for flow [%s], verifier=%s", flowId, Masking.mask(pair.codeVerifier()));
    }

    /**
     * Load the stored pair for a flow.
     *
     * @return the pair, or empty when nothing was stored
     * @throws FlowStateCorruptionException if the stored value is unreadable, lacks a half,
     *         or its verifier does not match its challenge
     */
    public Optional<PkcePair> load(String flowId) {
        Optional<String> stored = store.get(pairKey(flowId));
        if (stored.isEmpty()) {
            return Optional.empty();
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(stored.get());
        } catch (JsonProcessingException e) {
            LOG.errorf("Unreadable PKCE pair stored for flow [%s]: %s", flowId, e.getOriginalMessage());
            throw new FlowStateCorruptionException("Stored PKCE pair for flow " + flowId + " cannot be read", e);
        }
        String verifier = text(json, CODE_VERIFIER);
        String challenge = text(json, CODE_CHALLENGE);
        if (verifier == null || challenge == null) {
            LOG.errorf("Half a PKCE pair stored for flow [%s] (verifier=%s, challenge=%s)",
                flowId, verifier != null, challenge != null);
            throw FlowStateCorruptionException.halfPkcePair(flowId);
        }
        if (!verify(verifier, challenge)) {
            LOG.errorf("Stored PKCE verifier does not match its challenge for flow [%s]", flowId);
            throw new FlowStateCorruptionException(
                "Stored PKCE verifier for flow " + flowId + " does not match its challenge");
        }
        return Optional.of(new PkcePair(verifier, challenge, text(json, METHOD)));
    }

    public void clear(String flowId) {
        store.remove(pairKey(flowId));
    }

    static String pairKey(String flowId) {
        return "pkce:" + flowId;
    }

    private static String text(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
