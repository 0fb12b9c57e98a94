package tech.oauthplayground.flowengine.callback;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.exception.CorrelationException;
import tech.oauthplayground.flowengine.exception.ConfigurationException;
import tech.oauthplayground.flowengine.model.CallbackResult;
import tech.oauthplayground.flowengine.model.FlowType;
import tech.oauthplayground.flowengine.support.Masking;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns an authorization redirect into a {@link CallbackResult}.
 *
 * <p>The flow type decides which channel is trusted, not which channel happens to
 * carry data: authorization code reads the query only, implicit reads the fragment
 * only, hybrid reads both and merges them. Every non-empty channel must echo the
 * expected state. No network I/O.
 */
@ApplicationScoped
public class CallbackExtractor {

    private static final Logger LOG = Logger.getLogger(CallbackExtractor.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Read {@code code}, {@code state} and {@code error} from a query string.
     * Anything after a {@code #} is not part of the query and is ignored.
     *
     * @throws CorrelationException if state is missing or does not match
     */
    public CallbackResult extractFromQuery(String rawQuery, String expectedState) {
        Map<String, String> params = parse(stripFragment(rawQuery));
        if (params.isEmpty()) {
            return CallbackResult.empty();
        }
        checkState(params.get("state"), expectedState);
        return new CallbackResult(
            params.get("code"), params.get("state"),
            null, null, null, null, null,
            params.get("error"), params.get("error_description"));
    }

    /**
     * Read tokens from a fragment. For implicit flows a code in the fragment is dropped.
     *
     * @param nonce the nonce sent with the request; when present an ID token must carry it
     * @throws CorrelationException if state or nonce do not match
     */
    public CallbackResult extractFromFragment(FlowType flowType, String rawFragment, String expectedState, String nonce) {
        if (flowType != FlowType.IMPLICIT && flowType != FlowType.HYBRID) {
            throw ConfigurationException.unsupportedFlow("Fragment extraction", flowType.value());
        }
        Map<String, String> params = parse(rawFragment);
        if (params.isEmpty()) {
            return CallbackResult.empty();
        }
        checkState(params.get("state"), expectedState);

        String idToken = params.get("id_token");
        if (idToken != null && nonce != null) {
            checkNonce(idToken, nonce);
        }
        return new CallbackResult(
            flowType == FlowType.HYBRID ? params.get("code") : null,
            params.get("state"),
            params.get("access_token"),
            idToken,
            params.get("token_type"),
            parseLong(params.get("expires_in")),
            params.get("scope"),
            params.get("error"),
            params.get("error_description"));
    }

    /**
     * Extract from a full redirect URL using the channels the flow type trusts.
     */
    public CallbackResult extract(FlowType flowType, String redirectUrl, String expectedState, String nonce) {
        String query = null;
        String fragment = null;
        if (redirectUrl != null) {
            int hash = redirectUrl.indexOf('#');
            String beforeFragment = hash >= 0 ? redirectUrl.substring(0, hash) : redirectUrl;
            fragment = hash >= 0 ? redirectUrl.substring(hash + 1) : null;
            int question = beforeFragment.indexOf('?');
            query = question >= 0 ? beforeFragment.substring(question + 1) : null;
        }

        CallbackResult result = switch (flowType) {
            case AUTHORIZATION_CODE -> extractFromQuery(query, expectedState);
            case IMPLICIT -> extractFromFragment(flowType, fragment, expectedState, nonce);
            case HYBRID -> merge(
                extractFromQuery(query, expectedState),
                extractFromFragment(flowType, fragment, expectedState, nonce));
            default -> throw ConfigurationException.unsupportedFlow("Callback extraction", flowType.value());
        };

        if (result.isError()) {
            LOG.warnf("Authorization response for %s carried error %s", flowType.value(), result.error());
        } else if (!result.isEmpty()) {
            LOG.infof("Extracted %s callback (code=%s, accessToken=%s, idToken=%s)", flowType.value(),
                Masking.mask(result.code()), Masking.mask(result.accessToken()), result.idToken() != null);
        }
        return result;
    }

    /**
     * Fragment values win for tokens, the code is taken from whichever channel has it.
     */
    static CallbackResult merge(CallbackResult query, CallbackResult fragment) {
        return new CallbackResult(
            fragment.hasCode() ? fragment.code() : query.code(),
            fragment.state() != null ? fragment.state() : query.state(),
            fragment.accessToken(),
            fragment.idToken(),
            fragment.tokenType(),
            fragment.expiresIn(),
            fragment.scope(),
            fragment.isError() ? fragment.error() : query.error(),
            fragment.isError() ? fragment.errorDescription() : query.errorDescription());
    }

    private static void checkState(String actual, String expected) {
        if (expected == null) {
            throw CorrelationException.noRequestInProgress();
        }
        if (actual == null || actual.isEmpty()) {
            throw CorrelationException.stateMissing();
        }
        if (!MessageDigest.isEqual(actual.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8))) {
            LOG.warn("Rejected authorization response with mismatched state");
            throw CorrelationException.stateMismatch();
        }
    }

    private void checkNonce(String idToken, String expectedNonce) {
        String[] parts = idToken.split("\\.");
        if (parts.length < 2) {
            throw new CorrelationException("ID token is not a JWT");
        }
        Map<String, Object> claims;
        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            claims = objectMapper.readValue(payload, new TypeReference<Map<String, Object>>() {});
        } catch (IllegalArgumentException | IOException e) {
            throw new CorrelationException("ID token payload cannot be decoded: " + e.getMessage());
        }
        Object nonce = claims.get("nonce");
        if (nonce == null) {
            throw CorrelationException.nonceMissing();
        }
        if (!expectedNonce.equals(nonce.toString())) {
            LOG.warn("Rejected ID token with mismatched nonce");
            throw CorrelationException.nonceMismatch();
        }
    }

    static Map<String, String> parse(String raw) {
        Map<String, String> params = new LinkedHashMap<>();
        if (raw == null) {
            return params;
        }
        String trimmed = raw.startsWith("?") || raw.startsWith("#") ? raw.substring(1) : raw;
        for (String pair : trimmed.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = decode(eq >= 0 ? pair.substring(0, eq) : pair);
            String value = eq >= 0 ? decode(pair.substring(eq + 1)) : "";
            params.putIfAbsent(key, value);
        }
        return params;
    }

    private static String stripFragment(String rawQuery) {
        if (rawQuery == null) {
            return null;
        }
        int hash = rawQuery.indexOf('#');
        return hash >= 0 ? rawQuery.substring(0, hash) : rawQuery;
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    private static Long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
