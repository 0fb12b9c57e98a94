package tech.oauthplayground.flowengine.support;

/**
 * Log-safe rendering of codes and tokens.
 */
public final class Masking {

    private static final int VISIBLE_CHARS = 6;

    private Masking() {
    }

    /**
     * First six characters followed by an ellipsis. Short or null values are fully hidden.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "<none>";
        }
        if (secret.length() <= VISIBLE_CHARS) {
            return "***";
        }
        return secret.substring(0, VISIBLE_CHARS) + "...";
    }
}
