package tech.oauthplayground.flowengine.server;

import java.util.Map;

/**
 * A non-5xx response from the authorization server with its JSON body parsed.
 *
 * @param status HTTP status
 * @param body parsed JSON object, empty when the body was blank or not an object
 * @param rawBody the body as received
 */
public record HttpResult(int status, Map<String, Object> body, String rawBody) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public String string(String field) {
        Object value = body.get(field);
        return value != null ? value.toString() : null;
    }

    public Long number(String field) {
        Object value = body.get(field);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
