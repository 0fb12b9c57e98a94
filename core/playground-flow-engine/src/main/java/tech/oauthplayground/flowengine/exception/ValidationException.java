package tech.oauthplayground.flowengine.exception;

import java.util.List;

/**
 * A precondition failed before any network call. Always recoverable by
 * correcting the named fields; nothing has been mutated.
 */
public class ValidationException extends FlowEngineException {

    private final List<ValidationError> errors;

    public ValidationException(String message, List<ValidationError> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public List<String> getMessages() {
        return errors.stream().map(ValidationError::message).toList();
    }

    public boolean hasCode(String code) {
        return errors.stream().anyMatch(e -> e.code().equals(code));
    }

    public static ValidationException of(List<ValidationError> errors) {
        String summary = errors.size() == 1
            ? errors.get(0).message()
            : "Validation failed: " + String.join("; ", errors.stream().map(ValidationError::message).toList());
        return new ValidationException(summary, errors);
    }

    public static ValidationException single(String field, String message, String code) {
        return of(List.of(new ValidationError(field, message, code)));
    }

    public record ValidationError(String field, String message, String code) {}
}
