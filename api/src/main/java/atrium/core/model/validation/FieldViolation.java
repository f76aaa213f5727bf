package atrium.core.model.validation;

/**
 * A single schema violation, safe to return to the caller.
 */
public record FieldViolation(String field, String message) {}
