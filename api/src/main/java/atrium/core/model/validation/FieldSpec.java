package atrium.core.model.validation;

/**
 * A named field in a {@link RequestSchema}.
 */
public record FieldSpec(String name, boolean required, FieldRule rule) {

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be blank");
        }
        if (rule == null) {
            throw new IllegalArgumentException("Field rule cannot be null");
        }
    }

    public static FieldSpec required(String name, FieldRule rule) {
        return new FieldSpec(name, true, rule);
    }

    public static FieldSpec optional(String name, FieldRule rule) {
        return new FieldSpec(name, false, rule);
    }
}
