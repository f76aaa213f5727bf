package atrium.core.model.validation;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Declarative constraint on a single JSON field.
 *
 * <p>Rules are evaluated by {@code atrium.core.service.security.SchemaValidator}.
 */
public sealed interface FieldRule
        permits FieldRule.StringRule,
                FieldRule.NumberRule,
                FieldRule.EnumRule,
                FieldRule.ArrayRule,
                FieldRule.BooleanRule {

    /** Short type name used in violation messages. */
    String typeName();

    /**
     * Textual value with inclusive length bounds and an optional format.
     */
    record StringRule(int minLength, int maxLength, StringFormat format) implements FieldRule {

        public StringRule {
            if (minLength < 0 || maxLength < minLength) {
                throw new IllegalArgumentException("Invalid length bounds: " + minLength + ".." + maxLength);
            }
            format = format != null ? format : StringFormat.ANY;
        }

        public static StringRule length(int min, int max) {
            return new StringRule(min, max, StringFormat.ANY);
        }

        @Override
        public String typeName() {
            return "string";
        }
    }

    /**
     * Numeric value with inclusive bounds.
     */
    record NumberRule(Optional<Long> min, Optional<Long> max, boolean integerOnly) implements FieldRule {

        public NumberRule {
            min = min != null ? min : Optional.empty();
            max = max != null ? max : Optional.empty();
        }

        public static NumberRule integer(long min, long max) {
            return new NumberRule(Optional.of(min), Optional.of(max), true);
        }

        @Override
        public String typeName() {
            return integerOnly ? "integer" : "number";
        }
    }

    /**
     * String value restricted to a fixed set.
     */
    record EnumRule(Set<String> values) implements FieldRule {

        public EnumRule {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("Enum rule needs at least one value");
            }
            values = Set.copyOf(values);
        }

        public static EnumRule of(String... values) {
            return new EnumRule(Set.of(values));
        }

        public List<String> sortedValues() {
            return values.stream().sorted().toList();
        }

        @Override
        public String typeName() {
            return "enum";
        }
    }

    /**
     * Array whose items all satisfy {@code itemRule}.
     */
    record ArrayRule(FieldRule itemRule, int maxItems) implements FieldRule {

        public ArrayRule {
            if (itemRule == null) {
                throw new IllegalArgumentException("itemRule cannot be null");
            }
            if (maxItems < 0) {
                throw new IllegalArgumentException("maxItems cannot be negative");
            }
        }

        @Override
        public String typeName() {
            return "array";
        }
    }

    record BooleanRule() implements FieldRule {

        @Override
        public String typeName() {
            return "boolean";
        }
    }

    /**
     * Additional syntactic checks for string fields.
     */
    enum StringFormat {
        ANY(null),
        SLUG(Pattern.compile("^[a-z0-9-]+$")),
        EMAIL(Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$")),
        DATE_TIME(null);

        private final Pattern pattern;

        StringFormat(Pattern pattern) {
            this.pattern = pattern;
        }

        public Optional<Pattern> pattern() {
            return Optional.ofNullable(pattern);
        }
    }
}
