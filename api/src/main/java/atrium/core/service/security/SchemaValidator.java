package atrium.core.service.security;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.fasterxml.jackson.databind.JsonNode;

import atrium.core.model.validation.FieldRule;
import atrium.core.model.validation.FieldRule.ArrayRule;
import atrium.core.model.validation.FieldRule.BooleanRule;
import atrium.core.model.validation.FieldRule.EnumRule;
import atrium.core.model.validation.FieldRule.NumberRule;
import atrium.core.model.validation.FieldRule.StringFormat;
import atrium.core.model.validation.FieldRule.StringRule;
import atrium.core.model.validation.FieldViolation;
import atrium.core.model.validation.RequestSchema;

/**
 * Evaluates JSON arguments against a {@link RequestSchema}.
 *
 * <p>Type checks are strict: a string where a number is declared, or an object where a scalar is
 * declared, is a violation. Fields not declared by the schema are rejected.
 */
@ApplicationScoped
public class SchemaValidator {

    /**
     * Validate arguments.
     *
     * @param schema    the declared schema
     * @param arguments the arguments object
     * @return violations in field order, empty when valid
     */
    public List<FieldViolation> validate(RequestSchema schema, JsonNode arguments) {
        final var violations = new ArrayList<FieldViolation>();
        if (arguments == null || !arguments.isObject()) {
            violations.add(new FieldViolation("$", "arguments must be a JSON object"));
            return violations;
        }

        final var declared = schema.byName();
        arguments.fieldNames().forEachRemaining(name -> {
            if (!declared.containsKey(name)) {
                violations.add(new FieldViolation(name, "unknown field"));
            }
        });

        var present = 0;
        for (final var field : schema.fields()) {
            final var value = arguments.get(field.name());
            if (value == null || value.isNull()) {
                if (field.required()) {
                    violations.add(new FieldViolation(field.name(), "is required"));
                }
                continue;
            }
            present++;
            check(field.name(), field.rule(), value, violations);
        }

        if (present < schema.minPresentFields()) {
            violations.add(new FieldViolation(
                    "$", "at least %d of %s must be provided".formatted(schema.minPresentFields(), declared.keySet())));
        }
        return violations;
    }

    /**
     * Dispatch on the rule type.
     */
    void check(String path, FieldRule rule, JsonNode value, List<FieldViolation> violations) {
        if (rule instanceof StringRule stringRule) {
            checkString(path, stringRule, value, violations);
        } else if (rule instanceof NumberRule numberRule) {
            checkNumber(path, numberRule, value, violations);
        } else if (rule instanceof EnumRule enumRule) {
            checkEnum(path, enumRule, value, violations);
        } else if (rule instanceof ArrayRule arrayRule) {
            checkArray(path, arrayRule, value, violations);
        } else if (rule instanceof BooleanRule) {
            if (!value.isBoolean()) {
                violations.add(typeMismatch(path, rule));
            }
        } else {
            throw new IllegalStateException("Unhandled rule type: " + rule.getClass().getName());
        }
    }

    private void checkString(String path, StringRule rule, JsonNode value, List<FieldViolation> violations) {
        if (!value.isTextual()) {
            violations.add(typeMismatch(path, rule));
            return;
        }
        final var text = value.asText();
        final var length = text.trim().length();
        if (length < rule.minLength() || text.length() > rule.maxLength()) {
            violations.add(new FieldViolation(
                    path, "length must be between %d and %d".formatted(rule.minLength(), rule.maxLength())));
            return;
        }
        if (rule.format() == StringFormat.DATE_TIME) {
            if (!isDateTime(text)) {
                violations.add(new FieldViolation(path, "must be an ISO-8601 date-time"));
            }
            return;
        }
        rule.format().pattern().ifPresent(pattern -> {
            if (!pattern.matcher(text).matches()) {
                violations.add(new FieldViolation(
                        path, "must be a valid " + rule.format().name().toLowerCase(java.util.Locale.ROOT)));
            }
        });
    }

    private void checkNumber(String path, NumberRule rule, JsonNode value, List<FieldViolation> violations) {
        if (!value.isNumber() || (rule.integerOnly() && !value.canConvertToLong())) {
            violations.add(typeMismatch(path, rule));
            return;
        }
        if (rule.integerOnly() && !value.isIntegralNumber()) {
            violations.add(typeMismatch(path, rule));
            return;
        }
        final var number = value.asDouble();
        if (rule.min().isPresent() && number < rule.min().get()) {
            violations.add(new FieldViolation(path, "must be at least " + rule.min().get()));
        }
        if (rule.max().isPresent() && number > rule.max().get()) {
            violations.add(new FieldViolation(path, "must be at most " + rule.max().get()));
        }
    }

    private void checkEnum(String path, EnumRule rule, JsonNode value, List<FieldViolation> violations) {
        if (!value.isTextual()) {
            violations.add(typeMismatch(path, rule));
            return;
        }
        if (!rule.values().contains(value.asText())) {
            violations.add(new FieldViolation(path, "must be one of " + rule.sortedValues()));
        }
    }

    private void checkArray(String path, ArrayRule rule, JsonNode value, List<FieldViolation> violations) {
        if (!value.isArray()) {
            violations.add(typeMismatch(path, rule));
            return;
        }
        if (value.size() > rule.maxItems()) {
            violations.add(new FieldViolation(path, "must have at most %d items".formatted(rule.maxItems())));
            return;
        }
        for (var i = 0; i < value.size(); i++) {
            check(path + "[" + i + "]", rule.itemRule(), value.get(i), violations);
        }
    }

    private static FieldViolation typeMismatch(String path, FieldRule rule) {
        return new FieldViolation(path, "must be of type " + rule.typeName());
    }

    private static boolean isDateTime(String text) {
        try {
            OffsetDateTime.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
