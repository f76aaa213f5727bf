package atrium.core.model.validation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared shape of a tool's JSON arguments.
 *
 * @param name              tool name used in messages
 * @param fields            declared fields in declaration order
 * @param minPresentFields  minimum number of declared fields that must be present
 */
public record RequestSchema(String name, List<FieldSpec> fields, int minPresentFields) {

    public RequestSchema {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Schema name cannot be blank");
        }
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public static RequestSchema of(String name, FieldSpec... fields) {
        return new RequestSchema(name, List.of(fields), 0);
    }

    public RequestSchema requireAtLeast(int count) {
        return new RequestSchema(name, fields, count);
    }

    public Optional<FieldSpec> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    public Map<String, FieldSpec> byName() {
        final var map = new LinkedHashMap<String, FieldSpec>();
        fields.forEach(f -> map.put(f.name(), f));
        return map;
    }
}
