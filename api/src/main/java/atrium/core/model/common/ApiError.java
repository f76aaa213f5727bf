package atrium.core.model.common;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error envelope returned on every failure path.
 *
 * @param error     human-readable message, never containing internal detail
 * @param code      machine-readable error code
 * @param timestamp ISO-8601 instant the error was produced
 * @param details   optional structured details (may be null)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(String error, ErrorCode code, String timestamp, Map<String, Object> details) {

    public ApiError {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error message cannot be blank");
        }
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        details = details != null ? Map.copyOf(details) : null;
    }

    @JsonIgnore
    public int httpStatus() {
        return code.httpStatus();
    }
}
