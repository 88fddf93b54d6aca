package fr.lapetina.dopc.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import fr.lapetina.dopc.domain.model.ErrorType;

/**
 * Error body returned by both listeners: {@code {"success": false, "error": ..., "error_type": ...}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "error", "error_type"})
public record ErrorResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("error") String error,
        @JsonProperty("error_type") String errorType
) {
    public static ErrorResponse of(ErrorType errorType, String message) {
        return new ErrorResponse(false, message, errorType.name());
    }

    /**
     * Error without a type, as used for protocol-level rejections.
     */
    public static ErrorResponse of(String message) {
        return new ErrorResponse(false, message, null);
    }
}
