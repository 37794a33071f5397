package org.javai.errorwire;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One entry of an {@link ErrorEnvelope} as it appears on the wire.
 *
 * <pre>{@code
 * {"error":"validation","errorCode":8000,"field":"email","description":"must not be blank"}
 * }</pre>
 *
 * @param error The error name
 * @param errorCode The error code, omitted when 0
 * @param field The offending field, omitted when empty
 * @param description The description, omitted when empty
 */
@JsonPropertyOrder({"error", "errorCode", "field", "description"})
public record ErrorItem(
        @JsonProperty("error") String error,
        @JsonProperty("errorCode") @JsonInclude(JsonInclude.Include.NON_DEFAULT) int errorCode,
        @JsonProperty("field") @JsonInclude(JsonInclude.Include.NON_EMPTY) String field,
        @JsonProperty("description") @JsonInclude(JsonInclude.Include.NON_EMPTY) String description
) {

    @JsonCreator
    public ErrorItem {
        Objects.requireNonNull(error, "error must not be null");
        field = field == null ? "" : field;
        description = description == null ? "" : description;
    }

    public static ErrorItem from(ClassifiedError classified) {
        return new ErrorItem(classified.typeName(), classified.code(), "", classified.description());
    }

    public static ErrorItem from(FieldViolation violation) {
        return new ErrorItem(violation.errorName(), violation.errorCode(), violation.field(), violation.description());
    }
}
