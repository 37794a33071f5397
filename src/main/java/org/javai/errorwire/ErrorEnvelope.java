package org.javai.errorwire;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The single JSON shape of every error response: {@code {"errors":[...]}}.
 *
 * @param errors The error entries, in order
 */
public record ErrorEnvelope(@JsonProperty("errors") List<ErrorItem> errors) {

    @JsonCreator
    public ErrorEnvelope {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ErrorEnvelope of(ClassifiedError classified) {
        return new ErrorEnvelope(List.of(ErrorItem.from(classified)));
    }

    public static ErrorEnvelope ofViolations(List<FieldViolation> violations) {
        return new ErrorEnvelope(violations.stream().map(ErrorItem::from).toList());
    }
}
