package org.javai.errorwire;

import java.util.Objects;

/**
 * The stable public shape of an arbitrary error.
 * This is what classifiers produce; encoders render it on the wire.
 *
 * @param typeName The public error name (e.g., "not_found", "com.acme.OrderMissing", "error")
 * @param code Application error code, 0 when the error carries none
 * @param description Human-readable description (may be empty, never null)
 * @param httpStatus The HTTP status to respond with
 */
public record ClassifiedError(String typeName, int code, String description, int httpStatus) {

    public ClassifiedError {
        Objects.requireNonNull(typeName, "typeName must not be null");
        description = description == null ? "" : description;
        if (!HttpStatus.isValid(httpStatus)) {
            throw new IllegalArgumentException("httpStatus must be a valid HTTP status: " + httpStatus);
        }
    }
}
