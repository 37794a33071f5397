package org.javai.errorwire;

/**
 * An application error that carries its wire classification explicitly.
 *
 * <p>Unlike arbitrary exceptions, an {@code AppError} needs no introspection: its type,
 * code, description and HTTP status are rendered as given. Use {@link AppErrors} for the
 * errors the toolkit itself produces.
 */
public class AppError extends RuntimeException implements Named, HttpStatusEquivalent {

    private final String type;
    private final int code;
    private final String description;
    private final int httpStatus;

    /**
     * @param type The public error type (may be empty, in which case classification falls back)
     * @param code Application error code, 0 for none
     * @param description Human-readable description
     * @param httpStatus HTTP status, 0 when unspecified
     */
    public AppError(String type, int code, String description, int httpStatus) {
        super(description);
        this.type = type == null ? "" : type;
        this.code = code;
        this.description = description == null ? "" : description;
        this.httpStatus = httpStatus;
    }

    public AppError(String type, int code, String description) {
        this(type, code, description, 0);
    }

    public String type() {
        return type;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }

    @Override
    public String errorName() {
        return type;
    }

    @Override
    public int httpStatus() {
        return httpStatus;
    }
}
