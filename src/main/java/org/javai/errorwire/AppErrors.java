package org.javai.errorwire;

/**
 * Factories for the application errors produced around request decoding and routing.
 */
public final class AppErrors {

    public static final String UNKNOWN_ERROR_TYPE = "unknown";
    public static final int UNKNOWN_ERROR_CODE = 0;
    public static final String JSON_ERROR_TYPE = "json";
    public static final int JSON_ERROR_CODE = 9001;
    public static final String MARSHALER_ERROR_TYPE = "marshaler";
    public static final int MARSHALER_ERROR_CODE = 9002;
    public static final String VALIDATION_ERROR_TYPE = "validation";
    public static final int VALIDATION_ERROR_CODE = 8000;

    private AppErrors() {
        // Utility class
    }

    /**
     * A request body that could not be parsed as JSON.
     */
    public static AppError jsonError(String description) {
        return new AppError(JSON_ERROR_TYPE, JSON_ERROR_CODE, description, HttpStatus.BAD_REQUEST);
    }

    /**
     * A handler declared an untyped body for a method that carries one.
     */
    public static AppError marshalerEmptyBody(String method) {
        return new AppError(MARSHALER_ERROR_TYPE, MARSHALER_ERROR_CODE,
                "Empty interface is not suitable for " + method + " request bodies",
                HttpStatus.INTERNAL_SERVER_ERROR);
    }

    /**
     * The request declared a content type other than JSON.
     */
    public static AppError marshalerContentType(String contentType) {
        return new AppError(MARSHALER_ERROR_TYPE, MARSHALER_ERROR_CODE,
                "Content-Type header is " + contentType + ", not application/json",
                HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    }

    /**
     * No route matched. Carries no type, so its name comes from the status or the class.
     */
    public static AppError methodNotFound(String description) {
        return new AppError("", UNKNOWN_ERROR_CODE, description, HttpStatus.NOT_FOUND);
    }

    /**
     * A route matched but not for the request method.
     */
    public static AppError methodNotAllowed(String description) {
        return new AppError("", UNKNOWN_ERROR_CODE, "Method not allowed, " + description,
                HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * An application error without an HTTP status; classification responds 500.
     */
    public static AppError of(int code, String type, String description) {
        return new AppError(type, code, description);
    }
}
