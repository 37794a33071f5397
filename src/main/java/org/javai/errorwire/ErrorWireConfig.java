package org.javai.errorwire;

import java.util.Objects;

/**
 * Settings shared by the classifier, the encoder and the validation engine.
 * Built once at startup and handed to each component's constructor.
 *
 * <p>{@link #fromEnvironment()} resolves each setting from a system property with an
 * environment variable fallback:
 * <ul>
 *   <li>{@code errorwire.snakeCaseHttpEquivErrors} / {@code ERRORWIRE_SNAKE_CASE_HTTP_EQUIV_ERRORS}</li>
 *   <li>{@code errorwire.validationErrorCode} / {@code ERRORWIRE_VALIDATION_ERROR_CODE}</li>
 *   <li>{@code errorwire.validationErrorName} / {@code ERRORWIRE_VALIDATION_ERROR_NAME}</li>
 *   <li>{@code errorwire.fallbackErrorName} / {@code ERRORWIRE_FALLBACK_ERROR_NAME}</li>
 *   <li>{@code errorwire.maxValidationDepth} / {@code ERRORWIRE_MAX_VALIDATION_DEPTH}</li>
 * </ul>
 *
 * @param snakeCaseHttpEquivErrors Name status-bearing errors after their reason phrase ({@code not_found})
 * @param validationErrorCode Code stamped on every field violation
 * @param validationErrorName Error name stamped on every field violation
 * @param fallbackErrorName Name used for errors whose type cannot be shown
 * @param maxValidationDepth How many nested structures validation descends into
 */
public record ErrorWireConfig(
        boolean snakeCaseHttpEquivErrors,
        int validationErrorCode,
        String validationErrorName,
        String fallbackErrorName,
        int maxValidationDepth
) {

    public static final int DEFAULT_MAX_VALIDATION_DEPTH = 32;
    public static final String DEFAULT_FALLBACK_ERROR_NAME = "error";

    private static final ErrorWireConfig DEFAULTS = builder().build();

    public ErrorWireConfig {
        Objects.requireNonNull(validationErrorName, "validationErrorName must not be null");
        Objects.requireNonNull(fallbackErrorName, "fallbackErrorName must not be null");
        if (fallbackErrorName.isBlank()) {
            throw new IllegalArgumentException("fallbackErrorName must not be blank");
        }
        if (maxValidationDepth < 1) {
            throw new IllegalArgumentException("maxValidationDepth must be at least 1");
        }
    }

    public static ErrorWireConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the configuration from system properties, then environment variables,
     * then defaults.
     *
     * @throws IllegalStateException if a numeric setting is not a number
     */
    public static ErrorWireConfig fromEnvironment() {
        Builder builder = builder();
        String snakeCase = resolve("errorwire.snakeCaseHttpEquivErrors", "ERRORWIRE_SNAKE_CASE_HTTP_EQUIV_ERRORS");
        if (snakeCase != null) {
            builder.snakeCaseHttpEquivErrors(Boolean.parseBoolean(snakeCase.trim()));
        }
        String code = resolve("errorwire.validationErrorCode", "ERRORWIRE_VALIDATION_ERROR_CODE");
        if (code != null) {
            builder.validationErrorCode(parseInt("errorwire.validationErrorCode", code));
        }
        String name = resolve("errorwire.validationErrorName", "ERRORWIRE_VALIDATION_ERROR_NAME");
        if (name != null) {
            builder.validationErrorName(name.trim());
        }
        String fallback = resolve("errorwire.fallbackErrorName", "ERRORWIRE_FALLBACK_ERROR_NAME");
        if (fallback != null) {
            builder.fallbackErrorName(fallback.trim());
        }
        String depth = resolve("errorwire.maxValidationDepth", "ERRORWIRE_MAX_VALIDATION_DEPTH");
        if (depth != null) {
            builder.maxValidationDepth(parseInt("errorwire.maxValidationDepth", depth));
        }
        return builder.build();
    }

    private static String resolve(String sysProp, String envVar) {
        String value = System.getProperty(sysProp);
        if (value == null || value.isBlank()) {
            value = System.getenv(envVar);
        }
        if (value == null || value.isBlank()) {
            return null;
        }
        return value;
    }

    private static int parseInt(String sysProp, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Invalid configuration: '" + sysProp + "' must be an integer but was '" + value + "'", e);
        }
    }

    /**
     * Returns a copy with a different validation error code and name.
     */
    public ErrorWireConfig withValidationError(int code, String name) {
        return new ErrorWireConfig(snakeCaseHttpEquivErrors, code, name, fallbackErrorName, maxValidationDepth);
    }

    public static class Builder {
        private boolean snakeCaseHttpEquivErrors;
        private int validationErrorCode = AppErrors.VALIDATION_ERROR_CODE;
        private String validationErrorName = AppErrors.VALIDATION_ERROR_TYPE;
        private String fallbackErrorName = DEFAULT_FALLBACK_ERROR_NAME;
        private int maxValidationDepth = DEFAULT_MAX_VALIDATION_DEPTH;

        private Builder() {
        }

        public Builder snakeCaseHttpEquivErrors(boolean enabled) {
            this.snakeCaseHttpEquivErrors = enabled;
            return this;
        }

        public Builder validationErrorCode(int code) {
            this.validationErrorCode = code;
            return this;
        }

        public Builder validationErrorName(String name) {
            this.validationErrorName = name;
            return this;
        }

        public Builder fallbackErrorName(String name) {
            this.fallbackErrorName = name;
            return this;
        }

        public Builder maxValidationDepth(int depth) {
            this.maxValidationDepth = depth;
            return this;
        }

        public ErrorWireConfig build() {
            return new ErrorWireConfig(snakeCaseHttpEquivErrors, validationErrorCode, validationErrorName,
                    fallbackErrorName, maxValidationDepth);
        }
    }
}
