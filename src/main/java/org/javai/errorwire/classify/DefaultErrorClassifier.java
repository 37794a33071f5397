package org.javai.errorwire.classify;

import org.javai.errorwire.AppError;
import org.javai.errorwire.ClassifiedError;
import org.javai.errorwire.ErrorWireConfig;
import org.javai.errorwire.HttpStatus;
import org.javai.errorwire.HttpStatusEquivalent;
import org.javai.errorwire.Named;

import java.lang.reflect.Modifier;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies errors by probing the capabilities they expose, falling back to their runtime type.
 *
 * <p>Name resolution, first match wins:
 * <ol>
 *   <li>{@link Named} with a non-empty name: used verbatim.</li>
 *   <li>{@link HttpStatusEquivalent} when snake-case naming is enabled: the status reason
 *       phrase in snake case ({@code 404 -> not_found}).</li>
 *   <li>The class name, unless the class is not publicly visible, in which case the
 *       configured fallback name.</li>
 * </ol>
 *
 * <p>Status resolution: the explicit status of an {@link AppError}, then
 * {@link HttpStatusEquivalent}, then 500.
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    private final ErrorWireConfig config;

    public DefaultErrorClassifier() {
        this(ErrorWireConfig.defaults());
    }

    public DefaultErrorClassifier(ErrorWireConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public ClassifiedError classify(Throwable error) {
        Objects.requireNonNull(error, "error must not be null");

        String name = classifyName(error, config.fallbackErrorName());
        int status = resolveStatus(error);

        if (error instanceof AppError appError) {
            return new ClassifiedError(name, appError.code(), appError.description(), status);
        }
        return new ClassifiedError(name, 0, messageOf(error), status);
    }

    /**
     * Resolves the public name of an error.
     *
     * @param error The error to name
     * @param fallback The name used when the error's type is not publicly visible
     * @return The resolved name, never empty
     */
    public String classifyName(Throwable error, String fallback) {
        if (error instanceof Named named) {
            String name = named.errorName();
            if (name != null && !name.isEmpty()) {
                return name;
            }
        }

        if (config.snakeCaseHttpEquivErrors() && error instanceof HttpStatusEquivalent equivalent) {
            Optional<String> snakeCase = HttpStatus.snakeCaseName(equivalent.httpStatus());
            if (snakeCase.isPresent()) {
                return snakeCase.get();
            }
        }

        Class<?> type = error.getClass();
        if (!isPubliclyNamed(type)) {
            return fallback;
        }
        String canonical = type.getCanonicalName();
        return canonical != null ? canonical : type.getName();
    }

    /**
     * Resolves the HTTP status of an error, 500 when nothing better is known.
     */
    public int resolveStatus(Throwable error) {
        if (error instanceof AppError appError && HttpStatus.isValid(appError.httpStatus())) {
            return appError.httpStatus();
        }

        if (error instanceof HttpStatusEquivalent equivalent && HttpStatus.isValid(equivalent.httpStatus())) {
            return equivalent.httpStatus();
        }

        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static boolean isPubliclyNamed(Class<?> type) {
        if (type.isAnonymousClass() || type.isLocalClass() || type.isSynthetic()) {
            return false;
        }
        for (Class<?> current = type; current != null; current = current.getEnclosingClass()) {
            if (!Modifier.isPublic(current.getModifiers())) {
                return false;
            }
            String simpleName = current.getSimpleName();
            if (simpleName.isEmpty() || Character.isLowerCase(simpleName.charAt(0))) {
                return false;
            }
        }
        return true;
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : "";
    }
}
