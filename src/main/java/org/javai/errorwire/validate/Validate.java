package org.javai.errorwire.validate;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the validators that run against a field, comma separated and in order.
 *
 * <pre>{@code
 * public record SignUp(
 *         @Validate("required,email") String email,
 *         @Validate("struct") Address address,
 *         @Validate("required,struct") @JsonProperty("billing_address") Address billing
 * ) {}
 * }</pre>
 *
 * <p>The reserved name {@value ValidationEngine#STRUCT} validates the field's own fields with
 * the same {@link ValidatorTable}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
public @interface Validate {

    /**
     * Comma-separated validator names.
     */
    String value();
}
