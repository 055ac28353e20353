package io.catena.server.validation;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.ElementType.TYPE_USE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/// Validates that a string is a chain or execution identifier.
///
/// A valid identifier is 1 to 64 characters of letters, digits, hyphens and underscores,
/// the same allow-list the engine applies before deriving checkpoint file names.
///
/// ### Usage
/// ```java
/// @GET
/// @Path("/{executionId}")
/// public Object inspect(@PathParam("executionId") @ValidId String executionId) { ... }
/// ```
///
/// @see ValidIdValidator
@Target({FIELD, PARAMETER, TYPE_USE})
@Retention(RUNTIME)
@Constraint(validatedBy = ValidIdValidator.class)
@Documented
public @interface ValidId {

    String message() default
            "must be a valid identifier (letters, digits, hyphens, underscores; 1-64 chars)";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
