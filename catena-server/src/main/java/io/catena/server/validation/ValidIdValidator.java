package io.catena.server.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import java.util.regex.Pattern;

/// Checks strings against the identifier allow-list of {@link ValidId}.
///
/// @see ValidId
public class ValidIdValidator implements ConstraintValidator<ValidId, String> {

    static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    /// @param value the string to validate, may be null
    /// @param context validator context, not null
    /// @return `true` if the value is a non-null allow-listed identifier
    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && ID_PATTERN.matcher(value).matches();
    }
}
