package com.syntharb.validation;

import java.util.List;
import lombok.Getter;

/**
 * Outcome of validating one value (or one batch). Either valid with data, or invalid
 * with every violation found. Batch results may be invalid and still carry the
 * records that passed.
 */
@Getter
public class ValidationResult<T> {

    private final boolean valid;
    private final T data;
    private final List<ValidationError> errors;

    private ValidationResult(boolean valid, T data, List<ValidationError> errors) {
        this.valid = valid;
        this.data = data;
        this.errors = errors;
    }

    public static <T> ValidationResult<T> valid(T data) {
        return new ValidationResult<>(true, data, List.of());
    }

    public static <T> ValidationResult<T> invalid(List<ValidationError> errors) {
        return new ValidationResult<>(false, null, List.copyOf(errors));
    }

    public static <T> ValidationResult<T> of(T data, List<ValidationError> errors) {
        return new ValidationResult<>(errors.isEmpty(), data, List.copyOf(errors));
    }

    public boolean isInvalid() {
        return !valid;
    }
}
