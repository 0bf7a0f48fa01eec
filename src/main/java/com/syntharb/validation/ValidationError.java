package com.syntharb.validation;

import lombok.Builder;
import lombok.Value;

/**
 * One violated field. Validation always reports a list of these, never a single error,
 * because several fields can be wrong at once.
 */
@Value
@Builder(toBuilder = true)
public class ValidationError {

    /** Dotted path of the offending field, e.g. {@code price} or {@code bids[1].price}. */
    String field;

    /** Machine-readable code, e.g. {@code required}, {@code not_positive}, {@code invalid_spread}. */
    String code;

    String message;
    Object rejectedValue;

    /** Position in the batch for batch validation, null otherwise. */
    Integer index;

    public static ValidationError of(String field, String code, String message, Object rejectedValue) {
        return ValidationError.builder()
                .field(field)
                .code(code)
                .message(message)
                .rejectedValue(rejectedValue)
                .build();
    }

    public ValidationError atIndex(int batchIndex) {
        return toBuilder().index(batchIndex).build();
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
