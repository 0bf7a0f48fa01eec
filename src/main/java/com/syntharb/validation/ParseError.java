package com.syntharb.validation;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Why a raw record could not be turned into a valid domain value.
 */
@Value
@Builder(toBuilder = true)
public class ParseError {

    public enum Kind {
        /** The bytes could not be decoded in the requested format. */
        MALFORMED,
        /** The requested format is not supported for this record type. */
        UNSUPPORTED_FORMAT,
        /** Decoding succeeded but the record violates the schema or business rules. */
        VALIDATION
    }

    Kind kind;
    String message;

    @Builder.Default
    List<ValidationError> validationErrors = List.of();

    /** Position in the batch, null for single-record parsing. */
    Integer index;

    public static ParseError malformed(String message) {
        return ParseError.builder().kind(Kind.MALFORMED).message(message).build();
    }

    public static ParseError unsupported(String message) {
        return ParseError.builder().kind(Kind.UNSUPPORTED_FORMAT).message(message).build();
    }

    public static ParseError validation(List<ValidationError> errors) {
        StringBuilder message = new StringBuilder("Validation failed: ");
        for (int i = 0; i < errors.size(); i++) {
            if (i > 0) {
                message.append(", ");
            }
            message.append(errors.get(i).getMessage());
        }
        return ParseError.builder()
                .kind(Kind.VALIDATION)
                .message(message.toString())
                .validationErrors(List.copyOf(errors))
                .build();
    }

    public ParseError atIndex(int batchIndex) {
        return toBuilder().index(batchIndex).build();
    }
}
