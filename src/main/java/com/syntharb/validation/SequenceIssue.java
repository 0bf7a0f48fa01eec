package com.syntharb.validation;

import lombok.Builder;
import lombok.Value;

/**
 * An ordering problem between a tick and its predecessor in a stream.
 */
@Value
@Builder
public class SequenceIssue {

    public enum Type {
        TIMESTAMP_OUT_OF_ORDER("timestamp_out_of_order"),
        SEQUENCE_OUT_OF_ORDER("sequence_out_of_order"),
        DUPLICATE_TIMESTAMP("duplicate_timestamp");

        private final String code;

        Type(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    Type type;

    /** Index of the later tick of the offending pair. */
    int index;

    long current;
    long expected;
    String message;
}
