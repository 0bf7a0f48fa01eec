package com.syntharb.validation;

import lombok.Getter;

/**
 * Tagged result of parsing one raw record: data on success, a {@link ParseError} otherwise.
 * Parsing never throws to the caller.
 */
@Getter
public class ParseResult<T> {

    private final T data;
    private final ParseError error;

    private ParseResult(T data, ParseError error) {
        this.data = data;
        this.error = error;
    }

    public static <T> ParseResult<T> success(T data) {
        return new ParseResult<>(data, null);
    }

    public static <T> ParseResult<T> failure(ParseError error) {
        return new ParseResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
