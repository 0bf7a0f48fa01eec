package com.syntharb.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    LEG_INDEX_OUT_OF_RANGE("LEG_INDEX_OUT_OF_RANGE", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INVALID_TRANSITION("INVALID_TRANSITION", 409),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    CONNECTION_ERROR("CONNECTION_ERROR", 502),
    INGESTION_TIMEOUT("INGESTION_TIMEOUT", 504);

    private final String code;
    private final int httpStatus;
}
