package com.syntharb.api.dto.response;

import lombok.Getter;

/**
 * Success envelope applied to every REST body by ApiResponseAdvice.
 * Timestamps are epoch milliseconds, matching the broadcast envelope.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final long timestamp;

    private ApiResponse(T data) {
        this.success = true;
        this.data = data;
        this.timestamp = System.currentTimeMillis();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data);
    }
}
