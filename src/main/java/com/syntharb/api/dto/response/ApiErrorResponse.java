package com.syntharb.api.dto.response;

import com.syntharb.exception.ErrorCode;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorBody error;

    private ApiErrorResponse(ErrorBody error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorBody.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details != null ? details : Map.of())
                .timestamp(System.currentTimeMillis())
                .path(path)
                .build());
    }

    @Getter
    @Builder
    public static class ErrorBody {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final long timestamp;
        private final String path;
    }
}
