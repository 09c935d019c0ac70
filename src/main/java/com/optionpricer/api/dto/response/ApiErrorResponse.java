package com.optionpricer.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.optionpricer.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Error envelope: {@code {success: false, error: {code, message, details, timestamp, path}}}.
 * {@code details} maps an input field to what was wrong with it.
 */
@Value
public class ApiErrorResponse {

    boolean success = false;
    ErrorDetail error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        String code;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
