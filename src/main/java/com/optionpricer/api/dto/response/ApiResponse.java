package com.optionpricer.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collection;
import lombok.Value;

/**
 * Success envelope for pricing endpoints. {@code count} is present only for list payloads,
 * such as batch implied volatility results.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    boolean success = true;
    T data;
    Integer count;
    Instant timestamp;

    public static <T> ApiResponse<T> of(T data) {
        Integer count = data instanceof Collection<?> items ? items.size() : null;
        return new ApiResponse<>(data, count, Instant.now());
    }
}
