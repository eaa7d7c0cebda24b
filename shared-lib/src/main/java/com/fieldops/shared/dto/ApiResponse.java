package com.fieldops.shared.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Uniform response envelope returned by every REST endpoint.
 *
 *   success : true when {@code data} holds the result
 *   data    : payload (validation details on a 400)
 *   error   : machine-readable code, e.g. INVALID_CAPACITY
 *   message : human-readable explanation of the error
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;
    private T data;
    private String error;
    private String message;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant timestamp;

    public static <T> ApiResponse<T> ok(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .timestamp(Instant.now())
                .build();
    }

    public static <T> ApiResponse<T> error(String code, String message) {
        return error(code, message, null);
    }

    public static <T> ApiResponse<T> error(String code, String message, T details) {
        return ApiResponse.<T>builder()
                .success(false)
                .error(code)
                .message(message)
                .data(details)
                .timestamp(Instant.now())
                .build();
    }
}
