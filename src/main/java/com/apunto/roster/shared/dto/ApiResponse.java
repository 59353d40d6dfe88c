package com.apunto.roster.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private String status;

    private int statusCode;

    private String message;

    private T data;

    private Instant timestamp;
    private String path;
    private String traceId;

    public static <T> ApiResponse<T> ok(String message, T data, String path, String traceId) {
        return ApiResponse.<T>builder()
                .status("OK")
                .statusCode(200)
                .message(message)
                .data(data)
                .timestamp(Instant.now())
                .path(path)
                .traceId(traceId)
                .build();
    }
}
