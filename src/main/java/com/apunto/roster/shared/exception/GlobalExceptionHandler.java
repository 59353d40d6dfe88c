package com.apunto.roster.shared.exception;

import com.apunto.roster.shared.dto.ApiResponse;
import com.apunto.roster.shared.util.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;


@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ApiResponse<Object>> handleEngineException(
            EngineException ex,
            HttpServletRequest request
    ) {
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = errorCode.getHttpStatus();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("errorCode", errorCode.name());
        if (ex.getDetails() != null && !ex.getDetails().isEmpty()) {
            data.put("details", ex.getDetails());
        }

        return buildErrorResponse(status, errorCode, ex.getMessage(), data, request, ex);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleMethodArgumentTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request
    ) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("parameter", ex.getName());
        details.put("value", String.valueOf(ex.getValue()));
        details.put("requiredType", ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : null);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("errorCode", ErrorCode.VALIDATION_ERROR.name());
        data.put("details", details);

        return buildErrorResponse(
                ErrorCode.VALIDATION_ERROR.getHttpStatus(),
                ErrorCode.VALIDATION_ERROR,
                "Invalid request parameter",
                data,
                request,
                ex
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        Map<String, Object> data = Map.of(
                "errorCode", ErrorCode.INTERNAL_ERROR.name()
        );

        return buildErrorResponse(
                ErrorCode.INTERNAL_ERROR.getHttpStatus(),
                ErrorCode.INTERNAL_ERROR,
                "Failed to sync profile data.",
                data,
                request,
                ex
        );
    }

    private ResponseEntity<ApiResponse<Object>> buildErrorResponse(
            HttpStatus status,
            ErrorCode errorCode,
            @Nullable String message,
            @Nullable Map<String, Object> data,
            HttpServletRequest request,
            Throwable ex
    ) {
        String traceId = TraceIds.current();
        String path = request.getRequestURI();

        if (status.is5xxServerError()) {
            log.error("event=http.error traceId={} code={} path={} message={}",
                    traceId, errorCode.name(), path, ex.getMessage(), ex);
        } else {
            log.warn("event=http.rejected traceId={} code={} path={} message={}",
                    traceId, errorCode.name(), path, ex.getMessage());
        }

        ApiResponse<Object> body = ApiResponse.<Object>builder()
                .status("ERROR")
                .statusCode(status.value())
                .message(message != null ? message : errorCode.getDefaultMessage())
                .data(data == null || data.isEmpty() ? null : data)
                .timestamp(Instant.now())
                .path(path)
                .traceId(traceId)
                .build();

        return ResponseEntity.status(status).body(body);
    }
}
