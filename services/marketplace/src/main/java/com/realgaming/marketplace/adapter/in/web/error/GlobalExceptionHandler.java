package com.realgaming.marketplace.adapter.in.web.error;

import com.realgaming.marketplace.common.error.ErrorCode;
import com.realgaming.marketplace.common.error.GlobalErrorCode;
import com.realgaming.marketplace.common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getHttpStatus().is5xxServerError()) {
            log.error("Business Exception: [Code: {}] {}", errorCode.getCode(), e.getMessage(), e);
        } else {
            log.warn("Business Exception: [Code: {}] {}", errorCode.getCode(), e.getMessage());
        }

        return ErrorResponse.toResponseEntity(errorCode);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex,
            HttpHeaders headers,
            HttpStatusCode status,
            WebRequest request
    ) {
        Map<String, String> validation = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            validation.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        log.warn("Validation failed: {}", validation);

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(GlobalErrorCode.INVALID_INPUT_VALUE, validation));
    }

    // 프레임워크 예외(JSON 파싱, 타입 변환, 405 등)도 같은 형태로 응답
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            Exception ex,
            @Nullable Object body,
            HttpHeaders headers,
            HttpStatusCode statusCode,
            WebRequest request
    ) {
        log.warn("Request rejected: [{}] {}", statusCode.value(), ex.getMessage());

        ErrorCode errorCode = toErrorCode(statusCode);
        ErrorResponse response = ErrorResponse.builder()
                .success(false)
                .status(statusCode.value())
                .code(errorCode.getCode())
                .message(errorCode.getMessage())
                .build();
        return ResponseEntity.status(statusCode).headers(headers).body(response);
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unhandled Exception: ", e);
        return ErrorResponse.toResponseEntity(GlobalErrorCode.INTERNAL_SERVER_ERROR);
    }

    private ErrorCode toErrorCode(HttpStatusCode statusCode) {
        return switch (statusCode.value()) {
            case 404 -> GlobalErrorCode.RESOURCE_NOT_FOUND;
            case 405 -> GlobalErrorCode.METHOD_NOT_ALLOWED;
            case 503 -> GlobalErrorCode.REQUEST_TIMEOUT;
            default -> statusCode.is4xxClientError()
                    ? GlobalErrorCode.INVALID_INPUT_VALUE
                    : GlobalErrorCode.INTERNAL_SERVER_ERROR;
        };
    }
}
