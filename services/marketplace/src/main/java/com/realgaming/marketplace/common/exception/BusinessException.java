package com.realgaming.marketplace.common.exception;

import com.realgaming.marketplace.common.error.ErrorCode;
import lombok.Getter;

/**
 * 응답 코드가 정해진 예외. 메시지는 로그용이고 클라이언트에는 {@link ErrorCode#getMessage()}만 나간다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
