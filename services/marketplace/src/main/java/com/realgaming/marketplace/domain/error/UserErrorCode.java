package com.realgaming.marketplace.domain.error;

import com.realgaming.marketplace.common.error.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum UserErrorCode implements ErrorCode {

    USER_ALREADY_EXISTS(HttpStatus.CONFLICT, "U-001", "User with this email already exists."),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "U-002", "User not found."),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "U-003", "Invalid credentials."),
    ACCOUNT_INACTIVE(HttpStatus.FORBIDDEN, "U-004", "User account is inactive.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
}
