package com.realgaming.marketplace.domain.exception;

import com.realgaming.marketplace.common.exception.BusinessException;
import com.realgaming.marketplace.domain.error.UserErrorCode;

public class EmailAlreadyExistsException extends BusinessException {
    public EmailAlreadyExistsException() {
        super(UserErrorCode.USER_ALREADY_EXISTS);
    }

    public EmailAlreadyExistsException(Throwable cause) {
        super(UserErrorCode.USER_ALREADY_EXISTS, UserErrorCode.USER_ALREADY_EXISTS.getMessage(), cause);
    }
}
