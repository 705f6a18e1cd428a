package com.realgaming.marketplace.domain.exception;

import com.realgaming.marketplace.common.exception.BusinessException;
import com.realgaming.marketplace.domain.error.UserErrorCode;

public class UserNotFoundException extends BusinessException {
    public UserNotFoundException() {
        super(UserErrorCode.USER_NOT_FOUND);
    }
}
