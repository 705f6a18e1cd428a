package com.realgaming.marketplace.domain.exception;

import com.realgaming.marketplace.common.exception.BusinessException;
import com.realgaming.marketplace.domain.error.UserErrorCode;

/**
 * 이메일이 없을 때와 비밀번호가 틀렸을 때 같은 예외를 쓴다.
 */
public class LoginFailedException extends BusinessException {
    public LoginFailedException() {
        super(UserErrorCode.INVALID_CREDENTIALS);
    }
}
