package com.realgaming.marketplace.domain.exception;

import com.realgaming.marketplace.common.exception.BusinessException;
import com.realgaming.marketplace.domain.error.UserErrorCode;
import com.realgaming.marketplace.domain.model.Status;
import lombok.Getter;

@Getter
public class AccountInactiveException extends BusinessException {
    private final Status status;

    public AccountInactiveException(Status status) {
        super(UserErrorCode.ACCOUNT_INACTIVE, "Login rejected due to status: " + status);
        this.status = status;
    }
}
