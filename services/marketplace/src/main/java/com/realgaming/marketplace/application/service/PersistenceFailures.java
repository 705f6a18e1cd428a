package com.realgaming.marketplace.application.service;

import com.realgaming.marketplace.common.error.GlobalErrorCode;
import com.realgaming.marketplace.common.exception.BusinessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionTimedOutException;

final class PersistenceFailures {

    private PersistenceFailures() {
    }

    static BusinessException wrap(String action, RuntimeException e) {
        if (e instanceof QueryTimeoutException || e instanceof TransactionTimedOutException) {
            return new BusinessException(GlobalErrorCode.REQUEST_TIMEOUT, "Timed out while " + action, e);
        }
        return new BusinessException(GlobalErrorCode.INTERNAL_SERVER_ERROR, "Error while " + action, e);
    }
}
