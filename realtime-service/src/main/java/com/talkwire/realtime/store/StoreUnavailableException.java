package com.talkwire.realtime.store;

import com.talkwire.common.exception.BusinessException;
import com.talkwire.common.response.ErrorCode;

public class StoreUnavailableException extends BusinessException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
