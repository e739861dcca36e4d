package com.gt.chamlang.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String errMsg)  {
        super(errMsg);
    }

    public StoreUnavailableException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
