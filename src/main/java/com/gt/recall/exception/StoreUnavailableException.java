package com.gt.recall.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when the review item store cannot complete a read or write. Never retried internally.
@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, String errMsg) {
        super(errMsg);
        this.operation = operation;
    }

    public StoreUnavailableException(String operation, String errMsg, Exception ex) {
        super(errMsg, ex);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
