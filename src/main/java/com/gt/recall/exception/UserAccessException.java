package com.gt.recall.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a request is made for a review item owned by another user
@ResponseStatus(value = HttpStatus.FORBIDDEN)
public class UserAccessException extends RuntimeException {

    public UserAccessException(String msg) {
        super(msg);
    }

    public UserAccessException(String msg, Exception ex) {
        super(msg, ex);
    }
}
