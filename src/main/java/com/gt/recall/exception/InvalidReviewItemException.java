package com.gt.recall.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidReviewItemException extends RuntimeException {

    public InvalidReviewItemException(String msg) {
        super(msg);
    }
}
