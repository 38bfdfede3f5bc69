package com.gt.recall.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class ReviewItemNotFoundException extends RuntimeException {

    public ReviewItemNotFoundException(String itemId) {
        super("Review item " + itemId + " does not exist");
    }
}
