package com.gt.recall.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidGradeException extends RuntimeException {

    private final int quality;

    public InvalidGradeException(int quality) {
        super("Quality " + quality + " is outside the allowed range [0, 5]");
        this.quality = quality;
    }

    public int getQuality() {
        return quality;
    }
}
