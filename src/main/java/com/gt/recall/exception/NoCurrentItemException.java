package com.gt.recall.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a grade is submitted while the owner has nothing to review. The caller should start a new session.
@ResponseStatus(value = HttpStatus.CONFLICT)
public class NoCurrentItemException extends RuntimeException {

    private final String itemId;
    private final int quality;

    public NoCurrentItemException(String itemId, int quality) {
        super("No review item is currently presented. Grade " + quality + " for item " + itemId + " was not applied.");
        this.itemId = itemId;
        this.quality = quality;
    }

    public String getItemId() {
        return itemId;
    }

    public int getQuality() {
        return quality;
    }
}
