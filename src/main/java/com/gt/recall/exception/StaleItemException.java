package com.gt.recall.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a grade targets an item other than the head of the session queue
@ResponseStatus(value = HttpStatus.CONFLICT)
public class StaleItemException extends RuntimeException {

    private final String itemId;
    private final String currentItemId;
    private final int quality;

    public StaleItemException(String itemId, String currentItemId, int quality) {
        super("Grade " + quality + " submitted for item " + itemId + " but the current item is " + currentItemId);
        this.itemId = itemId;
        this.currentItemId = currentItemId;
        this.quality = quality;
    }

    public String getItemId() {
        return itemId;
    }

    public String getCurrentItemId() {
        return currentItemId;
    }

    public int getQuality() {
        return quality;
    }
}
