package com.nevis.curation.exception;

import lombok.Getter;

@Getter
public class MalformedItemException extends RuntimeException {
    private final String itemId;

    public MalformedItemException(String itemId, String reason) {
        super("Malformed item " + itemId + ": " + reason);
        this.itemId = itemId;
    }
}
