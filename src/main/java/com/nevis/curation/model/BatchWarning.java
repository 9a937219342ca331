package com.nevis.curation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BatchWarning(
    @JsonProperty("item_id") String itemId,
    WarningType type,
    String message
) {}
