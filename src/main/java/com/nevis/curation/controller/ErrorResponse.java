package com.nevis.curation.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
