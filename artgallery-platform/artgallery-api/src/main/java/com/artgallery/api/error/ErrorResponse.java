package com.artgallery.api.error;

/**
 * Body of every failed request: the error kind and a human-readable reason.
 */
public record ErrorResponse(String code, String message) {}
