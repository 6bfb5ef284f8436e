package com.artgallery.core.error;

/**
 * Failure categories surfaced by registry operations.
 * Every kind is terminal for the operation that raised it: nothing is committed.
 */
public enum ErrorKind {
    INVALID_ARGUMENT,
    NOT_FOUND,
    ALREADY_EXISTS,
    UNAUTHORIZED,
    NOT_FOR_SALE,
    INSUFFICIENT_PAYMENT,
    ALREADY_RATED,
    TRANSFER_FAILED,
    REENTRANT_CALL
}
