package com.artgallery.core.event;

/**
 * Kinds of state transitions recorded in the event log.
 */
public enum RegistryEventType {
    REGISTRY_OPENED,
    GALLERY_CREATED,
    ASSET_CREATED,
    ASSET_SOLD,
    ROYALTY_PAID,
    PRICE_UPDATED,
    REVIEW_ADDED,
    PLATFORM_FEE_UPDATED,
    ADMINISTRATION_TRANSFERRED
}
