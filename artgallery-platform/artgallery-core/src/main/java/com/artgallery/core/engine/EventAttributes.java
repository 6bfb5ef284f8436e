package com.artgallery.core.engine;

/**
 * Attribute names used in registry events.
 */
final class EventAttributes {

    static final String REGISTRY = "registry";

    static final String ADMINISTRATOR = "administrator";
    static final String PREVIOUS_ADMINISTRATOR = "previousAdministrator";
    static final String PLATFORM_FEE_RATE = "platformFeeRate";
    static final String PREVIOUS_PLATFORM_FEE_RATE = "previousPlatformFeeRate";

    static final String NAME = "name";
    static final String DESCRIPTION = "description";
    static final String CURATOR = "curator";

    static final String TITLE = "title";
    static final String CREATOR = "creator";
    static final String CONTENT_REF = "contentRef";
    static final String PRICE = "price";
    static final String GALLERY = "gallery";
    static final String ROYALTY_PERCENT = "royaltyPercent";
    static final String OWNER = "owner";

    static final String SELLER = "seller";
    static final String BUYER = "buyer";
    static final String PAYMENT = "payment";
    static final String AMOUNT = "amount";

    static final String REVIEWER = "reviewer";
    static final String COMMENT = "comment";
    static final String RATING = "rating";

    private EventAttributes() {
    }
}
