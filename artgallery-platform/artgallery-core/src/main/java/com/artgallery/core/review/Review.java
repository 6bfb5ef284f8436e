package com.artgallery.core.review;

import java.time.Instant;

/**
 * A single peer review. Immutable once appended.
 */
public record Review(
        long assetId,
        String reviewer,
        String comment,
        int rating,
        Instant timestamp
) {}
