package com.artgallery.core.asset;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Read snapshot of an asset, including the truncated average rating.
 */
public record AssetView(
        long id,
        String title,
        String creator,
        String owner,
        BigInteger price,
        boolean forSale,
        String contentRef,
        String galleryKey,
        int royaltyPercent,
        Instant createdAt,
        long ratingCount,
        long ratingSum,
        long averageRating
) {}
