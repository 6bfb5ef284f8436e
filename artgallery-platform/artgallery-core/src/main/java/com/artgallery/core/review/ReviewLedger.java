package com.artgallery.core.review;

import com.artgallery.core.error.ErrorKind;
import com.artgallery.core.error.RegistryException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Append-only review sequences per asset, with a side index of who already rated what.
 * Not thread-safe: the transaction engine serializes access.
 */
public class ReviewLedger {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    private final Map<Long, List<Review>> reviewsByAsset = new HashMap<>();
    private final Map<Long, Set<String>> ratedBy = new HashMap<>();

    /**
     * Checks rating range and the one-rating-per-reviewer rule without touching state.
     */
    public void validate(long assetId, int rating, String reviewer) {
        if (rating < MIN_RATING || rating > MAX_RATING) {
            throw RegistryException.invalidArgument("Rating must be between 1 and 5");
        }
        if (hasRated(assetId, reviewer)) {
            throw new RegistryException(ErrorKind.ALREADY_RATED,
                    "User has already rated this artwork: " + assetId);
        }
    }

    public Review append(long assetId, String reviewer, String comment, int rating, Instant timestamp) {
        validate(assetId, rating, reviewer);
        Review review = new Review(assetId, reviewer, comment == null ? "" : comment, rating, timestamp);
        reviewsByAsset.computeIfAbsent(assetId, id -> new ArrayList<>()).add(review);
        ratedBy.computeIfAbsent(assetId, id -> new HashSet<>()).add(reviewer);
        return review;
    }

    /**
     * Reverts an {@link #append} that was the latest change for the asset.
     */
    public void removeLast(Review review) {
        List<Review> reviews = reviewsByAsset.get(review.assetId());
        if (reviews != null && !reviews.isEmpty() && reviews.get(reviews.size() - 1).equals(review)) {
            reviews.remove(reviews.size() - 1);
            ratedBy.get(review.assetId()).remove(review.reviewer());
        }
    }

    public boolean hasRated(long assetId, String reviewer) {
        Set<String> reviewers = ratedBy.get(assetId);
        return reviewers != null && reviewers.contains(reviewer);
    }

    public List<Review> reviewsOf(long assetId) {
        return List.copyOf(reviewsByAsset.getOrDefault(assetId, List.of()));
    }
}
