package com.artgallery.core.asset;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Canonical asset record. Mutable only through {@link AssetRegistry}.
 */
public class Asset {

    private final long id;
    private final String title;
    private final String creator;
    private final String contentRef;
    private final String galleryKey;
    private final int royaltyPercent;
    private final Instant createdAt;

    private String owner;
    private BigInteger price;
    private boolean forSale;
    private long ratingCount;
    private long ratingSum;

    Asset(long id, String title, String creator, String contentRef, BigInteger price,
          String galleryKey, int royaltyPercent, Instant createdAt) {
        this.id = id;
        this.title = title;
        this.creator = creator;
        this.owner = creator;
        this.contentRef = contentRef;
        this.price = price;
        this.forSale = true;
        this.galleryKey = galleryKey;
        this.royaltyPercent = royaltyPercent;
        this.createdAt = createdAt;
    }

    public long getId() { return id; }
    public String getTitle() { return title; }
    public String getCreator() { return creator; }
    public String getOwner() { return owner; }
    public BigInteger getPrice() { return price; }
    public boolean isForSale() { return forSale; }
    public String getContentRef() { return contentRef; }
    public String getGalleryKey() { return galleryKey; }
    public int getRoyaltyPercent() { return royaltyPercent; }
    public Instant getCreatedAt() { return createdAt; }
    public long getRatingCount() { return ratingCount; }
    public long getRatingSum() { return ratingSum; }

    /**
     * Integer average, truncated toward zero; 0 when unrated.
     */
    public long averageRating() {
        return ratingCount == 0 ? 0 : ratingSum / ratingCount;
    }

    public boolean isPrimarySale() {
        return owner.equals(creator);
    }

    void setOwner(String owner) { this.owner = owner; }
    void setPrice(BigInteger price) { this.price = price; }
    void setForSale(boolean forSale) { this.forSale = forSale; }

    void addRating(int rating) {
        ratingCount++;
        ratingSum += rating;
    }

    void removeRating(int rating) {
        ratingCount--;
        ratingSum -= rating;
    }

    public AssetView toView() {
        return new AssetView(id, title, creator, owner, price, forSale, contentRef, galleryKey,
                royaltyPercent, createdAt, ratingCount, ratingSum, averageRating());
    }
}
