package com.artgallery.core.asset;

import com.artgallery.core.error.RegistryException;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns asset records and the "assets by owner" / "assets by gallery" indexes.
 *
 * The owner index is a provenance history: an id is appended whenever an identity
 * acquires the asset and is never removed when the asset is sold on.
 * Not thread-safe: the transaction engine serializes access.
 */
public class AssetRegistry {

    public static final int MAX_ROYALTY_PERCENT = 100;

    private final AssetSequence sequence;
    private final Map<Long, Asset> assets = new LinkedHashMap<>();
    private final Map<String, List<Long>> assetsByOwner = new HashMap<>();
    private final Map<String, List<Long>> assetsByGallery = new HashMap<>();

    public AssetRegistry(AssetSequence sequence) {
        this.sequence = sequence;
    }

    public static void requireRoyaltyPercent(int royaltyPercent) {
        if (royaltyPercent < 0 || royaltyPercent > MAX_ROYALTY_PERCENT) {
            throw RegistryException.invalidArgument("Royalty percentage must be between 0 and 100");
        }
    }

    public static void requirePositivePrice(BigInteger price) {
        if (price == null || price.signum() <= 0) {
            throw RegistryException.invalidArgument("Price must be greater than 0");
        }
    }

    public Asset register(String title, String creator, String contentRef, BigInteger price,
                          String galleryKey, int royaltyPercent, Instant createdAt) {
        return insert(sequence.next(), title, creator, contentRef, price, galleryKey, royaltyPercent, createdAt);
    }

    /**
     * Re-inserts an asset under an id issued earlier (replay).
     */
    public Asset restore(long id, String title, String creator, String contentRef, BigInteger price,
                         String galleryKey, int royaltyPercent, Instant createdAt) {
        sequence.observe(id);
        return insert(id, title, creator, contentRef, price, galleryKey, royaltyPercent, createdAt);
    }

    private Asset insert(long id, String title, String creator, String contentRef, BigInteger price,
                         String galleryKey, int royaltyPercent, Instant createdAt) {
        Asset asset = new Asset(id, title, creator, contentRef, price, galleryKey, royaltyPercent, createdAt);
        assets.put(id, asset);
        assetsByOwner.computeIfAbsent(creator, o -> new ArrayList<>()).add(id);
        assetsByGallery.computeIfAbsent(galleryKey, g -> new ArrayList<>()).add(id);
        return asset;
    }

    /**
     * Reverts a {@link #register} that was the latest change to the registry.
     */
    public void unregister(Asset asset) {
        assets.remove(asset.getId());
        removeLast(assetsByOwner, asset.getCreator(), asset.getId());
        removeLast(assetsByGallery, asset.getGalleryKey(), asset.getId());
        sequence.release(asset.getId());
    }

    public Optional<Asset> find(long id) {
        return Optional.ofNullable(assets.get(id));
    }

    public Asset require(long id) {
        return find(id).orElseThrow(() -> RegistryException.notFound("Artwork does not exist: " + id));
    }

    public void reprice(Asset asset, BigInteger newPrice) {
        requirePositivePrice(newPrice);
        asset.setPrice(newPrice);
        asset.setForSale(true);
    }

    /**
     * Hands the asset to the buyer and takes it off the market.
     */
    public void transfer(Asset asset, String buyer) {
        asset.setOwner(buyer);
        asset.setForSale(false);
        assetsByOwner.computeIfAbsent(buyer, o -> new ArrayList<>()).add(asset.getId());
    }

    /**
     * Reverts a {@link #transfer} that was the latest change to the buyer's index.
     */
    public void revertTransfer(Asset asset, String seller, boolean wasForSale) {
        removeLast(assetsByOwner, asset.getOwner(), asset.getId());
        asset.setOwner(seller);
        asset.setForSale(wasForSale);
    }

    public void restorePrice(Asset asset, BigInteger price, boolean forSale) {
        asset.setPrice(price);
        asset.setForSale(forSale);
    }

    public void recordRating(Asset asset, int rating) {
        asset.addRating(rating);
    }

    public void revertRating(Asset asset, int rating) {
        asset.removeRating(rating);
    }

    private static void removeLast(Map<String, List<Long>> index, String key, long id) {
        List<Long> ids = index.get(key);
        if (ids != null && !ids.isEmpty() && ids.get(ids.size() - 1) == id) {
            ids.remove(ids.size() - 1);
            if (ids.isEmpty()) {
                index.remove(key);
            }
        }
    }

    public List<Long> byOwner(String identity) {
        return List.copyOf(assetsByOwner.getOrDefault(identity, List.of()));
    }

    public List<Long> byGallery(String galleryKey) {
        return List.copyOf(assetsByGallery.getOrDefault(galleryKey, List.of()));
    }

    public List<AssetView> all() {
        return assets.values().stream().map(Asset::toView).toList();
    }

    public int size() {
        return assets.size();
    }
}
