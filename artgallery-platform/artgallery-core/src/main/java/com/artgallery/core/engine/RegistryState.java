package com.artgallery.core.engine;

import com.artgallery.core.asset.AssetRegistry;
import com.artgallery.core.asset.AssetSequence;
import com.artgallery.core.gallery.GalleryDirectory;
import com.artgallery.core.review.ReviewLedger;

/**
 * The three registry stores plus the registry-wide settings.
 */
public class RegistryState {

    private final GalleryDirectory galleries = new GalleryDirectory();
    private final AssetRegistry assets = new AssetRegistry(new AssetSequence());
    private final ReviewLedger reviews = new ReviewLedger();
    private String administrator;
    private int platformFeeRate;

    RegistryState(String administrator, int platformFeeRate) {
        this.administrator = administrator;
        this.platformFeeRate = platformFeeRate;
    }

    public GalleryDirectory galleries() { return galleries; }
    public AssetRegistry assets() { return assets; }
    public ReviewLedger reviews() { return reviews; }
    public String administrator() { return administrator; }
    public int platformFeeRate() { return platformFeeRate; }

    void setAdministrator(String administrator) {
        this.administrator = administrator;
    }

    void setPlatformFeeRate(int platformFeeRate) {
        this.platformFeeRate = platformFeeRate;
    }
}
