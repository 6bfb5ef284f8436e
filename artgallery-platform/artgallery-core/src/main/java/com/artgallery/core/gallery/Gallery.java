package com.artgallery.core.gallery;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Curator-owned collection of assets. Member ids are append-only.
 * Instances are confined to the {@link GalleryDirectory}; callers receive {@link GalleryView} copies.
 */
public class Gallery {

    private final String key;
    private final String name;
    private final String description;
    private final String curator;
    private final boolean active;
    private final Instant createdAt;
    private final List<Long> artworkIds = new ArrayList<>();

    Gallery(String key, String name, String description, String curator, Instant createdAt) {
        this.key = key;
        this.name = name;
        this.description = description;
        this.curator = curator;
        this.active = true;
        this.createdAt = createdAt;
    }

    public String getKey() { return key; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getCurator() { return curator; }
    public boolean isActive() { return active; }
    public Instant getCreatedAt() { return createdAt; }

    List<Long> artworkIds() {
        return artworkIds;
    }

    public GalleryView toView() {
        return new GalleryView(key, name, description, curator, active, List.copyOf(artworkIds), createdAt);
    }
}
