package com.artgallery.core.gallery;

import java.time.Instant;
import java.util.List;

/**
 * Read snapshot of a gallery.
 */
public record GalleryView(
        String key,
        String name,
        String description,
        String curator,
        boolean active,
        List<Long> artworkIds,
        Instant createdAt
) {}
