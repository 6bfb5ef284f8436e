package com.artgallery.core.gallery;

import com.artgallery.core.error.ErrorKind;
import com.artgallery.core.error.RegistryException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns gallery records and the per-curator gallery index.
 * Not thread-safe: the transaction engine serializes access.
 */
public class GalleryDirectory {

    private final Map<String, Gallery> galleries = new LinkedHashMap<>();
    private final Map<String, List<String>> galleriesByCurator = new HashMap<>();

    /**
     * Checks the preconditions of {@link #create} without touching state.
     */
    public void validateNew(String key, String name) {
        RegistryException.requireText(key, "Gallery key must not be empty");
        RegistryException.requireText(name, "Gallery name must not be empty");
        if (galleries.containsKey(key)) {
            throw new RegistryException(ErrorKind.ALREADY_EXISTS, "Gallery ID already exists: " + key);
        }
    }

    public Gallery create(String key, String name, String description, String curator, Instant createdAt) {
        validateNew(key, name);
        Gallery gallery = new Gallery(key, name, description == null ? "" : description, curator, createdAt);
        galleries.put(key, gallery);
        galleriesByCurator.computeIfAbsent(curator, c -> new ArrayList<>()).add(key);
        return gallery;
    }

    /**
     * Reverts a {@link #create} that was the latest change to the directory.
     */
    public void remove(Gallery gallery) {
        galleries.remove(gallery.getKey());
        List<String> curated = galleriesByCurator.get(gallery.getCurator());
        if (curated != null) {
            curated.remove(gallery.getKey());
            if (curated.isEmpty()) {
                galleriesByCurator.remove(gallery.getCurator());
            }
        }
    }

    public Optional<Gallery> find(String key) {
        return Optional.ofNullable(key).map(galleries::get).filter(Gallery::isActive);
    }

    public Gallery require(String key) {
        return find(key).orElseThrow(() -> RegistryException.notFound("Gallery not found: " + key));
    }

    public void addArtwork(Gallery gallery, long assetId) {
        gallery.artworkIds().add(assetId);
    }

    public void removeLastArtwork(Gallery gallery, long assetId) {
        List<Long> ids = gallery.artworkIds();
        if (!ids.isEmpty() && ids.get(ids.size() - 1) == assetId) {
            ids.remove(ids.size() - 1);
        }
    }

    public List<Long> artworksOf(String key) {
        return List.copyOf(require(key).artworkIds());
    }

    public List<String> galleriesOf(String curator) {
        return List.copyOf(galleriesByCurator.getOrDefault(curator, List.of()));
    }

    public List<GalleryView> all() {
        return galleries.values().stream().map(Gallery::toView).toList();
    }

    public int size() {
        return galleries.size();
    }
}
