package com.artgallery.api.gallery;

import com.artgallery.core.asset.AssetView;
import com.artgallery.core.engine.TransactionEngine;
import com.artgallery.core.gallery.GalleryView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.artgallery.api.CallerHeaders.CALLER_ID;

/**
 * Gallery directory REST API.
 */
@RestController
@RequestMapping("/api/v1")
public class GalleryController {

    private final TransactionEngine engine;

    public GalleryController(TransactionEngine engine) {
        this.engine = engine;
    }

    /**
     * Create a gallery curated by the caller.
     * POST /api/v1/galleries
     */
    @PostMapping("/galleries")
    public ResponseEntity<GalleryView> createGallery(
            @RequestHeader(CALLER_ID) String caller,
            @Valid @RequestBody CreateGalleryRequest request) {
        GalleryView gallery = engine.createGallery(request.key(), request.name(), request.description(), caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(gallery);
    }

    @GetMapping("/galleries")
    public ResponseEntity<List<GalleryView>> listGalleries() {
        return ResponseEntity.ok(engine.listGalleries());
    }

    @GetMapping("/galleries/{key}")
    public ResponseEntity<GalleryView> getGallery(@PathVariable String key) {
        return ResponseEntity.ok(engine.getGallery(key));
    }

    /**
     * Ids of the artworks listed in a gallery, in listing order.
     * GET /api/v1/galleries/{key}/artworks
     */
    @GetMapping("/galleries/{key}/artworks")
    public ResponseEntity<List<Long>> getArtworks(@PathVariable String key) {
        return ResponseEntity.ok(engine.getArtworks(key));
    }

    /**
     * Full asset records of a gallery.
     * GET /api/v1/galleries/{key}/assets
     */
    @GetMapping("/galleries/{key}/assets")
    public ResponseEntity<List<AssetView>> getGalleryAssets(@PathVariable String key) {
        engine.getGallery(key);
        return ResponseEntity.ok(engine.getByGallery(key).stream().map(engine::getAsset).toList());
    }

    @GetMapping("/curators/{identity}/galleries")
    public ResponseEntity<List<String>> getGalleriesOf(@PathVariable String identity) {
        return ResponseEntity.ok(engine.getGalleriesOf(identity));
    }

    public record CreateGalleryRequest(@NotBlank String key, @NotBlank String name, String description) {}
}
