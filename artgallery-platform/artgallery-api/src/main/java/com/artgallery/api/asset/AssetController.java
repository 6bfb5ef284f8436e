package com.artgallery.api.asset;

import com.artgallery.core.asset.AssetView;
import com.artgallery.core.engine.PurchaseReceipt;
import com.artgallery.core.engine.TransactionEngine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

import static com.artgallery.api.CallerHeaders.CALLER_ID;

/**
 * Asset listing and purchase REST API.
 *
 * Amounts are integers in the smallest currency unit.
 */
@RestController
@RequestMapping("/api/v1")
public class AssetController {

    private final TransactionEngine engine;

    public AssetController(TransactionEngine engine) {
        this.engine = engine;
    }

    /**
     * List a new artwork owned by the caller.
     * POST /api/v1/assets
     */
    @PostMapping("/assets")
    public ResponseEntity<AssetView> createAsset(
            @RequestHeader(CALLER_ID) String caller,
            @Valid @RequestBody CreateAssetRequest request) {
        long id = engine.createAsset(request.title(), request.contentRef(), request.price(),
                request.galleryKey(), request.royaltyPercent(), caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(engine.getAsset(id));
    }

    @GetMapping("/assets")
    public ResponseEntity<List<AssetView>> listAssets() {
        return ResponseEntity.ok(engine.listAssets());
    }

    @GetMapping("/assets/{id}")
    public ResponseEntity<AssetView> getAsset(@PathVariable long id) {
        return ResponseEntity.ok(engine.getAsset(id));
    }

    /**
     * Reprice and relist. Owner only.
     * PUT /api/v1/assets/{id}/price
     */
    @PutMapping("/assets/{id}/price")
    public ResponseEntity<AssetView> updatePrice(
            @RequestHeader(CALLER_ID) String caller,
            @PathVariable long id,
            @Valid @RequestBody UpdatePriceRequest request) {
        return ResponseEntity.ok(engine.updatePrice(id, request.price(), caller));
    }

    /**
     * Buy a listed artwork. The payment must cover the price; royalty and platform
     * fee are taken from the full payment.
     * POST /api/v1/assets/{id}/purchase
     */
    @PostMapping("/assets/{id}/purchase")
    public ResponseEntity<PurchaseReceipt> purchase(
            @RequestHeader(CALLER_ID) String caller,
            @PathVariable long id,
            @Valid @RequestBody PurchaseRequest request) {
        return ResponseEntity.ok(engine.purchase(id, request.payment(), caller));
    }

    /**
     * Every asset the identity has ever owned, in acquisition order.
     * GET /api/v1/owners/{identity}/assets
     */
    @GetMapping("/owners/{identity}/assets")
    public ResponseEntity<List<Long>> getByOwner(@PathVariable String identity) {
        return ResponseEntity.ok(engine.getByOwner(identity));
    }

    public record CreateAssetRequest(
            String title,
            String contentRef,
            @NotNull BigInteger price,
            String galleryKey,
            @NotNull Integer royaltyPercent
    ) {}

    public record UpdatePriceRequest(@NotNull BigInteger price) {}

    public record PurchaseRequest(@NotNull BigInteger payment) {}
}
