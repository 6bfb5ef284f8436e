package com.artgallery.api.admin;

import com.artgallery.core.engine.TransactionEngine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import static com.artgallery.api.CallerHeaders.CALLER_ID;

/**
 * Fee administration REST API.
 *
 * Rates are in tenths of a percent: 25 is 2.5%, the ceiling 100 is 10%.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final TransactionEngine engine;

    public AdminController(TransactionEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/fee")
    public ResponseEntity<FeeResponse> getPlatformFee() {
        return ResponseEntity.ok(new FeeResponse(engine.getPlatformFee(), engine.getAdministrator()));
    }

    @PutMapping("/fee")
    public ResponseEntity<FeeResponse> updateFee(
            @RequestHeader(CALLER_ID) String caller,
            @Valid @RequestBody UpdateFeeRequest request) {
        int rate = engine.updateFee(request.rate(), caller);
        return ResponseEntity.ok(new FeeResponse(rate, engine.getAdministrator()));
    }

    @PutMapping("/administrator")
    public ResponseEntity<FeeResponse> transferAdministration(
            @RequestHeader(CALLER_ID) String caller,
            @Valid @RequestBody TransferAdministrationRequest request) {
        String administrator = engine.transferAdministration(request.administrator(), caller);
        return ResponseEntity.ok(new FeeResponse(engine.getPlatformFee(), administrator));
    }

    public record UpdateFeeRequest(@NotNull Integer rate) {}
    public record TransferAdministrationRequest(@NotBlank String administrator) {}
    public record FeeResponse(int rate, String administrator) {}
}
