package com.artgallery.api.account;

import com.artgallery.core.payment.LedgerPaymentGateway;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

@RestController
@RequestMapping("/api/v1/accounts")
public class AccountController {

    private final LedgerPaymentGateway paymentGateway;

    public AccountController(LedgerPaymentGateway paymentGateway) {
        this.paymentGateway = paymentGateway;
    }

    /**
     * Payouts received by an identity, net of reversals.
     * GET /api/v1/accounts/{identity}/balance
     */
    @GetMapping("/{identity}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable String identity) {
        return ResponseEntity.ok(new BalanceResponse(identity, paymentGateway.balanceOf(identity)));
    }

    public record BalanceResponse(String identity, BigInteger balance) {}
}
