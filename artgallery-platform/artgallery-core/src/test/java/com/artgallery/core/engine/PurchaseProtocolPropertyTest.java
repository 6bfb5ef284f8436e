package com.artgallery.core.engine;

import com.artgallery.core.asset.AssetView;
import com.artgallery.core.error.ErrorKind;
import com.artgallery.core.error.RegistryException;
import com.artgallery.core.event.EventLog;
import com.artgallery.core.payment.LedgerPaymentGateway;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the purchase protocol and the invariants that hold
 * across any sequence of registry operations.
 */
class PurchaseProtocolPropertyTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final String ADMIN = "0xadmin";
    private static final String CREATOR = "0xcreator";
    private static final String GALLERY = "g1";

    private record Registry(TransactionEngine engine, EventLog eventLog, LedgerPaymentGateway ledger) {
    }

    private static Registry newRegistry(int feeRate) {
        EventLog eventLog = new EventLog();
        LedgerPaymentGateway ledger = new LedgerPaymentGateway("REGISTRY_ESCROW", CLOCK);
        TransactionEngine engine = TransactionEngine.open(ADMIN, feeRate, eventLog, ledger, CLOCK);
        engine.createGallery(GALLERY, "Gallery", "", CREATOR);
        return new Registry(engine, eventLog, ledger);
    }

    /**
     * Successful creations receive consecutive ids starting at 1 no matter how many
     * attempts fail in between.
     */
    @Property(tries = 50)
    void assetIds_areConsecutiveDespiteFailures(@ForAll @Size(min = 1, max = 30) List<Boolean> attemptValid) {
        Registry registry = newRegistry(25);
        List<Long> issued = new ArrayList<>();

        for (boolean valid : attemptValid) {
            BigInteger price = valid ? BigInteger.TEN : BigInteger.ZERO;
            try {
                issued.add(registry.engine().createAsset("Art", "ipfs://x", price, GALLERY, 5, CREATOR));
            } catch (RegistryException e) {
                assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
            }
        }

        for (int i = 0; i < issued.size(); i++) {
            assertThat(issued.get(i)).as("Id at position %d", i).isEqualTo(i + 1L);
        }
        assertThat(registry.engine().listAssets()).hasSize(issued.size());
    }

    /**
     * The seller receives the payment minus floored royalty and fee, and the payouts
     * together equal the payment.
     */
    @Property(tries = 100)
    void secondarySale_paysOutExactlyThePayment(
            @ForAll @IntRange(min = 0, max = 100) int feeRate,
            @ForAll @IntRange(min = 0, max = 80) int royaltyPercent,
            @ForAll("prices") BigInteger price,
            @ForAll("overpayments") BigInteger extra) {

        Registry registry = newRegistry(feeRate);
        TransactionEngine engine = registry.engine();
        long id = engine.createAsset("Art", "ipfs://x", price, GALLERY, royaltyPercent, CREATOR);
        engine.purchase(id, price, "0xfirst");
        engine.updatePrice(id, price, "0xfirst");
        BigInteger paidBefore = registry.ledger().totalPaidOut();

        BigInteger payment = price.add(extra);
        PurchaseReceipt receipt = engine.purchase(id, payment, "0xsecond");

        BigInteger expectedFee = payment.multiply(BigInteger.valueOf(feeRate)).divide(BigInteger.valueOf(1000));
        BigInteger expectedRoyalty = payment.multiply(BigInteger.valueOf(royaltyPercent)).divide(BigInteger.valueOf(100));
        assertThat(receipt.platformFee()).isEqualTo(expectedFee);
        assertThat(receipt.royalty()).isEqualTo(expectedRoyalty);
        assertThat(receipt.sellerProceeds()).isEqualTo(payment.subtract(expectedFee).subtract(expectedRoyalty));
        assertThat(registry.ledger().totalPaidOut().subtract(paidBefore))
                .as("Payouts of the sale")
                .isEqualTo(payment);
        assertThat(engine.ownerOf(id)).isEqualTo("0xsecond");
    }

    /**
     * An asset that has been sold and not relisted rejects every purchase,
     * whatever the offered payment.
     */
    @Property(tries = 100)
    void soldAsset_rejectsAnyPayment(@ForAll("overpayments") BigInteger offer) {
        Registry registry = newRegistry(25);
        long id = registry.engine().createAsset("Art", "ipfs://x", BigInteger.TEN, GALLERY, 10, CREATOR);
        registry.engine().purchase(id, BigInteger.TEN, "0xfirst");

        assertThatThrownBy(() -> registry.engine().purchase(id, offer, "0xsecond"))
                .isInstanceOfSatisfying(RegistryException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_FOR_SALE));
    }

    /**
     * When any one payout fails, nothing about the purchase remains visible:
     * owner, listing, indexes, events and balances are exactly as before.
     */
    @Property(tries = 30)
    void failedPayout_leavesNoTrace(@ForAll("payoutRecipients") String frozenRecipient) {
        Registry registry = newRegistry(25);
        TransactionEngine engine = registry.engine();
        long id = engine.createAsset("Art", "ipfs://x", BigInteger.valueOf(1000), GALLERY, 10, CREATOR);
        engine.purchase(id, BigInteger.valueOf(1000), "0xseller");
        engine.updatePrice(id, BigInteger.valueOf(1000), "0xseller");

        AssetView before = engine.getAsset(id);
        int eventsBefore = registry.eventLog().size();
        BigInteger paidBefore = registry.ledger().totalPaidOut();
        registry.ledger().freeze(frozenRecipient);

        assertThatThrownBy(() -> engine.purchase(id, BigInteger.valueOf(1000), "0xbuyer"))
                .isInstanceOfSatisfying(RegistryException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSFER_FAILED));

        assertThat(engine.getAsset(id)).isEqualTo(before);
        assertThat(engine.getByOwner("0xbuyer")).isEmpty();
        assertThat(registry.eventLog().size()).isEqualTo(eventsBefore);
        assertThat(registry.eventLog().verifyChain().isValid()).isTrue();
        assertThat(registry.ledger().totalPaidOut()).isEqualTo(paidBefore);
    }

    /**
     * Rating aggregates always match the recorded reviews.
     */
    @Property(tries = 50)
    void ratingAggregates_matchReviews(@ForAll @Size(min = 1, max = 20) List<@IntRange(min = 1, max = 5) Integer> ratings) {
        Registry registry = newRegistry(25);
        long id = registry.engine().createAsset("Art", "ipfs://x", BigInteger.TEN, GALLERY, 10, CREATOR);

        for (int i = 0; i < ratings.size(); i++) {
            registry.engine().addReview(id, "review " + i, ratings.get(i), "0xreviewer" + i);
        }

        int sum = ratings.stream().mapToInt(Integer::intValue).sum();
        AssetView asset = registry.engine().getAsset(id);
        assertThat(asset.ratingCount()).isEqualTo(ratings.size());
        assertThat(asset.ratingSum()).isEqualTo(sum);
        assertThat(asset.averageRating()).isEqualTo(sum / ratings.size());
        assertThat(registry.engine().getReviews(id)).hasSize(ratings.size());
    }

    @Provide
    Arbitrary<BigInteger> prices() {
        return Arbitraries.bigIntegers().between(BigInteger.ONE, BigInteger.TEN.pow(24));
    }

    @Provide
    Arbitrary<BigInteger> overpayments() {
        return Arbitraries.bigIntegers().between(BigInteger.ZERO, BigInteger.TEN.pow(20));
    }

    @Provide
    Arbitrary<String> payoutRecipients() {
        return Arbitraries.of(CREATOR, ADMIN, "0xseller");
    }
}
