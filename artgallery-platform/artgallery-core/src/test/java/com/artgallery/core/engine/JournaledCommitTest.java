package com.artgallery.core.engine;

import com.artgallery.core.asset.AssetView;
import com.artgallery.core.event.EventJournal;
import com.artgallery.core.event.EventLog;
import com.artgallery.core.event.JsonLinesEventJournal;
import com.artgallery.core.event.RegistryEvent;
import com.artgallery.core.event.RegistryEventType;
import com.artgallery.core.gallery.GalleryView;
import com.artgallery.core.payment.LedgerPaymentGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

/**
 * A commit that cannot be journaled does not happen: state, payouts and the log
 * stay as they were, and the journal always restarts cleanly.
 */
class JournaledCommitTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final BigInteger PRICE = BigInteger.valueOf(1000);

    @TempDir
    Path tempDir;

    private Path journalPath;
    private AtomicBoolean failNextSale;
    private EventLog eventLog;
    private LedgerPaymentGateway ledger;
    private TransactionEngine engine;

    @BeforeEach
    void setUp() {
        journalPath = tempDir.resolve("events.jsonl");
        JsonLinesEventJournal durable = new JsonLinesEventJournal(journalPath);
        failNextSale = new AtomicBoolean();
        EventJournal flaky = batch -> {
            boolean sale = batch.stream().anyMatch(event -> event.type() == RegistryEventType.ASSET_SOLD);
            if (sale && failNextSale.getAndSet(false)) {
                throw new UncheckedIOException(new IOException("No space left on device"));
            }
            durable.write(batch);
        };

        eventLog = new EventLog();
        eventLog.attachJournal(flaky);
        ledger = new LedgerPaymentGateway("REGISTRY_ESCROW", CLOCK);
        engine = TransactionEngine.open("0xadmin", 25, eventLog, ledger, CLOCK);
        engine.createGallery("g1", "Gallery", "", "0xcurator");
    }

    @Test
    void journalFailureDuringPurchase_rollsBackOwnershipAndPayouts() {
        long id = engine.createAsset("Art", "ipfs://x", PRICE, "g1", 10, "0xcreator");
        int eventsBefore = eventLog.size();
        failNextSale.set(true);

        assertThatThrownBy(() -> engine.purchase(id, PRICE, "0xbuyer"))
                .isInstanceOf(UncheckedIOException.class);

        assertThat(engine.ownerOf(id)).isEqualTo("0xcreator");
        assertThat(engine.getAsset(id).forSale()).isTrue();
        assertThat(engine.getByOwner("0xbuyer")).isEmpty();
        assertThat(eventLog.size()).isEqualTo(eventsBefore);
        assertThat(ledger.totalPaidOut()).isZero();
        assertThat(ledger.balanceOf("0xcreator")).isZero();
    }

    @Test
    void journalAfterFailedCommit_restartsToLiveState() {
        long id = engine.createAsset("Art", "ipfs://x", PRICE, "g1", 10, "0xcreator");
        failNextSale.set(true);
        assertThatThrownBy(() -> engine.purchase(id, PRICE, "0xbuyer"))
                .isInstanceOf(UncheckedIOException.class);

        engine.updatePrice(id, PRICE.multiply(BigInteger.TWO), "0xcreator");
        engine.purchase(id, PRICE.multiply(BigInteger.TWO), "0xbuyer");

        List<RegistryEvent> journaled = new JsonLinesEventJournal(journalPath).load();
        assertThat(journaled).isEqualTo(eventLog.all());

        EventLog restored = new EventLog();
        journaled.forEach(restored::appendVerified);
        TransactionEngine restarted = TransactionEngine.resume(
                restored, new LedgerPaymentGateway("REGISTRY_ESCROW", CLOCK), CLOCK);

        assertThat(restored.verifyChain().isValid()).isTrue();
        assertThat(restarted.listAssets()).isEqualTo(engine.listAssets());
        assertThat(restarted.ownerOf(id)).isEqualTo("0xbuyer");
    }

    @Test
    void journalFailureOnCreate_doesNotConsumeAnId() {
        eventLog.attachJournal(batch -> {
            throw new UncheckedIOException(new IOException("read-only file system"));
        });

        assertThatThrownBy(() -> engine.createAsset("Art", "ipfs://x", PRICE, "g1", 10, "0xcreator"))
                .isInstanceOf(UncheckedIOException.class);

        assertThat(engine.listAssets()).isEmpty();
        assertThat(engine.getArtworks("g1")).isEmpty();
        assertThat(engine.getByOwner("0xcreator")).isEmpty();

        eventLog.attachJournal(batch -> { });
        assertThat(engine.createAsset("Art", "ipfs://x", PRICE, "g1", 10, "0xcreator")).isEqualTo(1);
    }

    @Test
    void journalFailure_rollsBackEveryKindOfMutation() {
        long id = engine.createAsset("Art", "ipfs://x", PRICE, "g1", 10, "0xcreator");
        AssetView before = engine.getAsset(id);
        eventLog.attachJournal(batch -> {
            throw new UncheckedIOException(new IOException("journal offline"));
        });

        assertThatThrownBy(() -> engine.createGallery("g2", "Second", "", "0xcurator"))
                .isInstanceOf(UncheckedIOException.class);
        assertThatThrownBy(() -> engine.updatePrice(id, PRICE.add(BigInteger.ONE), "0xcreator"))
                .isInstanceOf(UncheckedIOException.class);
        assertThatThrownBy(() -> engine.addReview(id, "Nice", 5, "0xreader"))
                .isInstanceOf(UncheckedIOException.class);
        assertThatThrownBy(() -> engine.updateFee(50, "0xadmin"))
                .isInstanceOf(UncheckedIOException.class);
        assertThatThrownBy(() -> engine.transferAdministration("0xnext", "0xadmin"))
                .isInstanceOf(UncheckedIOException.class);

        assertThat(engine.listGalleries()).extracting(GalleryView::key).containsExactly("g1");
        assertThat(engine.getGalleriesOf("0xcurator")).containsExactly("g1");
        assertThat(engine.getAsset(id)).isEqualTo(before);
        assertThat(engine.getReviews(id)).isEmpty();
        assertThat(engine.hasRated(id, "0xreader")).isFalse();
        assertThat(engine.getPlatformFee()).isEqualTo(25);
        assertThat(engine.getAdministrator()).isEqualTo("0xadmin");

        eventLog.attachJournal(batch -> { });
        assertThat(engine.addReview(id, "Nice", 5, "0xreader").rating()).isEqualTo(5);
        assertThat(engine.createGallery("g2", "Second", "", "0xcurator").key()).isEqualTo("g2");
    }
}
