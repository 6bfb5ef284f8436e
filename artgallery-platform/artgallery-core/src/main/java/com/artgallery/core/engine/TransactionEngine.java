package com.artgallery.core.engine;

import com.artgallery.core.asset.Asset;
import com.artgallery.core.asset.AssetRegistry;
import com.artgallery.core.asset.AssetView;
import com.artgallery.core.error.ErrorKind;
import com.artgallery.core.error.RegistryException;
import com.artgallery.core.event.EventLog;
import com.artgallery.core.event.RegistryEventType;
import com.artgallery.core.gallery.Gallery;
import com.artgallery.core.gallery.GalleryView;
import com.artgallery.core.payment.PaymentGateway;
import com.artgallery.core.payment.PaymentSplit;
import com.artgallery.core.payment.TransferResult;
import com.artgallery.core.review.Review;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.artgallery.core.engine.EventAttributes.*;

/**
 * Entry point for every registry operation.
 *
 * Mutations are serialized behind a single write lock and run as one
 * {@link RegistryTransaction}: preconditions first, then state changes, then events,
 * and for purchases the outward payments last. A failure at any step rolls the whole
 * operation back. Queries share the read lock and return immutable copies. A query
 * issued while a mutation is in flight waits for it to commit or roll back, outward
 * payments included, so it never observes a half-applied operation. Slow gateways
 * therefore delay readers too.
 *
 * While an operation is in progress, any other mutating call made on the same thread
 * (from a payment gateway or event subscriber) fails once its own preconditions pass.
 */
public class TransactionEngine {

    private static final Logger log = LoggerFactory.getLogger(TransactionEngine.class);

    public static final int DEFAULT_PLATFORM_FEE_RATE = 25;
    public static final int MAX_PLATFORM_FEE_RATE = 100;

    private final RegistryState state;
    private final EventLog eventLog;
    private final PaymentGateway paymentGateway;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private RegistryTransaction active;

    TransactionEngine(RegistryState state, EventLog eventLog, PaymentGateway paymentGateway, Clock clock) {
        this.state = Objects.requireNonNull(state, "State cannot be null");
        this.eventLog = Objects.requireNonNull(eventLog, "Event log cannot be null");
        this.paymentGateway = Objects.requireNonNull(paymentGateway, "Payment gateway cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Opens a new registry on an empty event log.
     */
    public static TransactionEngine open(String administrator, int platformFeeRate, EventLog eventLog,
                                         PaymentGateway paymentGateway, Clock clock) {
        RegistryException.requireText(administrator, "Administrator identity must not be empty");
        requireFeeRate(platformFeeRate);
        if (!eventLog.isEmpty()) {
            throw new IllegalStateException("Event log already holds " + eventLog.size() + " events; resume it instead");
        }

        TransactionEngine engine = new TransactionEngine(
                new RegistryState(administrator, platformFeeRate), eventLog, paymentGateway, clock);
        engine.write(() -> engine.transact("open", tx -> {
            tx.emit(RegistryEventType.REGISTRY_OPENED, REGISTRY, Map.of(
                    ADMINISTRATOR, administrator,
                    PLATFORM_FEE_RATE, Integer.toString(platformFeeRate)));
            return null;
        }));
        log.info("Opened registry administered by {} with platform fee rate {}", administrator, platformFeeRate);
        return engine;
    }

    /**
     * Rebuilds a registry by replaying an existing event log and continues appending to it.
     */
    public static TransactionEngine resume(EventLog eventLog, PaymentGateway paymentGateway, Clock clock) {
        RegistryState state = RegistryReplayer.replay(eventLog.all());
        log.info("Resumed registry from {} events ({} galleries, {} assets)",
                eventLog.size(), state.galleries().size(), state.assets().size());
        return new TransactionEngine(state, eventLog, paymentGateway, clock);
    }

    // ==================== Gallery Directory ====================

    public GalleryView createGallery(String key, String name, String description, String caller) {
        return write(() -> {
            String curator = requireCaller(caller);
            state.galleries().validateNew(key, name);

            return transact("createGallery", tx -> {
                Gallery gallery = state.galleries().create(key, name, description, curator, tx.timestamp());
                tx.onRollback(() -> state.galleries().remove(gallery));
                tx.emit(RegistryEventType.GALLERY_CREATED, key, Map.of(
                        NAME, gallery.getName(),
                        DESCRIPTION, gallery.getDescription(),
                        CURATOR, curator));
                return gallery.toView();
            });
        });
    }

    public GalleryView getGallery(String key) {
        return read(() -> state.galleries().require(key).toView());
    }

    public List<Long> getArtworks(String key) {
        return read(() -> state.galleries().artworksOf(key));
    }

    public List<String> getGalleriesOf(String curator) {
        return read(() -> state.galleries().galleriesOf(curator));
    }

    public List<GalleryView> listGalleries() {
        return read(() -> state.galleries().all());
    }

    // ==================== Asset Registry ====================

    /**
     * Lists a new asset owned by its creator and returns the issued id.
     */
    public long createAsset(String title, String contentRef, BigInteger price, String galleryKey,
                            int royaltyPercent, String caller) {
        return write(() -> {
            String creator = requireCaller(caller);
            RegistryException.requireText(title, "Title must not be empty");
            AssetRegistry.requirePositivePrice(price);
            Gallery gallery = state.galleries().require(galleryKey);
            AssetRegistry.requireRoyaltyPercent(royaltyPercent);

            return transact("createAsset", tx -> {
                Asset asset = state.assets().register(title, creator, contentRef == null ? "" : contentRef,
                        price, galleryKey, royaltyPercent, tx.timestamp());
                tx.onRollback(() -> state.assets().unregister(asset));
                state.galleries().addArtwork(gallery, asset.getId());
                tx.onRollback(() -> state.galleries().removeLastArtwork(gallery, asset.getId()));
                tx.emit(RegistryEventType.ASSET_CREATED, Long.toString(asset.getId()), Map.of(
                        TITLE, asset.getTitle(),
                        CREATOR, creator,
                        CONTENT_REF, asset.getContentRef(),
                        PRICE, price.toString(),
                        GALLERY, galleryKey,
                        ROYALTY_PERCENT, Integer.toString(royaltyPercent)));
                return asset.getId();
            });
        });
    }

    /**
     * Sets a new price and puts the asset back on the market. Owner only.
     */
    public AssetView updatePrice(long assetId, BigInteger newPrice, String caller) {
        return write(() -> {
            String owner = requireCaller(caller);
            Asset asset = state.assets().require(assetId);
            if (!asset.getOwner().equals(owner)) {
                throw RegistryException.unauthorized("Only the owner can update the price of artwork " + assetId);
            }
            AssetRegistry.requirePositivePrice(newPrice);

            return transact("updatePrice", tx -> {
                BigInteger previousPrice = asset.getPrice();
                boolean wasForSale = asset.isForSale();
                state.assets().reprice(asset, newPrice);
                tx.onRollback(() -> state.assets().restorePrice(asset, previousPrice, wasForSale));
                tx.emit(RegistryEventType.PRICE_UPDATED, Long.toString(assetId), Map.of(
                        PRICE, newPrice.toString(),
                        OWNER, owner));
                return asset.toView();
            });
        });
    }

    public AssetView getAsset(long assetId) {
        return read(() -> state.assets().require(assetId).toView());
    }

    public long getAverageRating(long assetId) {
        return read(() -> state.assets().require(assetId).averageRating());
    }

    public String ownerOf(long assetId) {
        return read(() -> state.assets().require(assetId).getOwner());
    }

    public String contentRefOf(long assetId) {
        return read(() -> state.assets().require(assetId).getContentRef());
    }

    /**
     * Every id the identity has ever acquired, in acquisition order. Ids are not removed on resale.
     */
    public List<Long> getByOwner(String identity) {
        return read(() -> state.assets().byOwner(identity));
    }

    public List<Long> getByGallery(String galleryKey) {
        return read(() -> state.assets().byGallery(galleryKey));
    }

    public List<AssetView> listAssets() {
        return read(() -> state.assets().all());
    }

    // ==================== Purchase ====================

    /**
     * Buys a listed asset. Ownership moves before any money does; payouts follow in the
     * order royalty, platform fee, seller proceeds. A failed payout reverses the completed
     * ones and restores the listing.
     */
    public PurchaseReceipt purchase(long assetId, BigInteger payment, String caller) {
        return write(() -> {
            String buyer = requireCaller(caller);
            Asset asset = state.assets().require(assetId);
            if (!asset.isForSale()) {
                throw new RegistryException(ErrorKind.NOT_FOR_SALE, "Artwork is not for sale: " + assetId);
            }
            if (payment == null || payment.compareTo(asset.getPrice()) < 0) {
                throw new RegistryException(ErrorKind.INSUFFICIENT_PAYMENT,
                        "Insufficient payment: price is " + asset.getPrice() + ", offered " + payment);
            }

            String seller = asset.getOwner();
            String creator = asset.getCreator();
            String administrator = state.administrator();
            boolean primarySale = asset.isPrimarySale();
            PaymentSplit split;
            try {
                split = PaymentSplit.of(payment, state.platformFeeRate(), asset.getRoyaltyPercent(), primarySale);
            } catch (IllegalArgumentException e) {
                throw new RegistryException(ErrorKind.INVALID_ARGUMENT, e.getMessage(), e);
            }

            return transact("purchase", tx -> {
                state.assets().transfer(asset, buyer);
                tx.onRollback(() -> state.assets().revertTransfer(asset, seller, true));
                tx.emit(RegistryEventType.ASSET_SOLD, Long.toString(assetId), Map.of(
                        SELLER, seller,
                        BUYER, buyer,
                        PAYMENT, payment.toString()));

                List<TransferResult> completed = new ArrayList<>();
                tx.onRollback(() -> reverseTransfers(completed));

                if (split.royalty().signum() > 0) {
                    completed.add(pay(creator, split.royalty(), "royalty", assetId));
                    tx.emit(RegistryEventType.ROYALTY_PAID, Long.toString(assetId), Map.of(
                            CREATOR, creator,
                            AMOUNT, split.royalty().toString()));
                }
                if (split.platformFee().signum() > 0) {
                    completed.add(pay(administrator, split.platformFee(), "platform fee", assetId));
                }
                if (split.sellerProceeds().signum() > 0) {
                    completed.add(pay(seller, split.sellerProceeds(), "seller proceeds", assetId));
                }

                log.info("Artwork {} sold by {} to {} for {} (royalty {}, fee {}, proceeds {})",
                        assetId, seller, buyer, payment, split.royalty(), split.platformFee(), split.sellerProceeds());
                return new PurchaseReceipt(assetId, seller, buyer, creator, payment, split.royalty(),
                        split.platformFee(), split.sellerProceeds(), primarySale);
            });
        });
    }

    private TransferResult pay(String recipient, BigInteger amount, String purpose, long assetId) {
        TransferResult result;
        try {
            result = paymentGateway.transfer(recipient, amount);
        } catch (RuntimeException e) {
            throw new RegistryException(ErrorKind.TRANSFER_FAILED,
                    "Transfer of " + purpose + " for artwork " + assetId + " to " + recipient + " failed: " + e.getMessage(), e);
        }
        if (result == null || !result.successful()) {
            String reason = result == null ? "no result from payment gateway" : result.failureReason();
            throw new RegistryException(ErrorKind.TRANSFER_FAILED,
                    "Transfer of " + purpose + " for artwork " + assetId + " to " + recipient + " failed: " + reason);
        }
        return result;
    }

    private void reverseTransfers(List<TransferResult> completed) {
        for (int i = completed.size() - 1; i >= 0; i--) {
            paymentGateway.reverse(completed.get(i));
        }
    }

    // ==================== Review Ledger ====================

    public Review addReview(long assetId, String comment, int rating, String caller) {
        return write(() -> {
            String reviewer = requireCaller(caller);
            Asset asset = state.assets().require(assetId);
            state.reviews().validate(assetId, rating, reviewer);

            return transact("addReview", tx -> {
                Review review = state.reviews().append(assetId, reviewer, comment, rating, tx.timestamp());
                tx.onRollback(() -> state.reviews().removeLast(review));
                state.assets().recordRating(asset, rating);
                tx.onRollback(() -> state.assets().revertRating(asset, rating));
                tx.emit(RegistryEventType.REVIEW_ADDED, Long.toString(assetId), Map.of(
                        REVIEWER, reviewer,
                        COMMENT, review.comment(),
                        RATING, Integer.toString(rating)));
                return review;
            });
        });
    }

    public List<Review> getReviews(long assetId) {
        return read(() -> {
            state.assets().require(assetId);
            return state.reviews().reviewsOf(assetId);
        });
    }

    public boolean hasRated(long assetId, String identity) {
        return read(() -> state.reviews().hasRated(assetId, identity));
    }

    // ==================== Fee Administration ====================

    /**
     * Sets the platform fee in tenths of a percent (25 = 2.5%). Administrator only, at most 100.
     */
    public int updateFee(int newRate, String caller) {
        return write(() -> {
            String administrator = requireAdministrator(caller);
            requireFeeRate(newRate);

            return transact("updateFee", tx -> {
                int previous = state.platformFeeRate();
                state.setPlatformFeeRate(newRate);
                tx.onRollback(() -> state.setPlatformFeeRate(previous));
                tx.emit(RegistryEventType.PLATFORM_FEE_UPDATED, REGISTRY, Map.of(
                        PREVIOUS_PLATFORM_FEE_RATE, Integer.toString(previous),
                        PLATFORM_FEE_RATE, Integer.toString(newRate),
                        ADMINISTRATOR, administrator));
                log.info("Platform fee rate changed from {} to {} by {}", previous, newRate, administrator);
                return newRate;
            });
        });
    }

    public String transferAdministration(String newAdministrator, String caller) {
        return write(() -> {
            String administrator = requireAdministrator(caller);
            RegistryException.requireText(newAdministrator, "New administrator identity must not be empty");

            return transact("transferAdministration", tx -> {
                state.setAdministrator(newAdministrator);
                tx.onRollback(() -> state.setAdministrator(administrator));
                tx.emit(RegistryEventType.ADMINISTRATION_TRANSFERRED, REGISTRY, Map.of(
                        PREVIOUS_ADMINISTRATOR, administrator,
                        ADMINISTRATOR, newAdministrator));
                log.info("Administration transferred from {} to {}", administrator, newAdministrator);
                return newAdministrator;
            });
        });
    }

    public int getPlatformFee() {
        return read(state::platformFeeRate);
    }

    public String getAdministrator() {
        return read(state::administrator);
    }

    public EventLog getEventLog() {
        return eventLog;
    }

    // ==================== Plumbing ====================

    private static String requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw RegistryException.unauthorized("Caller identity is required");
        }
        return caller;
    }

    private String requireAdministrator(String caller) {
        String identity = requireCaller(caller);
        if (!identity.equals(state.administrator())) {
            throw RegistryException.unauthorized("Caller is not the administrator: " + identity);
        }
        return identity;
    }

    private static void requireFeeRate(int rate) {
        if (rate > MAX_PLATFORM_FEE_RATE) {
            throw RegistryException.invalidArgument("Fee cannot exceed 10%: " + rate);
        }
        if (rate < 0) {
            throw RegistryException.invalidArgument("Fee rate cannot be negative: " + rate);
        }
    }

    private <T> T write(Supplier<T> operation) {
        lock.writeLock().lock();
        try {
            return operation.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs the mutating part of an operation. Must be called with the write lock held,
     * after the operation's preconditions have been checked.
     */
    private <T> T transact(String operation, Function<RegistryTransaction, T> mutation) {
        if (active != null) {
            throw new RegistryException(ErrorKind.REENTRANT_CALL,
                    operation + " cannot run while " + active.operation() + " is in progress");
        }
        RegistryTransaction tx = new RegistryTransaction(operation, clock.instant());
        active = tx;
        try {
            T result = mutation.apply(tx);
            tx.commit(eventLog);
            return result;
        } catch (RuntimeException e) {
            tx.rollback(e);
            throw e;
        } finally {
            active = null;
        }
    }
}
