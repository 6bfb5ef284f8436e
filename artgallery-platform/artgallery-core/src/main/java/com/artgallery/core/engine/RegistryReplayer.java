package com.artgallery.core.engine;

import com.artgallery.core.asset.Asset;
import com.artgallery.core.event.RegistryEvent;
import com.artgallery.core.event.RegistryEventType;

import java.util.List;

import static com.artgallery.core.engine.EventAttributes.*;

/**
 * Rebuilds registry state from the event log, the same way a downstream indexer would.
 */
public final class RegistryReplayer {

    private RegistryReplayer() {
    }

    /**
     * @throws IllegalStateException if the events do not start with a registry opening
     *                               or reference records that were never created
     */
    public static RegistryState replay(List<RegistryEvent> events) {
        if (events.isEmpty() || events.get(0).type() != RegistryEventType.REGISTRY_OPENED) {
            throw new IllegalStateException("Event log must start with " + RegistryEventType.REGISTRY_OPENED);
        }
        RegistryEvent opening = events.get(0);
        RegistryState state = new RegistryState(
                opening.attribute(ADMINISTRATOR), opening.intAttribute(PLATFORM_FEE_RATE));

        for (RegistryEvent event : events.subList(1, events.size())) {
            try {
                apply(state, event);
            } catch (RuntimeException e) {
                throw new IllegalStateException(
                        "Cannot replay " + event.type() + " event " + event.sequence() + ": " + e.getMessage(), e);
            }
        }
        return state;
    }

    private static void apply(RegistryState state, RegistryEvent event) {
        switch (event.type()) {
            case REGISTRY_OPENED -> throw new IllegalStateException("Registry opened twice");
            case GALLERY_CREATED -> state.galleries().create(
                    event.subject(),
                    event.attribute(NAME),
                    event.attribute(DESCRIPTION),
                    event.attribute(CURATOR),
                    event.timestamp());
            case ASSET_CREATED -> {
                String galleryKey = event.attribute(GALLERY);
                Asset asset = state.assets().restore(
                        Long.parseLong(event.subject()),
                        event.attribute(TITLE),
                        event.attribute(CREATOR),
                        event.attribute(CONTENT_REF),
                        event.amountAttribute(PRICE),
                        galleryKey,
                        event.intAttribute(ROYALTY_PERCENT),
                        event.timestamp());
                state.galleries().addArtwork(state.galleries().require(galleryKey), asset.getId());
            }
            case ASSET_SOLD -> state.assets().transfer(assetOf(state, event), event.attribute(BUYER));
            case PRICE_UPDATED -> state.assets().reprice(assetOf(state, event), event.amountAttribute(PRICE));
            case REVIEW_ADDED -> {
                Asset asset = assetOf(state, event);
                int rating = event.intAttribute(RATING);
                state.reviews().append(asset.getId(), event.attribute(REVIEWER), event.attribute(COMMENT),
                        rating, event.timestamp());
                state.assets().recordRating(asset, rating);
            }
            case PLATFORM_FEE_UPDATED -> state.setPlatformFeeRate(event.intAttribute(PLATFORM_FEE_RATE));
            case ADMINISTRATION_TRANSFERRED -> state.setAdministrator(event.attribute(ADMINISTRATOR));
            case ROYALTY_PAID -> {
                // payout record only; ownership already moved with ASSET_SOLD
            }
        }
    }

    private static Asset assetOf(RegistryState state, RegistryEvent event) {
        return state.assets().require(Long.parseLong(event.subject()));
    }
}
