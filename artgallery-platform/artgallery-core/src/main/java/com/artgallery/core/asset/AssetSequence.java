package com.artgallery.core.asset;

/**
 * Monotonic asset id allocator. Ids start at 1 and are never handed out twice.
 */
public class AssetSequence {

    private long lastIssued;

    public long next() {
        return ++lastIssued;
    }

    /**
     * Returns the most recently issued id when its operation did not commit.
     */
    public void release(long issuedId) {
        if (issuedId != lastIssued) {
            throw new IllegalStateException("Only the last issued id " + lastIssued + " can be released, not " + issuedId);
        }
        lastIssued--;
    }

    /**
     * Advances the sequence past an id issued elsewhere (replay).
     */
    public void observe(long issuedId) {
        if (issuedId <= lastIssued) {
            throw new IllegalStateException("Asset id " + issuedId + " is not beyond last issued id " + lastIssued);
        }
        lastIssued = issuedId;
    }
}
