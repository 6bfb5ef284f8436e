package com.artgallery.core.engine;

import java.math.BigInteger;

/**
 * Settlement of a completed purchase.
 */
public record PurchaseReceipt(
        long assetId,
        String seller,
        String buyer,
        String creator,
        BigInteger payment,
        BigInteger royalty,
        BigInteger platformFee,
        BigInteger sellerProceeds,
        boolean primarySale
) {}
