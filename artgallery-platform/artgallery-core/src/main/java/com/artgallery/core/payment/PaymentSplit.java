package com.artgallery.core.payment;

import java.math.BigInteger;

/**
 * Division of a purchase payment between creator royalty, platform fee and seller.
 * Both cuts are floored; truncation remainders accrue to the seller.
 */
public record PaymentSplit(
        BigInteger payment,
        BigInteger royalty,
        BigInteger platformFee,
        BigInteger sellerProceeds
) {

    /** Platform fee rate unit: tenths of a percent. */
    public static final BigInteger FEE_DENOMINATOR = BigInteger.valueOf(1000);
    public static final BigInteger ROYALTY_DENOMINATOR = BigInteger.valueOf(100);

    /**
     * @param primarySale seller is the creator; no royalty is due
     * @throws IllegalArgumentException if royalty and fee together exceed the payment
     */
    public static PaymentSplit of(BigInteger payment, int platformFeeRate, int royaltyPercent, boolean primarySale) {
        BigInteger fee = payment.multiply(BigInteger.valueOf(platformFeeRate)).divide(FEE_DENOMINATOR);
        BigInteger royalty = primarySale
                ? BigInteger.ZERO
                : payment.multiply(BigInteger.valueOf(royaltyPercent)).divide(ROYALTY_DENOMINATOR);
        BigInteger proceeds = payment.subtract(fee).subtract(royalty);
        if (proceeds.signum() < 0) {
            throw new IllegalArgumentException(
                    "Royalty " + royalty + " and platform fee " + fee + " exceed payment " + payment);
        }
        return new PaymentSplit(payment, royalty, fee, proceeds);
    }
}
