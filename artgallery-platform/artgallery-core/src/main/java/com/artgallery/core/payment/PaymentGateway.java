package com.artgallery.core.payment;

import java.math.BigInteger;

/**
 * Outward payment substrate invoked synchronously while a purchase settles.
 */
public interface PaymentGateway {

    /**
     * Moves {@code amount} out of the registry to {@code recipient}.
     * Rejections are reported through {@link TransferResult#successful()}; implementations
     * may also throw, which the engine treats the same way.
     */
    TransferResult transfer(String recipient, BigInteger amount);

    /**
     * Compensates a transfer that completed inside a purchase that is being rolled back.
     */
    void reverse(TransferResult completed);
}
