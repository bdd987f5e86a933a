package com.flagship.pawn_ledger.collateral;

/**
 * Status of a pawned item.
 */
public enum ItemStatus {
    /**
     * Back with the customer (or never pledged).
     */
    AVAILABLE,

    /**
     * Held as security for an open loan.
     */
    COLLATERAL,

    /**
     * Forfeited by the customer after default.
     */
    CONFISCATED,

    /**
     * Sold by the shop. Terminal state.
     */
    SOLD
}
