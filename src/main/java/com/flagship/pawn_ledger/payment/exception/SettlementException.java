package com.flagship.pawn_ledger.payment.exception;

/**
 * Base class for business rejections raised by the settlement and reversal engines.
 * A rejected call leaves the loan exactly as it was.
 */
public abstract class SettlementException extends RuntimeException {

    protected SettlementException(String message) {
        super(message);
    }

    protected SettlementException(String message, Throwable cause) {
        super(message, cause);
    }
}
