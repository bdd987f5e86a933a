package com.flagship.pawn_ledger.payment.exception;

/**
 * Lost the per-loan lock or version race. The whole settle/reverse call is safe to retry.
 */
public class ConcurrencyConflictException extends SettlementException {

    /**
     * @param target what was being updated, e.g. "loan 3f2a..." or "payment 91c0..."
     */
    public ConcurrencyConflictException(String target, Throwable cause) {
        super("Concurrent update on " + target + ", retry the request", cause);
    }
}
