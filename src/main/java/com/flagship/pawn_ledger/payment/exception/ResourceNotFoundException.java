package com.flagship.pawn_ledger.payment.exception;

import java.util.UUID;

/**
 * A loan or payment does not exist.
 */
public abstract class ResourceNotFoundException extends SettlementException {

    private final UUID resourceId;

    protected ResourceNotFoundException(String resource, UUID resourceId) {
        super(resource + " not found: " + resourceId);
        this.resourceId = resourceId;
    }

    public UUID getResourceId() {
        return resourceId;
    }
}
