package com.flagship.pawn_ledger.settlement;

import lombok.Value;

import java.util.UUID;

@Value
public class ReversePaymentCommand {
    UUID paymentId;
    String reason;
    UUID reversedBy;
}
