package com.flagship.pawn_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.payment.Payment;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;

/**
 * One page of payments. page is 1-based, matching the request parameter.
 */
@Value
public class PaymentPageResponse {

    @JsonProperty("content")
    List<PaymentResponse> content;

    @JsonProperty("page")
    int page;

    @JsonProperty("per_page")
    int perPage;

    @JsonProperty("total_elements")
    long totalElements;

    @JsonProperty("total_pages")
    int totalPages;

    public static PaymentPageResponse from(Page<Payment> page) {
        return new PaymentPageResponse(
            page.getContent().stream().map(PaymentResponse::from).toList(),
            page.getNumber() + 1,
            page.getSize(),
            page.getTotalElements(),
            page.getTotalPages());
    }
}
