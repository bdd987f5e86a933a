package com.flagship.pawn_ledger.payment;

import com.flagship.pawn_ledger.loan.LoanQueryService;
import com.flagship.pawn_ledger.payment.dto.LoanAmountResponse;
import com.flagship.pawn_ledger.payment.dto.PaymentPageResponse;
import com.flagship.pawn_ledger.payment.dto.PaymentResponse;
import com.flagship.pawn_ledger.payment.dto.ReversalResponse;
import com.flagship.pawn_ledger.payment.dto.ReversePaymentRequest;
import com.flagship.pawn_ledger.payment.dto.SettlePaymentRequest;
import com.flagship.pawn_ledger.payment.dto.SettlementResponse;
import com.flagship.pawn_ledger.settlement.LoanPaymentService;
import com.flagship.pawn_ledger.settlement.ReversePaymentCommand;
import com.flagship.pawn_ledger.settlement.SettlePaymentCommand;
import com.flagship.pawn_ledger.settlement.SettlementResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST Controller for loan payments.
 *
 * Key features:
 * - POST requires an Idempotency-Key header
 * - A repeated key returns the original payment (200) instead of settling again (201)
 * - Business rejections are mapped to HTTP statuses by GlobalExceptionHandler
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    /** Wire names accepted in the sort parameter, mapped to payment properties. */
    private static final Map<String, String> SORTABLE = Map.of(
        "created_at", "createdAt",
        "payment_date", "paymentDate",
        "amount", "amount",
        "payment_number", "paymentNumber");

    private final LoanPaymentService loanPaymentService;
    private final LoanQueryService loanQueryService;

    /**
     * Applies a payment to a loan.
     *
     * @param request Payment request
     * @param idempotencyKey Idempotency key from header (required)
     * @return 201 with the new payment and loan, or 200 with the original payment on replay
     */
    @PostMapping
    public ResponseEntity<SettlementResponse> settlePayment(
            @Valid @RequestBody SettlePaymentRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        log.info("Received payment request: idempotencyKey={}, loanId={}, amount={}, method={}",
                idempotencyKey, request.getLoanId(), request.getAmount(), request.getPaymentMethod());

        SettlePaymentCommand command = SettlePaymentCommand.builder()
            .loanId(request.getLoanId())
            .amount(request.getAmount())
            .paymentMethod(PaymentMethod.fromCode(request.getPaymentMethod()))
            .referenceNumber(request.getReferenceNumber())
            .notes(request.getNotes())
            .cashSessionId(request.getCashSessionId())
            .branchId(request.getBranchId())
            .createdBy(request.getCreatedBy())
            .build();

        SettlementResult result = loanPaymentService.settle(command, idempotencyKey);

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(SettlementResponse.from(result));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(PaymentResponse.from(loanPaymentService.getPayment(id)));
    }

    /**
     * Lists payments page by page, newest first unless sort says otherwise.
     *
     * Paging uses page (1-based), per_page and sort=field,asc|desc where field is
     * one of created_at, payment_date, amount, payment_number. date_from and
     * date_to are inclusive days in the business time zone.
     */
    @GetMapping
    public ResponseEntity<PaymentPageResponse> listPayments(
            @RequestParam(value = "branch_id", required = false) UUID branchId,
            @RequestParam(value = "customer_id", required = false) UUID customerId,
            @RequestParam(value = "loan_id", required = false) UUID loanId,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "method", required = false) String method,
            @RequestParam(value = "date_from", required = false)
                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(value = "date_to", required = false)
                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @PageableDefault(size = 20, sort = "created_at", direction = Sort.Direction.DESC) Pageable pageable) {

        PaymentSearchCriteria criteria = PaymentSearchCriteria.builder()
            .branchId(branchId)
            .customerId(customerId)
            .loanId(loanId)
            .status(status != null ? PaymentStatus.fromCode(status) : null)
            .method(method != null ? PaymentMethod.fromCode(method) : null)
            .paidFrom(dateFrom)
            .paidTo(dateTo)
            .build();

        return ResponseEntity.ok(PaymentPageResponse.from(
            loanPaymentService.searchPayments(criteria, toEntitySort(pageable))));
    }

    @PostMapping("/{id}/reverse")
    public ResponseEntity<ReversalResponse> reversePayment(
            @PathVariable("id") UUID id,
            @Valid @RequestBody ReversePaymentRequest request) {

        log.info("Received reversal request: paymentId={}, reversedBy={}", id, request.getReversedBy());

        ReversePaymentCommand command = new ReversePaymentCommand(id, request.getReason(), request.getReversedBy());
        return ResponseEntity.ok(ReversalResponse.from(loanPaymentService.reverse(command)));
    }

    @GetMapping("/calculate-payoff")
    public ResponseEntity<LoanAmountResponse> calculatePayoff(@RequestParam("loan_id") UUID loanId) {
        return ResponseEntity.ok(new LoanAmountResponse(loanId, loanQueryService.calculatePayoff(loanId)));
    }

    @GetMapping("/calculate-minimum")
    public ResponseEntity<LoanAmountResponse> calculateMinimumPayment(@RequestParam("loan_id") UUID loanId) {
        return ResponseEntity.ok(new LoanAmountResponse(loanId, loanQueryService.calculateMinimumPayment(loanId)));
    }

    private static Pageable toEntitySort(Pageable pageable) {
        List<Sort.Order> orders = pageable.getSort().stream()
            .map(order -> {
                String property = SORTABLE.get(order.getProperty());
                if (property == null) {
                    throw new IllegalArgumentException("Cannot sort payments by: " + order.getProperty());
                }
                return new Sort.Order(order.getDirection(), property);
            })
            .toList();
        return PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), Sort.by(orders));
    }
}
