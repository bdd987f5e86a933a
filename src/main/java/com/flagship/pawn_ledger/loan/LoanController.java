package com.flagship.pawn_ledger.loan;

import com.flagship.pawn_ledger.loan.dto.InstallmentResponse;
import com.flagship.pawn_ledger.loan.dto.LoanResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Read-only loan endpoints.
 */
@RestController
@RequestMapping("/api/loans")
@RequiredArgsConstructor
public class LoanController {

    private final LoanQueryService loanQueryService;

    /**
     * Loan balances and status with an overdue snapshot.
     */
    @GetMapping("/{id}")
    public ResponseEntity<LoanResponse> getLoan(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(LoanResponse.from(loanQueryService.getLoan(id)));
    }

    @GetMapping("/{id}/installments")
    public ResponseEntity<List<InstallmentResponse>> getInstallments(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(loanQueryService.getInstallments(id).stream()
            .map(InstallmentResponse::from)
            .toList());
    }
}
