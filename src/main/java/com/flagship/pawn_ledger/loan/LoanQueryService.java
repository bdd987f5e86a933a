package com.flagship.pawn_ledger.loan;

import com.flagship.pawn_ledger.payment.exception.LoanNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Read-only loan views: balances with an overdue snapshot, the installment
 * schedule, and the payoff and minimum payment amounts.
 */
@Service
@RequiredArgsConstructor
public class LoanQueryService {

    private final LoanPersistenceService loanPersistence;
    private final OverdueCalculator overdueCalculator;

    public LoanSnapshot getLoan(UUID loanId) {
        Loan loan = load(loanId);
        return new LoanSnapshot(loan, overdueCalculator.evaluate(loan));
    }

    public List<LoanInstallment> getInstallments(UUID loanId) {
        load(loanId);
        return loanPersistence.findInstallments(loanId);
    }

    /**
     * Amount that closes the loan in one payment.
     */
    public BigDecimal calculatePayoff(UUID loanId) {
        return load(loanId).getRemainingBalance();
    }

    public BigDecimal calculateMinimumPayment(UUID loanId) {
        return load(loanId).getMinimumPaymentDue();
    }

    private Loan load(UUID loanId) {
        return loanPersistence.findById(loanId).orElseThrow(() -> new LoanNotFoundException(loanId));
    }
}
