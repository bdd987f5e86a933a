package com.flagship.pawn_ledger.payment;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Query predicates for payment listing.
 */
public final class PaymentSpecifications {

    private PaymentSpecifications() {
    }

    /**
     * Payments matching every non-null field of the criteria.
     * Day bounds are resolved in {@code zone}; paidTo covers the whole day.
     */
    public static Specification<PaymentEntity> matching(PaymentSearchCriteria criteria, ZoneId zone) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (criteria.getBranchId() != null) {
                predicates.add(cb.equal(root.get("branchId"), criteria.getBranchId()));
            }
            if (criteria.getCustomerId() != null) {
                predicates.add(cb.equal(root.get("customerId"), criteria.getCustomerId()));
            }
            if (criteria.getLoanId() != null) {
                predicates.add(cb.equal(root.get("loanId"), criteria.getLoanId()));
            }
            if (criteria.getStatus() != null) {
                predicates.add(cb.equal(root.get("status"), criteria.getStatus()));
            }
            if (criteria.getMethod() != null) {
                predicates.add(cb.equal(root.get("paymentMethod"), criteria.getMethod()));
            }
            if (criteria.getPaidFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("paymentDate"),
                    criteria.getPaidFrom().atStartOfDay(zone).toInstant()));
            }
            if (criteria.getPaidTo() != null) {
                predicates.add(cb.lessThan(root.<Instant>get("paymentDate"),
                    criteria.getPaidTo().plusDays(1).atStartOfDay(zone).toInstant()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
