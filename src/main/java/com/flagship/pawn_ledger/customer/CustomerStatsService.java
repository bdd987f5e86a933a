package com.flagship.pawn_ledger.customer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Maintains the customer's running total of payments.
 *
 * Runs in the consumer's transaction, so the update commits together with the
 * processed_events record and a redelivered event never counts twice.
 * An unknown customer is logged and skipped; it never blocks the event stream.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerStatsService {

    private final CustomerRepository customerRepository;

    /**
     * @return true if the customer exists and was updated
     */
    @Transactional
    public boolean recordPayment(UUID customerId, BigDecimal amount) {
        return customerRepository.findByIdForUpdate(customerId)
            .map(customer -> {
                customer.addPayment(amount);
                customerRepository.save(customer);
                log.debug("Customer {} total paid is now {}", customerId, customer.getTotalPaid());
                return true;
            })
            .orElseGet(() -> {
                log.warn("Customer {} not found, total paid not increased by {}", customerId, amount);
                return false;
            });
    }

    /**
     * Subtracts a reversed payment. The total is clamped at zero.
     *
     * @return true if the customer exists and was updated
     */
    @Transactional
    public boolean revertPayment(UUID customerId, BigDecimal amount) {
        return customerRepository.findByIdForUpdate(customerId)
            .map(customer -> {
                BigDecimal before = customer.getTotalPaid();
                customer.subtractPayment(amount);
                customerRepository.save(customer);
                if (before.compareTo(amount) < 0) {
                    log.warn("Customer {} total paid {} was below reversed amount {}, clamped to zero",
                            customerId, before, amount);
                }
                return true;
            })
            .orElseGet(() -> {
                log.warn("Customer {} not found, total paid not reduced by {}", customerId, amount);
                return false;
            });
    }
}
