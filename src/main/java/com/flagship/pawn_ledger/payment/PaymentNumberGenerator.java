package com.flagship.pawn_ledger.payment;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Issues receipt numbers of the form PY-2026-000042.
 *
 * The counter is the payment_number_seq database sequence, so numbers are
 * unique across instances. A number consumed by a rolled back settlement is skipped.
 */
@Component
public class PaymentNumberGenerator {

    private static final String NEXT_VALUE_SQL = "SELECT nextval('payment_number_seq')";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final ZoneId zone;

    public PaymentNumberGenerator(JdbcTemplate jdbcTemplate,
                                  Clock clock,
                                  @Value("${settlement.business-zone:UTC}") String businessZone) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.zone = ZoneId.of(businessZone);
    }

    public String next() {
        Long sequence = jdbcTemplate.queryForObject(NEXT_VALUE_SQL, Long.class);
        if (sequence == null) {
            throw new IllegalStateException("payment_number_seq returned no value");
        }
        return format(ZonedDateTime.now(clock.withZone(zone)).getYear(), sequence);
    }

    static String format(int year, long sequence) {
        return String.format("PY-%d-%06d", year, sequence);
    }
}
