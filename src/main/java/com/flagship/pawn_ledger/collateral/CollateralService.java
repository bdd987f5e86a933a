package com.flagship.pawn_ledger.collateral;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Releases and re-pledges pawned items as their loans close and reopen.
 *
 * Each change runs in its own transaction: a failure here rolls back only the
 * item update, and callers log it without failing the surrounding work.
 * Both operations are idempotent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollateralService {

    private final ItemRepository itemRepository;

    /**
     * COLLATERAL → AVAILABLE, after the loan was paid off.
     *
     * @return true if the item is now AVAILABLE
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean release(UUID itemId) {
        return move(itemId, ItemStatus.COLLATERAL, ItemStatus.AVAILABLE);
    }

    /**
     * AVAILABLE → COLLATERAL, after a reversal reopened a paid loan.
     *
     * @return true if the item is now COLLATERAL
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean repledge(UUID itemId) {
        return move(itemId, ItemStatus.AVAILABLE, ItemStatus.COLLATERAL);
    }

    private boolean move(UUID itemId, ItemStatus from, ItemStatus to) {
        ItemEntity item = itemRepository.findById(itemId).orElse(null);
        if (item == null) {
            log.warn("Item {} not found, cannot set status {}", itemId, to);
            return false;
        }
        if (item.getStatus() == to) {
            log.debug("Item {} already {}", itemId, to);
            return true;
        }
        if (!item.transition(from, to)) {
            log.warn("Item {} is {}, expected {} before moving to {}", itemId, item.getStatus(), from, to);
            return false;
        }
        itemRepository.save(item);
        log.info("Item {} moved from {} to {}", itemId, from, to);
        return true;
    }
}
