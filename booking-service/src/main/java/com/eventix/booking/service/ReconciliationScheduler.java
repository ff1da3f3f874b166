package com.eventix.booking.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs inventory reconciliation every 5 minutes on one instance at a time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationScheduler {

    private static final String LOCK_KEY = "lock:inventory-reconciliation";
    private static final long LOCK_LEASE_SECONDS = 240;

    private final InventoryReconciliationService reconciliationService;
    private final RedissonClient redissonClient;

    @Scheduled(fixedRate = 300_000, initialDelay = 60_000)
    public void runReconciliation() {
        RLock lock = redissonClient.getLock(LOCK_KEY);

        boolean acquired;
        try {
            acquired = lock.tryLock(0, LOCK_LEASE_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }

        if (!acquired) {
            log.debug("RECONCILE: Another instance is reconciling, skipping");
            return;
        }

        try {
            int ticketTypeDrifts = reconciliationService.detectTicketTypeDrift();
            int eventSeatDrifts = reconciliationService.detectEventSeatDrift();
            log.info("RECONCILE: Completed - results={}", Map.of(
                    "ticketTypeDrifts", ticketTypeDrifts,
                    "eventSeatDrifts", eventSeatDrifts));
        } catch (Exception e) {
            log.error("RECONCILE: Failed to complete reconciliation", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
