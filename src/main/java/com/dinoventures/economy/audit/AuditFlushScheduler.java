package com.dinoventures.economy.audit;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives {@link AuditQueue#flush(int)} on a fixed delay. Disabled in tests, which flush
 * by hand.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "economy.audit.flush.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AuditFlushScheduler {

    private final AuditQueue auditQueue;

    @Value("${economy.audit.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${economy.audit.flush.interval-ms:5000}")
    public void flushPending() {
        auditQueue.flush(batchSize);
    }

    @PreDestroy
    public void drainOnShutdown() {
        int pending = auditQueue.size();
        if (pending == 0) {
            return;
        }
        int written = auditQueue.drain(batchSize);
        log.info("Audit queue drained on shutdown: {} of {} events written", written, pending);
    }
}
