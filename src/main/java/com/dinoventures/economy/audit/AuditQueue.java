package com.dinoventures.economy.audit;

import com.dinoventures.economy.model.AuditEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory staging buffer between event producers and the {@link AuditSink}.
 *
 * Producers append under a short monitor hold and never wait on storage. The sink
 * write happens outside the monitor, so enqueue stays fast while a flush is in
 * progress. Only one flush runs at a time.
 *
 * A batch that fails to write is put back at the head of the buffer in its original
 * order and picked up again by the next flush.
 */
@Component
@Slf4j
public class AuditQueue {

    private final Deque<AuditEvent> buffer = new ArrayDeque<>();
    private final Object monitor = new Object();
    private final AtomicBoolean flushing = new AtomicBoolean(false);

    private final AuditSink     sink;
    private final AlertNotifier alertNotifier;
    private final Counter       flushedCounter;
    private final Counter       failureCounter;

    public AuditQueue(AuditSink sink, AlertNotifier alertNotifier, MeterRegistry meterRegistry) {
        this.sink = sink;
        this.alertNotifier = alertNotifier;

        Gauge.builder("economy.audit.backlog", this, AuditQueue::size)
                .description("Audit events buffered and not yet written")
                .register(meterRegistry);
        this.flushedCounter = Counter.builder("economy.audit.flushed")
                .description("Audit events written to the sink")
                .register(meterRegistry);
        this.failureCounter = Counter.builder("economy.audit.flush.failures")
                .description("Audit batches that failed to write and were re-queued")
                .register(meterRegistry);
    }

    public void enqueue(AuditEvent event) {
        synchronized (monitor) {
            buffer.addLast(event);
        }
    }

    /**
     * Removes up to {@code maxBatchSize} of the oldest events and writes them to the sink.
     *
     * @return number of events written; 0 if the buffer was empty, the write failed,
     *         or another flush was already running
     */
    public int flush(int maxBatchSize) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be at least 1, got " + maxBatchSize);
        }
        if (!flushing.compareAndSet(false, true)) {
            log.debug("Audit flush already in progress, skipping");
            return 0;
        }
        try {
            List<AuditEvent> batch;
            int backlog;
            synchronized (monitor) {
                backlog = buffer.size();
                batch = new ArrayList<>(Math.min(backlog, maxBatchSize));
                while (batch.size() < maxBatchSize && !buffer.isEmpty()) {
                    batch.add(buffer.pollFirst());
                }
            }

            if (backlog > maxBatchSize) {
                alertNotifier.backlogExceeded(backlog, maxBatchSize);
            }
            if (batch.isEmpty()) {
                return 0;
            }

            try {
                sink.writeBatch(batch);
            } catch (RuntimeException e) {
                requeueAtHead(batch);
                failureCounter.increment();
                log.warn("Audit batch of {} events failed to write, re-queued", batch.size(), e);
                alertNotifier.flushFailed(batch.size(), e);
                return 0;
            }

            flushedCounter.increment(batch.size());
            log.debug("Flushed {} audit events, {} remaining", batch.size(), size());
            return batch.size();
        } finally {
            flushing.set(false);
        }
    }

    /**
     * Flushes until the buffer is empty or a write fails.
     *
     * @return total number of events written
     */
    public int drain(int maxBatchSize) {
        int total = 0;
        int written;
        do {
            written = flush(maxBatchSize);
            total += written;
        } while (written > 0 && size() > 0);
        return total;
    }

    public int size() {
        synchronized (monitor) {
            return buffer.size();
        }
    }

    private void requeueAtHead(List<AuditEvent> batch) {
        synchronized (monitor) {
            for (int i = batch.size() - 1; i >= 0; i--) {
                buffer.addFirst(batch.get(i));
            }
        }
    }
}
