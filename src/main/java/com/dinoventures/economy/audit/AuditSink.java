package com.dinoventures.economy.audit;

import com.dinoventures.economy.model.AuditEvent;

import java.util.List;

/**
 * Durable destination for audit events. A batch is written all-or-nothing from the
 * caller's point of view: returning normally means every event is stored, throwing
 * means the whole batch must be retried. Re-delivery of an already stored event must
 * be harmless.
 */
public interface AuditSink {

    void writeBatch(List<AuditEvent> batch);
}
