package com.dinoventures.economy.audit;

import com.dinoventures.economy.model.AuditEvent;
import com.dinoventures.economy.repository.AuditEventRepository;
import com.dinoventures.economy.service.UnitOfWork;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes audit batches to the {@code audit_events} table in a single transaction.
 * Duplicates are dropped by the unique {@code event_id}.
 */
@Component
@RequiredArgsConstructor
public class JdbcAuditSink implements AuditSink {

    private final AuditEventRepository auditRepo;
    private final UnitOfWork           unitOfWork;

    @Override
    public void writeBatch(List<AuditEvent> batch) {
        unitOfWork.run(() -> auditRepo.insertAll(batch));
    }
}
