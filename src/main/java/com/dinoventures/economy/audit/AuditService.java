package com.dinoventures.economy.audit;

import com.dinoventures.economy.model.AuditEvent;
import com.dinoventures.economy.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the audit trail. Only events already flushed are visible.
 */
@Service
@RequiredArgsConstructor
public class AuditService {

    static final int MAX_LIMIT = 200;

    private final AuditEventRepository auditRepo;

    public List<AuditEvent> recentEvents(long accountId, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return auditRepo.findByAccount(accountId, bounded);
    }
}
