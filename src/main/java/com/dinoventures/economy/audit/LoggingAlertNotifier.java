package com.dinoventures.economy.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingAlertNotifier implements AlertNotifier {

    @Override
    public void backlogExceeded(int backlog, int batchSize) {
        log.warn("ALERT audit backlog is growing: {} events buffered, flush batch size is {}", backlog, batchSize);
    }

    @Override
    public void flushFailed(int batchSize, Throwable cause) {
        log.warn("ALERT audit flush failed, {} events re-queued: {}", batchSize, cause.getMessage());
    }
}
