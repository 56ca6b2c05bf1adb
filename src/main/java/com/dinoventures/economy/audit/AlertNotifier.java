package com.dinoventures.economy.audit;

/**
 * Operator alert channel. The chat platform integration supplies the real delivery;
 * by default alerts go to the log.
 */
public interface AlertNotifier {

    /**
     * The buffer held more events than one flush can drain.
     */
    void backlogExceeded(int backlog, int batchSize);

    void flushFailed(int batchSize, Throwable cause);
}
