package com.dinoventures.economy.service;

import java.util.function.Supplier;

/**
 * Commit-all-or-revert-all boundary for multi-record mutations.
 *
 * Everything the supplied work writes becomes visible together when it returns, or
 * not at all when it throws. Calls nested inside a running unit join it rather than
 * opening a second one, so a service can compose another service's mutation into its
 * own atomic step.
 */
public interface UnitOfWork {

    <T> T execute(Supplier<T> work);

    default void run(Runnable work) {
        execute(() -> {
            work.run();
            return null;
        });
    }
}
