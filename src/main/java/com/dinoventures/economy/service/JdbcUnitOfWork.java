package com.dinoventures.economy.service;

import com.dinoventures.economy.exception.EconomyException;
import com.dinoventures.economy.exception.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * {@link UnitOfWork} over a JDBC transaction (READ COMMITTED, PROPAGATION_REQUIRED).
 *
 * Domain failures pass through untouched after rollback. Storage failures of any kind
 * are reported as {@link StorageUnavailableException}; the transaction has been rolled
 * back by the time the caller sees it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcUnitOfWork implements UnitOfWork {

    private final TransactionTemplate transactionTemplate;

    @Override
    public <T> T execute(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (EconomyException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure, unit of work rolled back: {}", e.getMessage());
            throw new StorageUnavailableException(e);
        }
    }
}
