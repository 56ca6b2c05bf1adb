package com.dinoventures.economy.service;

import com.dinoventures.economy.audit.AuditQueue;
import com.dinoventures.economy.exception.InsufficientBalanceException;
import com.dinoventures.economy.exception.RateNotFoundException;
import com.dinoventures.economy.exception.SelfTransferException;
import com.dinoventures.economy.model.AuditEvent;
import com.dinoventures.economy.model.AuditEventKind;
import com.dinoventures.economy.model.Currency;
import com.dinoventures.economy.model.ExchangeResult;
import com.dinoventures.economy.model.Wallet;
import com.dinoventures.economy.repository.WalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Sole owner of wallet balances.
 *
 * Every operation runs as one {@link UnitOfWork}:
 *   1. Validate the request (amount, self-transfer, currency, account)
 *   2. Get-or-create the wallets it touches (INSERT ... ON CONFLICT DO NOTHING)
 *   3. Lock those wallets in ascending id order (deadlock prevention)
 *   4. Check balances under the lock
 *   5. Apply the deltas
 *   6. Commit, then enqueue the audit event
 *
 * A failure at any step rolls back everything the operation wrote, including wallets
 * it created. Audit events are enqueued only for committed operations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final WalletRepository walletRepo;
    private final CurrencyRegistry currencyRegistry;
    private final IdentityResolver identityResolver;
    private final ExchangeEngine   exchangeEngine;
    private final AuditQueue       auditQueue;
    private final UnitOfWork       unitOfWork;

    // =========================================================================
    // MUTATIONS
    // =========================================================================

    /**
     * Creates value: credits the account's wallet, creating the wallet if absent.
     * The account itself must already exist; callers holding an external user id go
     * through {@link IdentityResolver#resolveAccount} first.
     *
     * @throws com.dinoventures.economy.exception.AccountNotFoundException if no account has this id
     * @return the wallet balance after the mint
     */
    public long mint(long accountId, long currencyId, long amount) {
        requirePositive(amount);
        long balance = unitOfWork.execute(() -> {
            currencyRegistry.requireCurrency(currencyId);
            identityResolver.requireAccount(accountId);
            return applyDelta(accountId, currencyId, amount);
        });

        auditQueue.enqueue(AuditEvent.of(AuditEventKind.MINT, accountId, null, currencyId, amount));
        log.info("Minted: account={}, currency={}, amount={}, balance={}", accountId, currencyId, amount, balance);
        return balance;
    }

    /**
     * Destroys value held by the account.
     *
     * @return the wallet balance after the burn
     * @throws InsufficientBalanceException if the wallet holds less than {@code amount}
     */
    public long burn(long accountId, long currencyId, long amount) {
        requirePositive(amount);
        long balance = unitOfWork.execute(() -> {
            currencyRegistry.requireCurrency(currencyId);
            identityResolver.requireAccount(accountId);
            return applyDelta(accountId, currencyId, -amount);
        });

        auditQueue.enqueue(AuditEvent.of(AuditEventKind.BURN, accountId, null, currencyId, amount));
        log.info("Burned: account={}, currency={}, amount={}, balance={}", accountId, currencyId, amount, balance);
        return balance;
    }

    /**
     * Moves value between two accounts in one currency. The debit and the credit
     * commit together or not at all.
     */
    public void transfer(long fromAccountId, long toAccountId, long currencyId, long amount) {
        requirePositive(amount);
        if (fromAccountId == toAccountId) {
            throw new SelfTransferException(fromAccountId);
        }

        unitOfWork.run(() -> {
            currencyRegistry.requireCurrency(currencyId);
            identityResolver.requireAccount(fromAccountId);
            identityResolver.requireAccount(toAccountId);

            Wallet sender   = walletRepo.getOrCreate(fromAccountId, currencyId);
            Wallet receiver = walletRepo.getOrCreate(toAccountId, currencyId);
            Map<Long, Long> balances = lockInOrder(sender.getId(), receiver.getId());

            long available = balances.get(sender.getId());
            if (available < amount) {
                throw new InsufficientBalanceException(fromAccountId, currencyId, available, amount);
            }
            requireNoOverflow(balances.get(receiver.getId()), amount);

            walletRepo.adjustBalance(sender.getId(),   -amount);
            walletRepo.adjustBalance(receiver.getId(), +amount);
        });

        auditQueue.enqueue(AuditEvent.of(AuditEventKind.TRANSFER, fromAccountId, toAccountId, currencyId, amount));
        log.info("Transferred: from={}, to={}, currency={}, amount={}", fromAccountId, toAccountId, currencyId, amount);
    }

    /**
     * Converts {@code amount} of one currency into another of the same group at the
     * configured directional rate. The destination is credited
     * {@code floor(amount * rate)}; the fractional remainder is not credited to anyone.
     */
    public ExchangeResult exchange(long accountId, long fromCurrencyId, long toCurrencyId, long amount) {
        requirePositive(amount);

        ExchangeResult result = unitOfWork.execute(() -> {
            identityResolver.requireAccount(accountId);
            Currency from = currencyRegistry.requireCurrency(fromCurrencyId);
            currencyRegistry.requireCurrency(toCurrencyId);

            BigDecimal rate = exchangeEngine.rateFor(from.getGroupId(), fromCurrencyId, toCurrencyId)
                    .orElseThrow(() -> new RateNotFoundException(fromCurrencyId, toCurrencyId));
            long credit = ExchangeEngine.convertFloor(amount, rate);

            Wallet source      = walletRepo.getOrCreate(accountId, fromCurrencyId);
            Wallet destination = walletRepo.getOrCreate(accountId, toCurrencyId);
            Map<Long, Long> balances = lockInOrder(source.getId(), destination.getId());

            long available = balances.get(source.getId());
            if (available < amount) {
                throw new InsufficientBalanceException(accountId, fromCurrencyId, available, amount);
            }
            requireNoOverflow(balances.get(destination.getId()), credit);

            walletRepo.adjustBalance(source.getId(), -amount);
            if (credit > 0) {
                walletRepo.adjustBalance(destination.getId(), credit);
            }
            return new ExchangeResult(accountId, fromCurrencyId, toCurrencyId, amount, credit, rate);
        });

        auditQueue.enqueue(AuditEvent.exchange(accountId, fromCurrencyId, amount, toCurrencyId, result.getCredited()));
        log.info("Exchanged: account={}, {} x{} -> {} x{} (rate {})",
                accountId, fromCurrencyId, amount, toCurrencyId, result.getCredited(), result.getRate().toPlainString());
        return result;
    }

    // =========================================================================
    // PRIMITIVES FOR BANK NOTES
    // Both join the caller's unit of work; auditing is the caller's job.
    // =========================================================================

    long withdraw(long accountId, long currencyId, long amount) {
        requirePositive(amount);
        return unitOfWork.execute(() -> applyDelta(accountId, currencyId, -amount));
    }

    long deposit(long accountId, long currencyId, long amount) {
        requirePositive(amount);
        return unitOfWork.execute(() -> applyDelta(accountId, currencyId, amount));
    }

    // =========================================================================
    // QUERIES
    // =========================================================================

    /**
     * Snapshot of every wallet the account holds, keyed by currency id. Currencies
     * without a wallet row are absent and mean a balance of 0.
     */
    public Map<Long, Long> balanceOf(long accountId) {
        identityResolver.requireAccount(accountId);
        Map<Long, Long> balances = new LinkedHashMap<>();
        for (Wallet wallet : walletRepo.findByAccount(accountId)) {
            balances.put(wallet.getCurrencyId(), wallet.getBalance());
        }
        return balances;
    }

    public long balanceOf(long accountId, long currencyId) {
        return walletRepo.getBalance(accountId, currencyId);
    }

    public long totalSupply(long currencyId) {
        currencyRegistry.requireCurrency(currencyId);
        return walletRepo.totalSupply(currencyId);
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    /**
     * Single-wallet change under lock. Must run inside a unit of work.
     */
    private long applyDelta(long accountId, long currencyId, long delta) {
        Wallet wallet = walletRepo.getOrCreate(accountId, currencyId);
        long balance = walletRepo.lockForUpdate(List.of(wallet.getId())).get(wallet.getId());

        if (delta < 0 && balance < -delta) {
            throw new InsufficientBalanceException(accountId, currencyId, balance, -delta);
        }
        if (delta > 0) {
            requireNoOverflow(balance, delta);
        }
        walletRepo.adjustBalance(wallet.getId(), delta);
        return balance + delta;
    }

    private Map<Long, Long> lockInOrder(long walletA, long walletB) {
        List<Long> sortedIds = Stream.of(walletA, walletB)
                .distinct()
                .sorted()
                .toList();
        return walletRepo.lockForUpdate(sortedIds);
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be greater than zero, got " + amount);
        }
    }

    private static void requireNoOverflow(long balance, long credit) {
        if (credit > Long.MAX_VALUE - balance) {
            throw new IllegalArgumentException("Credit of " + credit + " would overflow wallet balance " + balance);
        }
    }
}
