package com.dinoventures.economy.controller;

import com.dinoventures.economy.audit.AuditService;
import com.dinoventures.economy.model.Account;
import com.dinoventures.economy.model.AuditEvent;
import com.dinoventures.economy.model.ExchangeResult;
import com.dinoventures.economy.model.dto.BalanceResponse;
import com.dinoventures.economy.model.dto.ExchangeRequest;
import com.dinoventures.economy.model.dto.SupplyRequest;
import com.dinoventures.economy.model.dto.TransferRequest;
import com.dinoventures.economy.model.dto.TransferResponse;
import com.dinoventures.economy.model.dto.UserBalancesResponse;
import com.dinoventures.economy.service.IdentityResolver;
import com.dinoventures.economy.service.LedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Balance-moving endpoints. Callers identify users by their chat-platform id; accounts
 * are created on first use.
 */
@RestController
@RequiredArgsConstructor
public class EconomyController {

    private final IdentityResolver identityResolver;
    private final LedgerService    ledgerService;
    private final AuditService     auditService;

    /**
     * POST /api/v1/economy/mint
     */
    @PostMapping("/api/v1/economy/mint")
    public ResponseEntity<BalanceResponse> mint(@Valid @RequestBody SupplyRequest req) {
        Account account = identityResolver.resolveAccount(req.getUserId());
        long balance = ledgerService.mint(account.getId(), req.getCurrencyId(), req.getAmount());
        return ResponseEntity.ok(new BalanceResponse(account.getId(), req.getCurrencyId(), balance));
    }

    /**
     * POST /api/v1/economy/burn
     * Returns 422 if the user holds less than the amount.
     */
    @PostMapping("/api/v1/economy/burn")
    public ResponseEntity<BalanceResponse> burn(@Valid @RequestBody SupplyRequest req) {
        Account account = identityResolver.resolveAccount(req.getUserId());
        long balance = ledgerService.burn(account.getId(), req.getCurrencyId(), req.getAmount());
        return ResponseEntity.ok(new BalanceResponse(account.getId(), req.getCurrencyId(), balance));
    }

    /**
     * POST /api/v1/economy/transfer
     * Returns 422 for a self-transfer or when the sender holds less than the amount.
     */
    @PostMapping("/api/v1/economy/transfer")
    public ResponseEntity<TransferResponse> transfer(@Valid @RequestBody TransferRequest req) {
        Account from = identityResolver.resolveAccount(req.getFromUserId());
        Account to   = identityResolver.resolveAccount(req.getToUserId());

        ledgerService.transfer(from.getId(), to.getId(), req.getCurrencyId(), req.getAmount());

        return ResponseEntity.ok(new TransferResponse(
                from.getId(), to.getId(), req.getCurrencyId(), req.getAmount(),
                ledgerService.balanceOf(from.getId(), req.getCurrencyId()),
                ledgerService.balanceOf(to.getId(), req.getCurrencyId())));
    }

    /**
     * POST /api/v1/economy/exchange
     * Returns 422 when no rate is configured for the direction asked.
     */
    @PostMapping("/api/v1/economy/exchange")
    public ResponseEntity<ExchangeResult> exchange(@Valid @RequestBody ExchangeRequest req) {
        Account account = identityResolver.resolveAccount(req.getUserId());
        ExchangeResult result = ledgerService.exchange(
                account.getId(), req.getFromCurrencyId(), req.getToCurrencyId(), req.getAmount());
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/users/{externalId}/balances
     * A user never seen before has no wallets; the list is empty.
     */
    @GetMapping("/api/v1/users/{externalId}/balances")
    public ResponseEntity<UserBalancesResponse> balances(@PathVariable String externalId) {
        Optional<Account> account = identityResolver.findAccount(externalId);
        if (account.isEmpty()) {
            return ResponseEntity.ok(new UserBalancesResponse(externalId, null, List.of()));
        }
        long accountId = account.get().getId();
        List<BalanceResponse> balances = ledgerService.balanceOf(accountId).entrySet().stream()
                .map(e -> new BalanceResponse(accountId, e.getKey(), e.getValue()))
                .toList();
        return ResponseEntity.ok(new UserBalancesResponse(externalId, accountId, balances));
    }

    /**
     * GET /api/v1/users/{externalId}/audit?limit=50
     * Flushed audit events where the user is actor or counterpart, newest first.
     */
    @GetMapping("/api/v1/users/{externalId}/audit")
    public ResponseEntity<List<AuditEvent>> audit(@PathVariable String externalId,
                                                  @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return ResponseEntity.ok(identityResolver.findAccount(externalId)
                .map(account -> auditService.recentEvents(account.getId(), limit))
                .orElse(List.of()));
    }
}
