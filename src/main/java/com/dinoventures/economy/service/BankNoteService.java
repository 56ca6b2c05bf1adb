package com.dinoventures.economy.service;

import com.dinoventures.economy.audit.AuditQueue;
import com.dinoventures.economy.exception.AlreadyConsumedException;
import com.dinoventures.economy.exception.BankNoteNotFoundException;
import com.dinoventures.economy.exception.InvalidSignatureException;
import com.dinoventures.economy.exception.RecipientMismatchException;
import com.dinoventures.economy.model.Account;
import com.dinoventures.economy.model.AuditEvent;
import com.dinoventures.economy.model.AuditEventKind;
import com.dinoventures.economy.model.BankNote;
import com.dinoventures.economy.model.IssuedNote;
import com.dinoventures.economy.model.NoteClaims;
import com.dinoventures.economy.model.RedeemedNote;
import com.dinoventures.economy.repository.BankNoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Issues and redeems recipient-bound bearer notes.
 *
 * A note moves Issued → Consumed exactly once. The issuer is debited at issuance, so
 * the value is out of circulation until redemption credits the recipient.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BankNoteService {

    private final BankNoteRepository noteRepo;
    private final BankNoteSigner     signer;
    private final LedgerService      ledgerService;
    private final CurrencyRegistry   currencyRegistry;
    private final IdentityResolver   identityResolver;
    private final AuditQueue         auditQueue;
    private final UnitOfWork         unitOfWork;

    /**
     * Debits the issuer and records a new note in one unit of work, then returns the
     * signed token for it.
     *
     * @throws com.dinoventures.economy.exception.InsufficientBalanceException if the
     *         issuer holds less than {@code amount}
     */
    public IssuedNote issue(long issuerAccountId, String recipientExternalId, long currencyId, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be greater than zero, got " + amount);
        }
        if (recipientExternalId == null || recipientExternalId.isBlank()) {
            throw new IllegalArgumentException("Recipient must not be blank");
        }

        BankNote note = unitOfWork.execute(() -> {
            currencyRegistry.requireCurrency(currencyId);
            identityResolver.requireAccount(issuerAccountId);
            Account recipient = identityResolver.resolveAccount(recipientExternalId);

            ledgerService.withdraw(issuerAccountId, currencyId, amount);

            BankNote created = BankNote.builder()
                    .id(UUID.randomUUID())
                    .currencyId(currencyId)
                    .amount(amount)
                    .issuerAccountId(issuerAccountId)
                    .recipientAccountId(recipient.getId())
                    .recipientExternalId(recipientExternalId)
                    .build();
            noteRepo.insert(created);
            return created;
        });

        String token = signer.sign(new NoteClaims(note.getId(), currencyId, amount, recipientExternalId));

        auditQueue.enqueue(AuditEvent.of(AuditEventKind.NOTE_ISSUE,
                issuerAccountId, note.getRecipientAccountId(), currencyId, amount));
        log.info("Issued bank note: id={}, issuer={}, recipient={}, currency={}, amount={}",
                note.getId(), issuerAccountId, recipientExternalId, currencyId, amount);

        return new IssuedNote(note.getId(), currencyId, amount, recipientExternalId, token);
    }

    /**
     * Redeems a note for the user it was issued to.
     *
     * Checks run in order: signature, recipient, consumption. The consumed flag is
     * flipped by a conditional UPDATE in the same unit of work as the credit, so of
     * any number of concurrent attempts at most one commits.
     *
     * @throws InvalidSignatureException  if the token was not signed with our secret or was altered
     * @throws RecipientMismatchException if the token names a different recipient
     * @throws AlreadyConsumedException   if the note was redeemed before
     */
    public RedeemedNote redeem(String redeemerExternalId, String token) {
        NoteClaims claims = signer.verify(token);
        if (!claims.getRecipientExternalId().equals(redeemerExternalId)) {
            log.warn("Bank note {} presented by {} but addressed to {}",
                    claims.getNoteId(), redeemerExternalId, claims.getRecipientExternalId());
            throw new RecipientMismatchException(redeemerExternalId);
        }

        RedeemedNote redeemed = unitOfWork.execute(() -> {
            BankNote note = noteRepo.findById(claims.getNoteId())
                    .orElseThrow(() -> new BankNoteNotFoundException(claims.getNoteId()));
            if (note.getAmount() != claims.getAmount() || note.getCurrencyId() != claims.getCurrencyId()) {
                throw new InvalidSignatureException("Bank note token does not match note " + note.getId(), null);
            }
            if (!note.getRecipientExternalId().equals(redeemerExternalId)) {
                throw new RecipientMismatchException(redeemerExternalId);
            }

            if (noteRepo.markConsumed(note.getId()) == 0) {
                throw new AlreadyConsumedException(note.getId());
            }

            Account redeemer = identityResolver.resolveAccount(redeemerExternalId);
            ledgerService.deposit(redeemer.getId(), note.getCurrencyId(), note.getAmount());
            return new RedeemedNote(note.getId(), redeemer.getId(), note.getIssuerAccountId(),
                    note.getCurrencyId(), note.getAmount());
        });

        auditQueue.enqueue(AuditEvent.of(AuditEventKind.NOTE_REDEEM,
                redeemed.getAccountId(), redeemed.getIssuerAccountId(), redeemed.getCurrencyId(), redeemed.getCredited()));
        log.info("Redeemed bank note: id={}, account={}, currency={}, amount={}",
                redeemed.getNoteId(), redeemed.getAccountId(), redeemed.getCurrencyId(), redeemed.getCredited());
        return redeemed;
    }

    public BankNote note(UUID noteId) {
        return noteRepo.findById(noteId).orElseThrow(() -> new BankNoteNotFoundException(noteId));
    }
}
