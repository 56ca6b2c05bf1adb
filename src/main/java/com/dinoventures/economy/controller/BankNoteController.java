package com.dinoventures.economy.controller;

import com.dinoventures.economy.model.Account;
import com.dinoventures.economy.model.BankNote;
import com.dinoventures.economy.model.IssuedNote;
import com.dinoventures.economy.model.RedeemedNote;
import com.dinoventures.economy.model.dto.IssueNoteRequest;
import com.dinoventures.economy.model.dto.RedeemNoteRequest;
import com.dinoventures.economy.service.BankNoteService;
import com.dinoventures.economy.service.IdentityResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/notes")
@RequiredArgsConstructor
public class BankNoteController {

    private final BankNoteService  bankNoteService;
    private final IdentityResolver identityResolver;

    /**
     * POST /api/v1/notes
     * Debits the issuer now and returns the signed token the recipient redeems later.
     */
    @PostMapping
    public ResponseEntity<IssuedNote> issue(@Valid @RequestBody IssueNoteRequest req) {
        Account issuer = identityResolver.resolveAccount(req.getIssuerUserId());
        IssuedNote note = bankNoteService.issue(
                issuer.getId(), req.getRecipientUserId(), req.getCurrencyId(), req.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(note);
    }

    /**
     * POST /api/v1/notes/redeem
     *
     * 400 bad token, 403 wrong recipient, 409 already redeemed.
     */
    @PostMapping("/redeem")
    public ResponseEntity<RedeemedNote> redeem(@Valid @RequestBody RedeemNoteRequest req) {
        return ResponseEntity.ok(bankNoteService.redeem(req.getUserId(), req.getToken()));
    }

    @GetMapping("/{noteId}")
    public ResponseEntity<BankNote> get(@PathVariable UUID noteId) {
        return ResponseEntity.ok(bankNoteService.note(noteId));
    }
}
