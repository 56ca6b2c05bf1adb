package com.dinoventures.economy.service;

import com.dinoventures.economy.exception.InvalidSignatureException;
import com.dinoventures.economy.model.NoteClaims;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.UUID;

/**
 * Encodes and verifies bank-note tokens.
 *
 * A token is a compact HS256 JWT: base64url(header) "." base64url(payload) "." signature,
 * with header {@code {"typ":"JWT","alg":"HS256"}} and payload
 * {@code {"jti", "currencyId", "amount", "recipientId", "iat"}}. The signature is an
 * HMAC-SHA256 over the first two segments keyed with the process-wide secret.
 *
 * Verification only proves the token was minted here and not altered. Whether the note
 * is still redeemable is decided by server-side state in {@link BankNoteService}.
 */
@Component
@Slf4j
public class BankNoteSigner {

    static final String CLAIM_CURRENCY  = "currencyId";
    static final String CLAIM_AMOUNT    = "amount";
    static final String CLAIM_RECIPIENT = "recipientId";

    private static final int MIN_SECRET_BYTES = 32;

    private final Key key;

    public BankNoteSigner(@Value("${economy.bank-note.secret}") String secret) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "economy.bank-note.secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public String sign(NoteClaims claims) {
        return Jwts.builder()
                .setHeaderParam("typ", "JWT")
                .setId(claims.getNoteId().toString())
                .claim(CLAIM_CURRENCY, claims.getCurrencyId())
                .claim(CLAIM_AMOUNT, claims.getAmount())
                .claim(CLAIM_RECIPIENT, claims.getRecipientExternalId())
                .setIssuedAt(new Date())
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * @throws InvalidSignatureException if the signature does not match, a segment
     *         cannot be decoded, or a required claim is missing
     */
    public NoteClaims verify(String token) {
        try {
            Claims body = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();

            return new NoteClaims(
                    UUID.fromString(requireClaim(body.getId(), "jti")),
                    requireNumber(body, CLAIM_CURRENCY),
                    requireNumber(body, CLAIM_AMOUNT),
                    requireClaim(body.get(CLAIM_RECIPIENT, String.class), CLAIM_RECIPIENT));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Bank note token rejected: {}", e.getMessage());
            throw new InvalidSignatureException("Bank note token failed verification", e);
        }
    }

    private static long requireNumber(Claims body, String name) {
        Object value = body.get(name);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Missing numeric claim '" + name + "'");
        }
        return ((Number) value).longValue();
    }

    private static String requireClaim(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing claim '" + name + "'");
        }
        return value;
    }
}
