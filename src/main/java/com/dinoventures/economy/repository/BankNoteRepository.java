package com.dinoventures.economy.repository;

import com.dinoventures.economy.model.BankNote;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class BankNoteRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final RowMapper<BankNote> ROW_MAPPER = (rs, rowNum) -> BankNote.builder()
            .id(rs.getObject("id", UUID.class))
            .currencyId(rs.getLong("currency_id"))
            .amount(rs.getLong("amount"))
            .issuerAccountId(rs.getLong("issuer_account_id"))
            .recipientAccountId(rs.getLong("recipient_account_id"))
            .recipientExternalId(rs.getString("recipient_external_id"))
            .consumed(rs.getBoolean("consumed"))
            .issuedAt(rs.getObject("issued_at", OffsetDateTime.class))
            .consumedAt(rs.getObject("consumed_at", OffsetDateTime.class))
            .build();

    /** Must be called within the transaction that debits the issuer. */
    public void insert(BankNote note) {
        namedJdbc.update(
                "INSERT INTO bank_notes (id, currency_id, amount, issuer_account_id, " +
                "                        recipient_account_id, recipient_external_id) " +
                "VALUES (:id, :currencyId, :amount, :issuerAccountId, :recipientAccountId, :recipientExternalId)",
                new MapSqlParameterSource()
                        .addValue("id", note.getId())
                        .addValue("currencyId", note.getCurrencyId())
                        .addValue("amount", note.getAmount())
                        .addValue("issuerAccountId", note.getIssuerAccountId())
                        .addValue("recipientAccountId", note.getRecipientAccountId())
                        .addValue("recipientExternalId", note.getRecipientExternalId())
        );
    }

    public Optional<BankNote> findById(UUID id) {
        List<BankNote> results = namedJdbc.query(
                "SELECT id, currency_id, amount, issuer_account_id, recipient_account_id, " +
                "       recipient_external_id, consumed, issued_at, consumed_at " +
                "FROM bank_notes WHERE id = :id",
                new MapSqlParameterSource("id", id),
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    /**
     * Compare-and-set Issued → Consumed.
     *
     * Returns 1 for the single caller that wins the flip and 0 for everyone else.
     * A concurrent redeemer blocks on the row lock taken by the winner's UPDATE and,
     * once the winner commits, re-evaluates {@code consumed = FALSE} and matches nothing.
     *
     * Must be called within the transaction that credits the redeemer.
     */
    public int markConsumed(UUID id) {
        return namedJdbc.update(
                "UPDATE bank_notes SET consumed = TRUE, consumed_at = now() " +
                "WHERE id = :id AND consumed = FALSE",
                new MapSqlParameterSource("id", id)
        );
    }
}
