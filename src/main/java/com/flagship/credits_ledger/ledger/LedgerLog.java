package com.flagship.credits_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credits_ledger.event.LedgerEntryRecordedEvent;
import com.flagship.credits_ledger.exception.CreditsValidationException;
import com.flagship.credits_ledger.exception.WalletFrozenException;
import com.flagship.credits_ledger.exception.WalletNotFoundException;
import com.flagship.credits_ledger.observability.CreditMetrics;
import com.flagship.credits_ledger.outbox.OutboxService;
import com.flagship.credits_ledger.wallet.Wallet;
import com.flagship.credits_ledger.wallet.WalletDirectory;
import com.flagship.credits_ledger.observability.MdcScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only, idempotent ledger of credit and debit entries.
 *
 * Idempotency is enforced by the unique constraint on {@code (wallet_id, idempotency_key)}:
 * the insert is {@code ON CONFLICT DO NOTHING}, and when it writes nothing the id stored
 * under the key is returned instead. Entries are never updated or deleted; a database
 * trigger rejects both.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerLog {

    private static final String ENTRY_COLUMNS =
        "id, organization_id, wallet_id, direction, amount, reason, reference, idempotency_key, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final WalletDirectory walletDirectory;
    private final OutboxService outboxService;
    private final CreditMetrics metrics;
    private final ObjectMapper objectMapper;

    /**
     * Records one credit or debit against a wallet.
     *
     * Debits take the wallet row lock so they serialize with hold creation and are refused
     * while the wallet is frozen. Debits are not checked against the available balance.
     * Capture entries are only written by hold capture and are rejected here.
     *
     * @return the entry id; {@code created} is false when the key had already been used
     * @throws CreditsValidationException if the request is malformed
     * @throws WalletNotFoundException if the wallet does not exist in the organization
     * @throws WalletFrozenException if a new debit targets a frozen wallet
     */
    @Transactional
    public RecordedEntry insertLedgerEntry(String organizationId, UUID walletId, EntryDirection direction,
                                           long amount, LedgerReason reason, EntryReference reference,
                                           String idempotencyKey) {
        LedgerEntryRequest request = LedgerEntryRequest.of(
            organizationId, walletId, direction, amount, reason, reference, idempotencyKey);
        if (request.getReason() == LedgerReason.CAPTURE) {
            throw new CreditsValidationException("Capture entries are written by hold capture only");
        }

        MdcScope walletScope = MdcScope.put("walletId", walletId);
        try {
            if (request.getDirection() == EntryDirection.DEBIT) {
                Wallet wallet = walletDirectory.lockWallet(organizationId, walletId);
                if (wallet.isFrozen()) {
                    Optional<LedgerEntry> existing = findEntryByKey(walletId, idempotencyKey);
                    if (existing.isPresent()) {
                        log.debug("Replayed debit on frozen wallet: entryId={}, key={}",
                                existing.get().getId(), idempotencyKey);
                        metrics.recordLedgerEntry(direction.name(), reason.name(), false);
                        return RecordedEntry.replayed(existing.get().getId());
                    }
                    metrics.recordConflict("wallet_frozen");
                    throw new WalletFrozenException(walletId);
                }
            } else if (walletDirectory.findWallet(organizationId, walletId).isEmpty()) {
                throw new WalletNotFoundException(walletId);
            }

            return append(request);
        } finally {
            walletScope.close();
        }
    }

    /**
     * Writes a validated entry inside the caller's transaction. The caller owns any locking
     * and status checks. A new entry also writes its {@code LedgerEntryRecorded} event.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public RecordedEntry append(LedgerEntryRequest request) {
        Instant now = Instant.now();
        UUID entryId = UUID.randomUUID();

        List<UUID> inserted = jdbcTemplate.query(
            "INSERT INTO credit_ledger_entries (" + ENTRY_COLUMNS + ") " +
            "VALUES (?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?) " +
            "ON CONFLICT (wallet_id, idempotency_key) DO NOTHING " +
            "RETURNING id",
            (rs, rowNum) -> rs.getObject("id", UUID.class),
            entryId,
            request.getOrganizationId(),
            request.getWalletId(),
            request.getDirection().name(),
            request.getAmount(),
            request.getReason().name(),
            writeReference(request.getReference()),
            request.getIdempotencyKey(),
            Timestamp.from(now)
        );

        if (inserted.isEmpty()) {
            UUID existingId = jdbcTemplate.queryForObject(
                "SELECT id FROM credit_ledger_entries WHERE wallet_id = ? AND idempotency_key = ?",
                UUID.class,
                request.getWalletId(),
                request.getIdempotencyKey()
            );
            log.debug("Idempotent replay: entryId={}, walletId={}, key={}",
                    existingId, request.getWalletId(), request.getIdempotencyKey());
            metrics.recordLedgerEntry(request.getDirection().name(), request.getReason().name(), false);
            return RecordedEntry.replayed(existingId);
        }

        outboxService.saveEvent(LedgerEntryRecordedEvent.fromRequest(request, entryId, now));
        metrics.recordLedgerEntry(request.getDirection().name(), request.getReason().name(), true);
        log.info("Recorded ledger entry: entryId={}, walletId={}, direction={}, amount={}, reason={}",
                entryId, request.getWalletId(), request.getDirection(), request.getAmount(), request.getReason());
        return RecordedEntry.created(entryId);
    }

    /**
     * The entry stored under an idempotency key, if any.
     */
    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findEntryByKey(UUID walletId, String idempotencyKey) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM credit_ledger_entries WHERE wallet_id = ? AND idempotency_key = ?",
            entryRowMapper(),
            walletId,
            idempotencyKey
        ).stream().findFirst();
    }

    /**
     * Full history of a wallet in the order it was written.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> findEntries(String organizationId, UUID walletId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM credit_ledger_entries " +
            "WHERE organization_id = ? AND wallet_id = ? " +
            "ORDER BY created_at, sequence_number",
            entryRowMapper(),
            organizationId,
            walletId
        );
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getString("organization_id"),
            rs.getObject("wallet_id", UUID.class),
            EntryDirection.valueOf(rs.getString("direction")),
            rs.getLong("amount"),
            LedgerReason.valueOf(rs.getString("reason")),
            readReference(rs.getString("reference")),
            rs.getString("idempotency_key"),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private String writeReference(EntryReference reference) {
        try {
            return objectMapper.writerFor(EntryReference.class).writeValueAsString(reference);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize entry reference", e);
        }
    }

    private EntryReference readReference(String json) {
        try {
            return objectMapper.readValue(json, EntryReference.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored entry reference is not readable: " + json, e);
        }
    }
}
