package com.flagship.credits_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of an idempotent append: the entry id, and whether this call wrote it
 * ({@code created}) or found it already stored under the same key.
 */
@Value
public class RecordedEntry {
    UUID id;
    boolean created;

    public static RecordedEntry created(UUID id) {
        return new RecordedEntry(id, true);
    }

    public static RecordedEntry replayed(UUID id) {
        return new RecordedEntry(id, false);
    }
}
