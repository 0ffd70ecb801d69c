package com.flagship.credits_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.UUID;

/**
 * Describes the operation that produced a ledger entry.
 *
 * The ledger never interprets a reference; it only checks that the variant matches the
 * entry's {@link LedgerReason}. Stored as JSONB with a {@code type} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EntryReference.Purchase.class, name = "purchase"),
    @JsonSubTypes.Type(value = EntryReference.Capture.class, name = "capture"),
    @JsonSubTypes.Type(value = EntryReference.Adjustment.class, name = "manual_adjustment"),
    @JsonSubTypes.Type(value = EntryReference.Refund.class, name = "refund")
})
public sealed interface EntryReference
        permits EntryReference.Purchase, EntryReference.Capture, EntryReference.Adjustment, EntryReference.Refund {

    @JsonIgnore
    LedgerReason reason();

    /**
     * An external order that bought credits.
     */
    record Purchase(String provider, String orderId) implements EntryReference {
        @Override
        public LedgerReason reason() {
            return LedgerReason.PURCHASE;
        }
    }

    /**
     * The hold this debit realizes, with the external order it was reserved for.
     */
    record Capture(String provider, String orderId, UUID holdId) implements EntryReference {
        @Override
        public LedgerReason reason() {
            return LedgerReason.CAPTURE;
        }
    }

    /**
     * A manual correction; {@code actor} is whoever made it.
     */
    record Adjustment(String note, String actor) implements EntryReference {
        @Override
        public LedgerReason reason() {
            return LedgerReason.MANUAL_ADJUSTMENT;
        }
    }

    record Refund(String provider, String orderId, String note) implements EntryReference {
        @Override
        public LedgerReason reason() {
            return LedgerReason.REFUND;
        }
    }
}
