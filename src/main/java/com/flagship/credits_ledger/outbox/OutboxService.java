package com.flagship.credits_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credits_ledger.event.CreditEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes credit events to the outbox inside the caller's transaction.
 *
 * If the ledger or hold change commits, its event is committed with it; if the change
 * rolls back, so does the event. Relaying to Kafka happens later in {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves an event within the current transaction. MANDATORY propagation makes a
     * call outside a business transaction fail fast instead of committing on its own.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(CreditEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.create(event, serializePayload(event));
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, walletId={}, eventId={}",
                event.getEventType(), event.getWalletId(), event.getEventId());

        return saved.toDomain();
    }

    /**
     * Fetches the next batch to relay, skipping rows locked by another publisher and
     * rows that have exhausted their retries.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int maxRetries, int limit) {
        return repository.findUnpublishedEventsForUpdate(maxRetries, limit)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events of one wallet in write order.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForWallet(UUID walletId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                CreditEvent.AGGREGATE_TYPE, walletId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(CreditEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + event.getEventType() + " payload", e);
        }
    }
}
