package com.geography.sync.ledger;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable ledger record of one registry decision.
 *
 * @param sequence     position in the ledger, strictly increasing
 * @param tenantUnitId the tenant unit the decision was about, null for registry-only events
 */
public record SyncLedgerEntry(
        String id,
        long sequence,
        Instant timestamp,
        String actor,
        String tenantUnitId,
        SyncEvent event
) {
    public SyncLedgerEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(actor, "actor is required");
        Objects.requireNonNull(event, "event is required");
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1");
        }
    }

    public LedgerOutcome outcome() {
        return event.outcome();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fields are package-visible so repositories can persist a draft before its
     * sequence number is known.
     */
    public static class Builder {
        String id = UUID.randomUUID().toString();
        long sequence;
        Instant timestamp = Instant.now();
        String actor;
        String tenantUnitId;
        SyncEvent event;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder tenantUnitId(String tenantUnitId) {
            this.tenantUnitId = tenantUnitId;
            return this;
        }

        public Builder event(SyncEvent event) {
            this.event = event;
            return this;
        }

        public SyncLedgerEntry build() {
            return new SyncLedgerEntry(id, sequence, timestamp, actor, tenantUnitId, event);
        }
    }
}
