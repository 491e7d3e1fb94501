package com.geography.sync.conflict;

import com.geography.sync.core.model.MatchCandidate;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A tenant submission waiting for an administrator because the matcher found
 * candidates but none conclusively.
 */
public class ConflictCase {
    private final String id;
    private final String tenantUnitId;
    private final String tenantId;
    private final int level;
    private final String declaredName;
    private final List<MatchCandidate> candidates;
    private ConflictStatus status;
    private ConflictResolution resolution;
    private final Instant openedAt;

    private ConflictCase(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.tenantUnitId = builder.tenantUnitId;
        this.tenantId = builder.tenantId;
        this.level = builder.level;
        this.declaredName = builder.declaredName;
        this.candidates = List.copyOf(builder.candidates);
        this.status = builder.status != null ? builder.status : ConflictStatus.OPEN;
        this.resolution = builder.resolution;
        this.openedAt = builder.openedAt != null ? builder.openedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getTenantUnitId() {
        return tenantUnitId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public int getLevel() {
        return level;
    }

    public String getDeclaredName() {
        return declaredName;
    }

    /**
     * Candidates at or above the floor, best first.
     */
    public List<MatchCandidate> getCandidates() {
        return candidates;
    }

    public List<String> getCandidateIds() {
        return candidates.stream().map(MatchCandidate::canonicalId).toList();
    }

    public ConflictStatus getStatus() {
        return status;
    }

    public ConflictResolution getResolution() {
        return resolution;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public boolean isOpen() {
        return status == ConflictStatus.OPEN;
    }

    /**
     * Closes the case.
     *
     * @throws IllegalStateException if the case is already resolved
     */
    public void resolve(ConflictResolution resolution) {
        if (!isOpen()) {
            throw new IllegalStateException("Conflict case " + id + " is already " + status);
        }
        this.resolution = resolution;
        this.status = ConflictStatus.RESOLVED;
    }

    public ConflictCase copy() {
        return builder(this).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((ConflictCase) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ConflictCase{id='" + id + "', tenantUnitId='" + tenantUnitId + "', declaredName='" + declaredName
                + "', candidates=" + candidates.size() + ", status=" + status + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(ConflictCase source) {
        return new Builder()
                .id(source.id)
                .tenantUnitId(source.tenantUnitId)
                .tenantId(source.tenantId)
                .level(source.level)
                .declaredName(source.declaredName)
                .candidates(source.candidates)
                .status(source.status)
                .resolution(source.resolution)
                .openedAt(source.openedAt);
    }

    public static class Builder {
        private String id;
        private String tenantUnitId;
        private String tenantId;
        private int level;
        private String declaredName;
        private List<MatchCandidate> candidates = List.of();
        private ConflictStatus status;
        private ConflictResolution resolution;
        private Instant openedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tenantUnitId(String tenantUnitId) {
            this.tenantUnitId = tenantUnitId;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder declaredName(String declaredName) {
            this.declaredName = declaredName;
            return this;
        }

        public Builder candidates(List<MatchCandidate> candidates) {
            this.candidates = candidates;
            return this;
        }

        public Builder status(ConflictStatus status) {
            this.status = status;
            return this;
        }

        public Builder resolution(ConflictResolution resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder openedAt(Instant openedAt) {
            this.openedAt = openedAt;
            return this;
        }

        public ConflictCase build() {
            Objects.requireNonNull(tenantUnitId, "tenantUnitId is required");
            Objects.requireNonNull(tenantId, "tenantId is required");
            Objects.requireNonNull(candidates, "candidates is required");
            if (status == ConflictStatus.RESOLVED && resolution == null) {
                throw new IllegalArgumentException("a resolved case needs a resolution");
            }
            return new ConflictCase(this);
        }
    }
}
