package com.geography.sync.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A geography node as entered by one tenant.
 * Linked to at most one {@link CanonicalUnit}; the link is a reference, not ownership.
 * Units are soft-retired, never deleted.
 */
public class TenantGeoUnit {
    private final String id;
    private final String tenantId;
    private final int level;
    private String parentId;
    private final Map<String, String> names;
    private final String primaryLanguage;
    private final String governmentCode;
    private String canonicalUnitId;
    private SyncState syncState;
    private boolean retired;
    private final Instant createdAt;
    private Instant updatedAt;

    private TenantGeoUnit(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.tenantId = builder.tenantId;
        this.level = builder.level;
        this.parentId = builder.parentId;
        this.names = Collections.unmodifiableMap(new LinkedHashMap<>(builder.names));
        this.primaryLanguage = builder.primaryLanguage != null
                ? builder.primaryLanguage : builder.names.keySet().iterator().next();
        this.governmentCode = builder.governmentCode;
        this.canonicalUnitId = builder.canonicalUnitId;
        this.syncState = builder.syncState != null ? builder.syncState : SyncState.DRAFT;
        this.retired = builder.retired;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public int getLevel() {
        return level;
    }

    public String getParentId() {
        return parentId;
    }

    /**
     * Declared names keyed by language code, in declaration order.
     */
    public Map<String, String> getNames() {
        return names;
    }

    public String getPrimaryLanguage() {
        return primaryLanguage;
    }

    /**
     * The name in the unit's primary language.
     */
    public String getDeclaredName() {
        return names.get(primaryLanguage);
    }

    public String getGovernmentCode() {
        return governmentCode;
    }

    public String getCanonicalUnitId() {
        return canonicalUnitId;
    }

    public SyncState getSyncState() {
        return syncState;
    }

    public boolean isRetired() {
        return retired;
    }

    public boolean isLinked() {
        return canonicalUnitId != null;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Moves the unit to a new sync state.
     *
     * @throws IllegalStateException if the state machine does not allow the move
     */
    public void transitionTo(SyncState target) {
        if (!syncState.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Illegal sync state transition " + syncState + " -> " + target + " for unit " + id);
        }
        this.syncState = target;
        this.updatedAt = Instant.now();
    }

    public void linkTo(String canonicalUnitId) {
        this.canonicalUnitId = canonicalUnitId;
        this.updatedAt = Instant.now();
    }

    public void moveUnder(String parentId) {
        this.parentId = parentId;
        this.updatedAt = Instant.now();
    }

    public void retire() {
        this.retired = true;
        this.updatedAt = Instant.now();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TenantGeoUnit that = (TenantGeoUnit) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TenantGeoUnit{" +
                "id='" + id + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", level=" + level +
                ", name='" + getDeclaredName() + '\'' +
                ", syncState=" + syncState +
                ", canonicalUnitId='" + canonicalUnitId + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder pre-populated with a copy of the given unit.
     */
    public static Builder builder(TenantGeoUnit unit) {
        return new Builder()
                .id(unit.id)
                .tenantId(unit.tenantId)
                .level(unit.level)
                .parentId(unit.parentId)
                .names(unit.names)
                .primaryLanguage(unit.primaryLanguage)
                .governmentCode(unit.governmentCode)
                .canonicalUnitId(unit.canonicalUnitId)
                .syncState(unit.syncState)
                .retired(unit.retired)
                .createdAt(unit.createdAt)
                .updatedAt(unit.updatedAt);
    }

    public static class Builder {
        private String id;
        private String tenantId;
        private int level;
        private String parentId;
        private Map<String, String> names = new LinkedHashMap<>();
        private String primaryLanguage;
        private String governmentCode;
        private String canonicalUnitId;
        private SyncState syncState;
        private boolean retired;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
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

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder names(Map<String, String> names) {
            this.names = new LinkedHashMap<>(names);
            return this;
        }

        public Builder name(String language, String name) {
            this.names.put(language, name);
            return this;
        }

        public Builder primaryLanguage(String primaryLanguage) {
            this.primaryLanguage = primaryLanguage;
            return this;
        }

        public Builder governmentCode(String governmentCode) {
            this.governmentCode = governmentCode;
            return this;
        }

        public Builder canonicalUnitId(String canonicalUnitId) {
            this.canonicalUnitId = canonicalUnitId;
            return this;
        }

        public Builder syncState(SyncState syncState) {
            this.syncState = syncState;
            return this;
        }

        public Builder retired(boolean retired) {
            this.retired = retired;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public TenantGeoUnit build() {
            Objects.requireNonNull(tenantId, "tenantId is required");
            if (names.isEmpty()) {
                throw new IllegalArgumentException("at least one declared name is required");
            }
            if (primaryLanguage != null && !names.containsKey(primaryLanguage)) {
                throw new IllegalArgumentException("primaryLanguage '" + primaryLanguage + "' has no declared name");
            }
            return new TenantGeoUnit(this);
        }
    }
}
