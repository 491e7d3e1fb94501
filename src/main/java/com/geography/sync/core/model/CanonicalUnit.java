package com.geography.sync.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * The single cross-tenant record of one real-world administrative place.
 * Mutated only through {@link com.geography.sync.registry.CanonicalRegistry}.
 */
public class CanonicalUnit {
    private final String id;
    private final int level;
    private String parentId;
    private String primaryName;
    private String normalizedName;
    private final Set<String> alternateNames;
    private final Set<String> tenantIds;
    private String governmentCode;
    private VerificationState verificationState;
    private UnitStatus status;
    private String mergedInto;
    private final Instant createdAt;
    private Instant updatedAt;

    private CanonicalUnit(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.level = builder.level;
        this.parentId = builder.parentId;
        this.primaryName = builder.primaryName;
        this.normalizedName = builder.normalizedName;
        this.alternateNames = new LinkedHashSet<>(builder.alternateNames);
        this.tenantIds = new LinkedHashSet<>(builder.tenantIds);
        this.governmentCode = builder.governmentCode;
        this.verificationState = builder.verificationState != null
                ? builder.verificationState : VerificationState.UNVERIFIED;
        this.status = builder.status != null ? builder.status : UnitStatus.ACTIVE;
        this.mergedInto = builder.mergedInto;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public int getLevel() {
        return level;
    }

    public String getParentId() {
        return parentId;
    }

    public String getPrimaryName() {
        return primaryName;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public Set<String> getAlternateNames() {
        return Collections.unmodifiableSet(alternateNames);
    }

    /**
     * Primary name followed by every alternate name.
     */
    public Set<String> getAllNames() {
        Set<String> all = new LinkedHashSet<>();
        all.add(primaryName);
        all.addAll(alternateNames);
        return all;
    }

    public Set<String> getTenantIds() {
        return Collections.unmodifiableSet(tenantIds);
    }

    /**
     * Number of distinct tenants referencing this unit.
     */
    public int getTenantReferenceCount() {
        return tenantIds.size();
    }

    public String getGovernmentCode() {
        return governmentCode;
    }

    public VerificationState getVerificationState() {
        return verificationState;
    }

    public UnitStatus getStatus() {
        return status;
    }

    public String getMergedInto() {
        return mergedInto;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isActive() {
        return status == UnitStatus.ACTIVE;
    }

    /**
     * Derived confidence that this unit denotes one real place.
     * Grows with independent tenant confirmation, halved while disputed.
     */
    public double confidence() {
        if (verificationState == VerificationState.VERIFIED) {
            return 1.0;
        }
        double base = Math.min(0.95, 0.5 + 0.1 * (Math.max(1, tenantIds.size()) - 1));
        return verificationState == VerificationState.DISPUTED ? base / 2 : base;
    }

    /**
     * Records an observed name. The primary name and known alternates
     * (case-insensitive) are ignored.
     *
     * @return true if the name was new
     */
    public boolean addAlternateName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        for (String known : getAllNames()) {
            if (known.equalsIgnoreCase(name)) {
                return false;
            }
        }
        alternateNames.add(name);
        updatedAt = Instant.now();
        return true;
    }

    /**
     * @return true if the tenant was not already referencing this unit
     */
    public boolean addTenant(String tenantId) {
        boolean added = tenantIds.add(tenantId);
        if (added) {
            updatedAt = Instant.now();
        }
        return added;
    }

    public void rename(String primaryName, String normalizedName) {
        String previous = this.primaryName;
        this.primaryName = primaryName;
        this.normalizedName = normalizedName;
        alternateNames.removeIf(n -> n.equalsIgnoreCase(primaryName));
        if (previous != null && !previous.equalsIgnoreCase(primaryName)) {
            alternateNames.add(previous);
        }
        updatedAt = Instant.now();
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
        updatedAt = Instant.now();
    }

    public void setGovernmentCode(String governmentCode) {
        this.governmentCode = governmentCode;
        updatedAt = Instant.now();
    }

    public void setVerificationState(VerificationState verificationState) {
        this.verificationState = verificationState;
        updatedAt = Instant.now();
    }

    /**
     * Retires this unit after it was folded into {@code primaryId}.
     */
    public void retireInto(String primaryId) {
        this.status = UnitStatus.RETIRED;
        this.mergedInto = primaryId;
        updatedAt = Instant.now();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalUnit that = (CanonicalUnit) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CanonicalUnit{" +
                "id='" + id + '\'' +
                ", level=" + level +
                ", parentId='" + parentId + '\'' +
                ", primaryName='" + primaryName + '\'' +
                ", tenants=" + tenantIds.size() +
                ", verificationState=" + verificationState +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder holding a deep copy of the given unit.
     */
    public static Builder builder(CanonicalUnit unit) {
        return new Builder()
                .id(unit.id)
                .level(unit.level)
                .parentId(unit.parentId)
                .primaryName(unit.primaryName)
                .normalizedName(unit.normalizedName)
                .alternateNames(unit.alternateNames)
                .tenantIds(unit.tenantIds)
                .governmentCode(unit.governmentCode)
                .verificationState(unit.verificationState)
                .status(unit.status)
                .mergedInto(unit.mergedInto)
                .createdAt(unit.createdAt)
                .updatedAt(unit.updatedAt);
    }

    /**
     * Returns an independent copy of this unit.
     */
    public CanonicalUnit copy() {
        return builder(this).build();
    }

    public static class Builder {
        private String id;
        private int level;
        private String parentId;
        private String primaryName;
        private String normalizedName;
        private Set<String> alternateNames = new LinkedHashSet<>();
        private Set<String> tenantIds = new LinkedHashSet<>();
        private String governmentCode;
        private VerificationState verificationState;
        private UnitStatus status;
        private String mergedInto;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
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

        public Builder primaryName(String primaryName) {
            this.primaryName = primaryName;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder alternateNames(Set<String> alternateNames) {
            this.alternateNames = new LinkedHashSet<>(alternateNames);
            return this;
        }

        public Builder tenantIds(Set<String> tenantIds) {
            this.tenantIds = new LinkedHashSet<>(tenantIds);
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantIds.add(tenantId);
            return this;
        }

        public Builder governmentCode(String governmentCode) {
            this.governmentCode = governmentCode;
            return this;
        }

        public Builder verificationState(VerificationState verificationState) {
            this.verificationState = verificationState;
            return this;
        }

        public Builder status(UnitStatus status) {
            this.status = status;
            return this;
        }

        public Builder mergedInto(String mergedInto) {
            this.mergedInto = mergedInto;
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

        public CanonicalUnit build() {
            Objects.requireNonNull(primaryName, "primaryName is required");
            Objects.requireNonNull(normalizedName, "normalizedName is required");
            if (level < 0) {
                throw new IllegalArgumentException("level must be >= 0");
            }
            return new CanonicalUnit(this);
        }
    }
}
