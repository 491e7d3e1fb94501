package com.geography.sync.conflict;

import java.util.Objects;

/**
 * An administrator's decision on an open conflict case.
 *
 * <ul>
 *   <li>LINK and MERGE need {@code canonicalId}</li>
 *   <li>RENAME needs {@code newName}</li>
 *   <li>REASSIGN_PARENT needs {@code newParentTenantUnitId}</li>
 * </ul>
 */
public record ResolutionCommand(String caseId, ResolutionAction action, String canonicalId, String newName,
                                String newParentTenantUnitId, String resolvedBy, String notes) {

    public ResolutionCommand {
        Objects.requireNonNull(caseId, "caseId is required");
        Objects.requireNonNull(action, "action is required");
        if (resolvedBy == null || resolvedBy.isBlank()) {
            throw new IllegalArgumentException("resolvedBy is required");
        }
        switch (action) {
            case LINK, MERGE -> require(canonicalId, "canonicalId", action);
            case RENAME -> require(newName, "newName", action);
            case REASSIGN_PARENT -> require(newParentTenantUnitId, "newParentTenantUnitId", action);
            case REJECT -> {
            }
        }
    }

    private static void require(String value, String name, ResolutionAction action) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required for " + action);
        }
    }

    public static ResolutionCommand link(String caseId, String canonicalId, String resolvedBy) {
        return builder(caseId, ResolutionAction.LINK).canonicalId(canonicalId).resolvedBy(resolvedBy).build();
    }

    public static ResolutionCommand merge(String caseId, String canonicalId, String resolvedBy) {
        return builder(caseId, ResolutionAction.MERGE).canonicalId(canonicalId).resolvedBy(resolvedBy).build();
    }

    public static ResolutionCommand rename(String caseId, String newName, String resolvedBy) {
        return builder(caseId, ResolutionAction.RENAME).newName(newName).resolvedBy(resolvedBy).build();
    }

    public static ResolutionCommand reject(String caseId, String resolvedBy) {
        return builder(caseId, ResolutionAction.REJECT).resolvedBy(resolvedBy).build();
    }

    public static ResolutionCommand reassignParent(String caseId, String newParentTenantUnitId, String resolvedBy) {
        return builder(caseId, ResolutionAction.REASSIGN_PARENT)
                .newParentTenantUnitId(newParentTenantUnitId).resolvedBy(resolvedBy).build();
    }

    public static Builder builder(String caseId, ResolutionAction action) {
        return new Builder(caseId, action);
    }

    public static class Builder {
        private final String caseId;
        private final ResolutionAction action;
        private String canonicalId;
        private String newName;
        private String newParentTenantUnitId;
        private String resolvedBy;
        private String notes;

        private Builder(String caseId, ResolutionAction action) {
            this.caseId = caseId;
            this.action = action;
        }

        public Builder canonicalId(String canonicalId) {
            this.canonicalId = canonicalId;
            return this;
        }

        public Builder newName(String newName) {
            this.newName = newName;
            return this;
        }

        public Builder newParentTenantUnitId(String newParentTenantUnitId) {
            this.newParentTenantUnitId = newParentTenantUnitId;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public ResolutionCommand build() {
            return new ResolutionCommand(caseId, action, canonicalId, newName, newParentTenantUnitId, resolvedBy, notes);
        }
    }
}
