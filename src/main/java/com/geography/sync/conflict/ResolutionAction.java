package com.geography.sync.conflict;

/**
 * Administrator decisions on a conflict case.
 */
public enum ResolutionAction {
    /**
     * The submission is the chosen canonical unit.
     */
    LINK,
    /**
     * The candidates are one place: fold them into the chosen unit and link.
     */
    MERGE,
    /**
     * The submission is a distinct place whose name collided; register it under a new name.
     */
    RENAME,
    /**
     * Keep the submission local to its tenant.
     */
    REJECT,
    /**
     * The submission sits under the wrong parent; move it and sync again.
     */
    REASSIGN_PARENT
}
