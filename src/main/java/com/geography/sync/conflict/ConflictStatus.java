package com.geography.sync.conflict;

public enum ConflictStatus {
    OPEN,
    RESOLVED
}
