package com.nestegg.backend.model;

/**
 * Effective access of a caller to one sandbox, strongest last.
 */
public enum AccessLevel {
    WATCH,
    EDIT,
    OWNER;

    public boolean canTrade() {
        return this == EDIT || this == OWNER;
    }

    public static AccessLevel from(SharePermission permission) {
        return permission == SharePermission.EDIT ? EDIT : WATCH;
    }
}
