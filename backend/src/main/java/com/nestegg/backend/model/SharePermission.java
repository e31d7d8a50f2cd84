package com.nestegg.backend.model;

public enum SharePermission {
    WATCH,
    EDIT
}
