package com.reviewroster.scheduler.reviewer.model;

public enum ReviewerRole {
    ORDINARY(0),
    REVIEWER(1);

    private final int code;

    ReviewerRole(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ReviewerRole fromCode(int code) {
        for (var role : values()) {
            if (role.code == code) return role;
        }
        throw new IllegalArgumentException("invalid_role");
    }
}
