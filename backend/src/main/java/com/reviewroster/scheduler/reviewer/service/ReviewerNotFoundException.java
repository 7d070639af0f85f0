package com.reviewroster.scheduler.reviewer.service;

/**
 * The reviewer id does not resolve to a record that may take a status change.
 * The message is a stable code: {@code reviewer_not_found} or {@code reviewer_not_eligible}.
 */
public class ReviewerNotFoundException extends RuntimeException {

    public static final String NOT_FOUND = "reviewer_not_found";
    public static final String NOT_ELIGIBLE = "reviewer_not_eligible";

    private final String reviewerId;

    public ReviewerNotFoundException(String code, String reviewerId) {
        super(code);
        this.reviewerId = reviewerId;
    }

    public String code() {
        return getMessage();
    }

    public String reviewerId() {
        return reviewerId;
    }
}
