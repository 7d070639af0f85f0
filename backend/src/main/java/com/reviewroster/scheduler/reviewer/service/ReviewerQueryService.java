package com.reviewroster.scheduler.reviewer.service;

import com.reviewroster.scheduler.reviewer.model.Reviewer;
import com.reviewroster.scheduler.reviewer.repo.ReviewerDirectory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class ReviewerQueryService {

    private final ReviewerDirectory reviewerDirectory;

    public ReviewerQueryService(ReviewerDirectory reviewerDirectory) {
        this.reviewerDirectory = reviewerDirectory;
    }

    /**
     * Substring search over available records. Null or empty fragments match anything; other fragments are not trimmed.
     */
    public List<Reviewer> search(String idFragment, String nameFragment, String phoneFragment, boolean onlyReviewers) {
        return reviewerDirectory.search(emptyToNull(idFragment), emptyToNull(nameFragment), emptyToNull(phoneFragment), onlyReviewers);
    }

    public Optional<Reviewer> fetch(String reviewerId) {
        requireId(reviewerId);
        return reviewerDirectory.findReviewer(reviewerId);
    }

    public boolean exists(String reviewerId, boolean onlyReviewers) {
        requireId(reviewerId);
        return reviewerDirectory.exists(reviewerId, onlyReviewers);
    }

    private static void requireId(String reviewerId) {
        if (reviewerId == null || reviewerId.isBlank()) throw new IllegalArgumentException("reviewer_id_required");
    }

    // Fragments match as given, whitespace included.
    private static String emptyToNull(String raw) {
        return raw == null || raw.isEmpty() ? null : raw;
    }
}
