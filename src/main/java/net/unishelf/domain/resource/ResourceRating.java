package net.unishelf.domain.resource;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * One rater's score for a resource.
 */
public record ResourceRating(
    String raterId,
    int score,
    @Nullable String review,
    Instant ratedAt
) {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 5;

    public ResourceRating {
        if (raterId == null || raterId.isBlank()) {
            throw new IllegalArgumentException("raterId must not be blank");
        }
        if (score < MIN_SCORE || score > MAX_SCORE) {
            throw new IllegalArgumentException("score must be between 1 and 5");
        }
    }
}
