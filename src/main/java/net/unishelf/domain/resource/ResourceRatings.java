package net.unishelf.domain.resource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable rating list of a single resource. Each rater holds at most one slot;
 * rating again replaces the earlier score instead of appending.
 */
public final class ResourceRatings {

    private final List<ResourceRating> entries;

    private ResourceRatings(List<ResourceRating> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    public static ResourceRatings of(List<ResourceRating> entries) {
        return new ResourceRatings(entries == null ? new ArrayList<>() : new ArrayList<>(entries));
    }

    public static ResourceRatings empty() {
        return new ResourceRatings(new ArrayList<>());
    }

    public ResourceRatings upsert(ResourceRating rating) {
        List<ResourceRating> next = new ArrayList<>(entries.size() + 1);
        boolean replaced = false;
        for (ResourceRating existing : entries) {
            if (existing.raterId().equals(rating.raterId())) {
                next.add(rating);
                replaced = true;
            } else {
                next.add(existing);
            }
        }
        if (!replaced) {
            next.add(rating);
        }
        return new ResourceRatings(next);
    }

    /** Arithmetic mean of the current scores, 0 when nobody rated yet. */
    public double average() {
        if (entries.isEmpty()) {
            return 0.0;
        }
        long sum = 0;
        for (ResourceRating entry : entries) {
            sum += entry.score();
        }
        return (double) sum / entries.size();
    }

    public Optional<ResourceRating> findByRater(String raterId) {
        if (raterId == null) {
            return Optional.empty();
        }
        return entries.stream().filter(entry -> entry.raterId().equals(raterId)).findFirst();
    }

    public int size() {
        return entries.size();
    }

    public List<ResourceRating> entries() {
        return entries;
    }
}
