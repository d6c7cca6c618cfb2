package com.xksgroup.streamarchiver.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * Display ordering of jobs: (status priority, reference time).
 * <p>
 * Natural ordering puts the larger key first: higher priority first and, within the same
 * non-zero priority, the later reference time first. This means waiting jobs scheduled further
 * in the future come before those scheduled sooner. Keys with priority 0, or where either
 * reference time is missing, compare as equal so a stable sort keeps insertion order.
 * <p>
 * Because "equal" is not transitive here, sort with {@link #sortStable}, which never throws on
 * such keys, rather than {@link List#sort}.
 */
public record JobSortKey(int priority, Instant referenceTime) implements Comparable<JobSortKey> {

    @Override
    public int compareTo(JobSortKey other) {
        if (priority != other.priority) {
            return Integer.compare(other.priority, priority);
        }
        if (priority == 0 || referenceTime == null || other.referenceTime == null) {
            return 0;
        }
        return other.referenceTime.compareTo(referenceTime);
    }

    /**
     * Stable insertion sort by key.
     */
    public static <T> void sortStable(List<T> items, Function<T, JobSortKey> keyOf) {
        for (int i = 1; i < items.size(); i++) {
            T item = items.get(i);
            JobSortKey key = keyOf.apply(item);
            int j = i - 1;
            while (j >= 0 && keyOf.apply(items.get(j)).compareTo(key) > 0) {
                items.set(j + 1, items.get(j));
                j--;
            }
            items.set(j + 1, item);
        }
    }
}
