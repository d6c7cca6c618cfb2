package com.xksgroup.streamarchiver.model.Job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobSortKey Tests")
class JobSortKeyTest {

    private static final Instant EARLY = Instant.parse("2024-11-20T10:00:00Z");
    private static final Instant LATE = Instant.parse("2024-11-20T20:00:00Z");

    @Test
    @DisplayName("Should order by status priority first")
    void testPriorityFirst() {
        JobSortKey unknown = new JobSortKey(JobStatus.UNKNOWN.getSortPriority(), EARLY);
        JobSortKey downloading = new JobSortKey(JobStatus.DOWNLOADING.getSortPriority(), LATE);
        JobSortKey finished = new JobSortKey(JobStatus.FINISHED.getSortPriority(), LATE);

        assertTrue(unknown.compareTo(downloading) < 0);
        assertTrue(downloading.compareTo(finished) < 0);
        assertTrue(finished.compareTo(unknown) > 0);
    }

    @Test
    @DisplayName("Should put later reference times first within a priority")
    void testLaterFirst() {
        assertTrue(new JobSortKey(1, LATE).compareTo(new JobSortKey(1, EARLY)) < 0);
        assertTrue(new JobSortKey(1, EARLY).compareTo(new JobSortKey(1, LATE)) > 0);
    }

    @Test
    @DisplayName("Should treat priority zero and missing times as ties")
    void testTies() {
        assertEquals(0, new JobSortKey(0, LATE).compareTo(new JobSortKey(0, EARLY)));
        assertEquals(0, new JobSortKey(2, null).compareTo(new JobSortKey(2, EARLY)));
        assertEquals(0, new JobSortKey(2, EARLY).compareTo(new JobSortKey(2, null)));
    }

    @Test
    @DisplayName("Should sort stably, keeping insertion order between ties")
    void testSortStable() {
        Map<String, JobSortKey> keys = Map.of(
                "finished-a", new JobSortKey(0, EARLY),
                "waiting-soon", new JobSortKey(1, EARLY),
                "finished-b", new JobSortKey(0, LATE),
                "new", new JobSortKey(3, null),
                "waiting-later", new JobSortKey(1, LATE),
                "downloading", new JobSortKey(2, null));
        List<String> jobs = new ArrayList<>(List.of(
                "finished-a", "waiting-soon", "finished-b", "new", "waiting-later", "downloading"));

        JobSortKey.sortStable(jobs, keys::get);

        assertEquals(List.of("new", "downloading", "waiting-later", "waiting-soon", "finished-a", "finished-b"), jobs);
    }

    @Test
    @DisplayName("Should handle empty and single-element lists")
    void testTrivialLists() {
        List<String> empty = new ArrayList<>();
        JobSortKey.sortStable(empty, s -> new JobSortKey(0, null));
        assertTrue(empty.isEmpty());

        List<String> single = new ArrayList<>(List.of("only"));
        JobSortKey.sortStable(single, s -> new JobSortKey(1, EARLY));
        assertEquals(List.of("only"), single);
    }
}
