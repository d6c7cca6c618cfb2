package com.xksgroup.streamarchiver.service;

import com.xksgroup.streamarchiver.model.Job.JobSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobBroadcaster Tests")
class JobBroadcasterTest {

    private static final Duration SHORT = Duration.ofMillis(50);

    private final JobBroadcaster broadcaster = new JobBroadcaster();

    private static JobSnapshot snapshot(String id) {
        return JobSnapshot.builder().id(id).build();
    }

    @Test
    @DisplayName("Should deliver global updates to every global subscriber")
    void testGlobalFanOut() throws InterruptedException {
        JobBroadcaster.Subscription first = broadcaster.subscribe();
        JobBroadcaster.Subscription second = broadcaster.subscribe();

        broadcaster.publish(snapshot("job-1"));

        assertEquals("job-1", first.poll(SHORT).getId());
        assertEquals("job-1", second.poll(SHORT).getId());
        assertNull(first.poll(SHORT));
    }

    @Test
    @DisplayName("Should deliver detail updates only to that job's subscribers")
    void testPerJobDelivery() throws InterruptedException {
        JobBroadcaster.Subscription global = broadcaster.subscribe();
        JobBroadcaster.Subscription jobOne = broadcaster.subscribe("job-1");
        JobBroadcaster.Subscription jobTwo = broadcaster.subscribe("job-2");

        broadcaster.publishDetail(snapshot("job-1"));

        assertEquals("job-1", jobOne.poll(SHORT).getId());
        assertNull(jobTwo.poll(SHORT));
        assertNull(global.poll(SHORT));
        assertEquals("job-2", jobTwo.getJobId());
    }

    @Test
    @DisplayName("Should keep updates in publish order")
    void testOrdering() throws InterruptedException {
        JobBroadcaster.Subscription subscription = broadcaster.subscribe();
        broadcaster.publish(snapshot("a"));
        broadcaster.publish(snapshot("b"));
        broadcaster.publish(snapshot("c"));

        assertEquals("a", subscription.poll(SHORT).getId());
        assertEquals("b", subscription.poll(SHORT).getId());
        assertEquals("c", subscription.poll(SHORT).getId());
    }

    @Test
    @DisplayName("Should unsubscribe on close")
    void testCloseUnsubscribes() throws InterruptedException {
        JobBroadcaster.Subscription global = broadcaster.subscribe();
        JobBroadcaster.Subscription detail = broadcaster.subscribe("job-1");
        assertEquals(2, broadcaster.subscriberCount());

        global.close();
        detail.close();
        detail.close();

        assertTrue(global.isClosed());
        assertEquals(0, broadcaster.subscriberCount());
        broadcaster.publish(snapshot("job-1"));
        broadcaster.publishDetail(snapshot("job-1"));
        assertNull(global.poll(SHORT));
        assertNull(detail.poll(SHORT));
    }

    @Test
    @DisplayName("Should tolerate publishing with no subscribers")
    void testNoSubscribers() {
        assertDoesNotThrow(() -> broadcaster.publish(snapshot("job-1")));
        assertDoesNotThrow(() -> broadcaster.publishDetail(snapshot("job-1")));
    }
}
