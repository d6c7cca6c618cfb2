package com.xksgroup.streamarchiver.service;

import com.xksgroup.streamarchiver.model.Job.JobSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fans job snapshots out to subscribers. A subscription either follows every job or a single one,
 * and stops receiving once closed. Publishing never blocks on a slow subscriber.
 */
@Slf4j
@Service
public class JobBroadcaster {

    private final Set<Subscription> globalSubscribers = new CopyOnWriteArraySet<>();
    private final Map<String, Set<Subscription>> jobSubscribers = new ConcurrentHashMap<>();

    /**
     * Subscribes to updates of every job.
     */
    public Subscription subscribe() {
        Subscription subscription = new Subscription(null);
        globalSubscribers.add(subscription);
        log.debug("New global job subscriber ({} total)", globalSubscribers.size());
        return subscription;
    }

    /**
     * Subscribes to updates of a single job.
     */
    public Subscription subscribe(String jobId) {
        Subscription subscription = new Subscription(jobId);
        jobSubscribers.computeIfAbsent(jobId, k -> new CopyOnWriteArraySet<>()).add(subscription);
        return subscription;
    }

    /**
     * Delivers a job update to all global subscribers.
     */
    public void publish(JobSnapshot snapshot) {
        for (Subscription subscription : globalSubscribers) {
            subscription.offer(snapshot);
        }
    }

    /**
     * Delivers a job update to the subscribers of that job only.
     */
    public void publishDetail(JobSnapshot snapshot) {
        Set<Subscription> subscribers = jobSubscribers.get(snapshot.getId());
        if (subscribers == null) {
            return;
        }
        for (Subscription subscription : subscribers) {
            subscription.offer(snapshot);
        }
    }

    public int subscriberCount() {
        return globalSubscribers.size() + jobSubscribers.values().stream().mapToInt(Set::size).sum();
    }

    private void unsubscribe(Subscription subscription) {
        if (subscription.jobId == null) {
            globalSubscribers.remove(subscription);
            return;
        }
        jobSubscribers.computeIfPresent(subscription.jobId, (id, subscribers) -> {
            subscribers.remove(subscription);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    public final class Subscription implements AutoCloseable {

        private final String jobId;
        private final BlockingQueue<JobSnapshot> queue = new LinkedBlockingQueue<>();
        private volatile boolean closed;

        private Subscription(String jobId) {
            this.jobId = jobId;
        }

        private void offer(JobSnapshot snapshot) {
            if (!closed) {
                queue.offer(snapshot);
            }
        }

        /**
         * Waits up to {@code timeout} for the next update; {@code null} if none arrived.
         */
        public JobSnapshot poll(Duration timeout) throws InterruptedException {
            return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        public String getJobId() {
            return jobId;
        }

        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                queue.clear();
                unsubscribe(this);
            }
        }
    }
}
