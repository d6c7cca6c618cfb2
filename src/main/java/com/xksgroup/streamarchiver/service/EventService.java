package com.xksgroup.streamarchiver.service;

import com.xksgroup.streamarchiver.model.Job.JobSnapshot;
import com.xksgroup.streamarchiver.model.dto.JobProgressDto;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Streams broadcaster updates to SSE clients. Each connection drains its own subscription on a
 * dedicated thread, so a slow client only ever delays itself.
 */
@Slf4j
@Service
public class EventService {

    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(15);

    private final JobBroadcaster broadcaster;
    private final ExecutorService pumps = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "sse-pump");
        thread.setDaemon(true);
        return thread;
    });

    public EventService(JobBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    /**
     * Follows every job.
     */
    public SseEmitter subscribe() {
        return stream(broadcaster.subscribe(), "job-update");
    }

    /**
     * Follows a single job, starting with its current state.
     */
    public SseEmitter subscribe(JobSnapshot current) {
        SseEmitter emitter = stream(broadcaster.subscribe(current.getId()), "job-detail");
        safeSend(emitter, "job-detail", JobProgressDto.fromSnapshot(current));
        return emitter;
    }

    private SseEmitter stream(JobBroadcaster.Subscription subscription, String eventName) {
        SseEmitter emitter = new SseEmitter(0L);
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(t -> subscription.close());

        safeSend(emitter, "connected", Map.of("ok", true));
        pumps.submit(() -> pump(subscription, emitter, eventName));
        return emitter;
    }

    private void pump(JobBroadcaster.Subscription subscription, SseEmitter emitter, String eventName) {
        try (subscription) {
            while (!subscription.isClosed()) {
                JobSnapshot snapshot = subscription.poll(HEARTBEAT_INTERVAL);
                boolean sent = snapshot != null
                        ? safeSend(emitter, eventName, JobProgressDto.fromSnapshot(snapshot))
                        : safeSend(emitter, "heartbeat", Map.of("ts", System.currentTimeMillis()));
                if (!sent) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        }
    }

    /**
     * Sends one SSE event; a failed send ends the stream.
     */
    private boolean safeSend(SseEmitter emitter, String eventName, Object data) {
        try {
            emitter.send(SseEmitter.event()
                    .id(UUID.randomUUID().toString())
                    .name(eventName)
                    .data(data)
                    .reconnectTime(3000)
                    .build());
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE client went away: {}", e.getMessage());
            try {
                emitter.completeWithError(e);
            } catch (IllegalStateException alreadyCompleted) {
                log.trace("Emitter already completed");
            }
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        pumps.shutdownNow();
    }
}
