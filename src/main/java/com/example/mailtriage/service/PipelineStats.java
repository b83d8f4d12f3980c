package com.example.mailtriage.service;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory counters for the health endpoint. Reset on restart.
 */
@Component
public class PipelineStats {

    static final int MAX_RECENT_ERRORS = 50;
    static final int DEGRADED_ERROR_THRESHOLD = 10;
    static final Duration DEGRADED_WINDOW = Duration.ofMinutes(5);

    private final Clock clock;
    private final Instant startedAt;

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final ConcurrentLinkedDeque<RecentError> recentErrors = new ConcurrentLinkedDeque<>();

    public PipelineStats(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void recordRequest() {
        requests.incrementAndGet();
    }

    public void recordCompleted(boolean fallback) {
        completed.incrementAndGet();
        if (fallback) {
            fallbacks.incrementAndGet();
        }
    }

    public void recordError(String messageId, String stage, Throwable error) {
        errors.incrementAndGet();
        recentErrors.addFirst(new RecentError(clock.instant(), messageId, stage,
                error.getClass().getSimpleName() + ": " + error.getMessage()));
        while (recentErrors.size() > MAX_RECENT_ERRORS) {
            recentErrors.pollLast();
        }
    }

    public boolean isDegraded() {
        Instant cutoff = clock.instant().minus(DEGRADED_WINDOW);
        int inWindow = 0;
        Iterator<RecentError> iterator = recentErrors.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getAt().isBefore(cutoff)) {
                break;
            }
            inWindow++;
        }
        return inWindow >= DEGRADED_ERROR_THRESHOLD;
    }

    public Duration uptime() {
        return Duration.between(startedAt, clock.instant());
    }

    public long getRequests() {
        return requests.get();
    }

    public long getCompleted() {
        return completed.get();
    }

    public long getFallbacks() {
        return fallbacks.get();
    }

    public long getErrors() {
        return errors.get();
    }

    /** Newest first. */
    public List<RecentError> recentErrors(int max) {
        List<RecentError> out = new ArrayList<>();
        for (RecentError error : recentErrors) {
            if (out.size() >= max) {
                break;
            }
            out.add(error);
        }
        return out;
    }

    @Value
    public static class RecentError {
        Instant at;
        String messageId;
        String stage;
        String error;
    }
}
