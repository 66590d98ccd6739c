package ch.uzh.ifi.grading.service;

import ch.uzh.ifi.grading.config.GraderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Sliding-window admission control. Pruning, the capacity check and recording the accepted request happen in one
 * critical section, so concurrent callers can never overshoot the quota.
 */
@Slf4j
@Service
public class RateLimiter {

    private final Map<String, Deque<Instant>> requests = new HashMap<>();

    private final Duration window;

    private final int maxRequests;

    private final Clock clock;

    private Instant lastSweep = Instant.EPOCH;

    @Autowired
    public RateLimiter(GraderProperties properties) {
        this(properties.getRateLimit().getWindow(), properties.getRateLimit().getMaxRequests(), Clock.systemUTC());
    }

    public RateLimiter(Duration window, int maxRequests, Clock clock) {
        this.window = window;
        this.maxRequests = maxRequests;
        this.clock = clock;
    }

    public synchronized boolean isAllowed(String key) {
        Instant now = clock.instant();
        evictIdle(now);
        Deque<Instant> recent = requests.computeIfAbsent(key, k -> new ArrayDeque<>());
        while (!recent.isEmpty() && !recent.peekFirst().isAfter(now.minus(window)))
            recent.pollFirst();
        if (recent.size() >= maxRequests) {
            log.warn("Rate limit exceeded for {}", key);
            return false;
        }
        recent.addLast(now);
        return true;
    }

    /**
     * Drops clients whose newest request has left the window, at most once per window.
     */
    private void evictIdle(Instant now) {
        if (lastSweep.plus(window).isAfter(now))
            return;
        lastSweep = now;
        int before = requests.size();
        requests.values().removeIf(recent -> recent.isEmpty() || !recent.peekLast().isAfter(now.minus(window)));
        if (before > requests.size())
            log.debug("Evicted {} idle rate limit entries", before - requests.size());
    }

    synchronized int getTrackedClients() {
        return requests.size();
    }

    public int getMaxRequests() {
        return maxRequests;
    }
}
