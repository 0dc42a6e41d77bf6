package com.uwb.positioning.motion;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-lifetime motion cache backed by a {@link ConcurrentHashMap}.
 *
 * <p>The read of the previous fix and the write of the new one happen inside
 * {@link ConcurrentHashMap#compute}, which holds the bin lock for that tag, so updates for the same
 * tag are serialised while different tags proceed in parallel. Nothing is persisted. A revert only
 * applies while the reverted fix is still the latest one of its tag.
 */
@Slf4j
public class InMemoryMotionCache implements MotionCache {

    private final Map<String, MotionCacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public MotionUpdate record(String tagId, double x, double y, Instant at) {
        MotionCacheEntry current = new MotionCacheEntry(tagId, x, y, at);
        AtomicReference<MotionCacheEntry> replaced = new AtomicReference<>();

        entries.compute(tagId, (key, previous) -> {
            replaced.set(previous);
            return current;
        });

        MotionCacheEntry previous = replaced.get();
        MotionDelta delta = previous == null
            ? MotionDelta.firstFix()
            : deltaBetween(previous, x, y, at);
        log.debug("Motion cache updated for tag {}: {}", tagId, delta);
        return new MotionUpdate(previous, current, delta);
    }

    @Override
    public boolean revert(MotionUpdate update) {
        MotionCacheEntry current = update.current();
        AtomicBoolean restored = new AtomicBoolean();

        entries.computeIfPresent(current.tagId(), (key, latest) -> {
            if (latest != current) {
                return latest;
            }
            restored.set(true);
            return update.previous();
        });

        if (restored.get()) {
            log.debug("Motion cache reverted for tag {}", current.tagId());
        }
        return restored.get();
    }

    @Override
    public Optional<MotionCacheEntry> lookup(String tagId) {
        return Optional.ofNullable(entries.get(tagId));
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void clear() {
        entries.clear();
    }

    static MotionDelta deltaBetween(MotionCacheEntry previous, double x, double y, Instant at) {
        double distance = Math.hypot(x - previous.lastX(), y - previous.lastY());
        // Duration#getSeconds floors toward negative infinity; reordered fixes clamp to zero
        long elapsed = Math.max(0L, Duration.between(previous.lastTimestamp(), at).getSeconds());
        return new MotionDelta(distance, elapsed);
    }
}
