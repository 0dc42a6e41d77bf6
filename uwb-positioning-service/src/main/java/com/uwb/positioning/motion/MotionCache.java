package com.uwb.positioning.motion;

import java.time.Instant;
import java.util.Optional;

/**
 * Per-tag store of the last resolved fix, used to derive distance travelled and elapsed time.
 *
 * <p>Implementations must make {@link #update} atomic per tag: two concurrent updates for the same
 * tag may not both observe the same previous entry.
 */
public interface MotionCache {

    /**
     * Records a new fix and returns the movement since the previous one.
     *
     * @param tagId tag identifier
     * @param x resolved x
     * @param y resolved y
     * @param at time of the fix
     * @return delta to the previous fix, {@link MotionDelta#firstFix()} when there was none
     */
    default MotionDelta update(String tagId, double x, double y, Instant at) {
        return record(tagId, x, y, at).delta();
    }

    /**
     * Records a new fix and returns both the replaced and the written entry, so the caller can
     * {@link #revert} it when the fix is not persisted.
     */
    MotionUpdate record(String tagId, double x, double y, Instant at);

    /**
     * Restores the entry an update replaced, provided that update is still the latest fix of its
     * tag. Updates of the same tag must be reverted newest first.
     *
     * @return whether the entry was restored
     */
    boolean revert(MotionUpdate update);

    Optional<MotionCacheEntry> lookup(String tagId);

    int size();

    /**
     * Drops every entry, as a process restart would.
     */
    void clear();
}
