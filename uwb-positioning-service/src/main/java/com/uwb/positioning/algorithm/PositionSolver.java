package com.uwb.positioning.algorithm;

import java.util.List;
import java.util.Optional;

/**
 * Computes a tag position from anchor ranges.
 *
 * <p>Implementations never throw for geometric problems: too few anchors or a degenerate anchor
 * arrangement is reported as an empty result.
 */
public interface PositionSolver {

    int MIN_ANCHORS = 3;

    /**
     * Solves for the tag position.
     *
     * @param anchors valid anchor ranges
     * @return the position, or empty when the system is unsolvable
     */
    Optional<PlanarPosition> solve(List<AnchorRange> anchors);

    String getName();
}
