package com.matching.SURF;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Tentative match found inside one matcher call: indexes into the outer and
 * inner collections plus their descriptor distance (normalized in place later).
 */
@AllArgsConstructor
@Getter
class MatchedPointPairInfo {
    private final int outerIndex;
    private final int innerIndex;
    private double distance;

    void normalize(double maxDistance) {
        this.distance /= maxDistance;
    }
}
