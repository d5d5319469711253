package com.matching.registration;

import com.matching.SURF.SurfConfig;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public class MatchingOptions {
    private final int octaveStart;
    private final int octaveEnd;
    private final double surfThreshold;     // minimum Hessian determinant of a feature point
    private final double matchingThreshold; // maximum normalized descriptor distance of a pair

    public static MatchingOptions defaults() {
        return new MatchingOptions(SurfConfig.OCTAVE_START, SurfConfig.OCTAVE_END,
                SurfConfig.SURF_THRESHOLD, SurfConfig.MATCHING_THRESHOLD);
    }

    @Override
    public String toString() {
        return String.format("MatchingOptions[octaves=%d..%d, surfThreshold=%s, matchingThreshold=%s]",
                octaveStart, octaveEnd, surfThreshold, matchingThreshold);
    }
}
