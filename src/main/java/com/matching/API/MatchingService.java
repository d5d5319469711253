package com.matching.API;

import com.matching.imageOperator.ImageBands;
import com.matching.registration.GroundControlPoint;
import com.matching.registration.MatchingOptions;
import com.matching.registration.MatchingPointsComputer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

@Service
public class MatchingService {

    @Value("${matching.octave-start}")
    private int defaultOctaveStart;

    @Value("${matching.octave-end}")
    private int defaultOctaveEnd;

    @Value("${matching.surf-threshold}")
    private double defaultSurfThreshold;

    @Value("${matching.matching-threshold}")
    private double defaultMatchingThreshold;

    private final MatchingPointsComputer computer = new MatchingPointsComputer();

    /**
     * Request parameters override the configured defaults; null keeps the default.
     */
    public MatchingOptions resolveOptions(Integer octaveStart, Integer octaveEnd,
                                          Double surfThreshold, Double matchingThreshold) {
        return new MatchingOptions(
                octaveStart != null ? octaveStart : defaultOctaveStart,
                octaveEnd != null ? octaveEnd : defaultOctaveEnd,
                surfThreshold != null ? surfThreshold : defaultSurfThreshold,
                matchingThreshold != null ? matchingThreshold : defaultMatchingThreshold);
    }

    public List<GroundControlPoint> matchImages(Path firstImage, Path secondImage, MatchingOptions options) {
        ImageBands first = ImageBands.fromFile(firstImage);
        ImageBands second = ImageBands.fromFile(secondImage);
        return computer.computeMatchingPoints(first, second, options);
    }
}
