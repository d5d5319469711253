package com.matching.registration;

import com.matching.SURF.FeaturePoint;
import com.matching.SURF.FeaturePointsCollection;
import com.matching.SURF.MatchedPointsCollection;
import com.matching.SURF.SimpleSurf;
import com.matching.imageOperator.ImageBands;
import com.matching.imageOperator.LuminosityConverter;
import com.matching.integralImage.IntegralImage;
import com.matching.scaleSpace.OctaveMap;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Tìm các điểm tương ứng giữa hai ảnh:
 * độ sáng -> ảnh tích phân -> điểm SURF của từng ảnh -> so khớp -> danh sách GCP.
 */
@Slf4j
public class MatchingPointsComputer {

    public List<GroundControlPoint> computeMatchingPoints(ImageBands firstImage, ImageBands secondImage,
                                                          MatchingOptions options) {
        if (options == null) throw new IllegalArgumentException("Matching options are not specified");
        validateOptions(options);

        long start = System.currentTimeMillis();
        FeaturePointsCollection firstPoints = gatherFeaturePoints(firstImage, options);
        FeaturePointsCollection secondPoints = gatherFeaturePoints(secondImage, options);

        SimpleSurf surf = new SimpleSurf(options.getOctaveStart(), options.getOctaveEnd());
        MatchedPointsCollection matched = surf.matchFeaturePoints(firstPoints, secondPoints, options.getMatchingThreshold());

        List<GroundControlPoint> gcps = new ArrayList<>(matched.size());
        for (MatchedPointsCollection.PointPair pair : matched.getPairs()) {
            FeaturePoint p1 = pair.getFirst();
            FeaturePoint p2 = pair.getSecond();
            gcps.add(new GroundControlPoint(p1.getX() + 0.5, p1.getY() + 0.5, p2.getX() + 0.5, p2.getY() + 0.5, 0.0));
        }

        log.info("Computed {} matching points ({} and {} feature points) in {} ms with {}",
                gcps.size(), firstPoints.size(), secondPoints.size(), System.currentTimeMillis() - start, options);
        return gcps;
    }

    public List<GroundControlPoint> computeMatchingPoints(ImageBands firstImage, ImageBands secondImage) {
        return computeMatchingPoints(firstImage, secondImage, MatchingOptions.defaults());
    }

    FeaturePointsCollection gatherFeaturePoints(ImageBands bands, MatchingOptions options) {
        if (bands == null) throw new IllegalArgumentException("Raster bands are not specified");
        if (bands.getWidth() == 0 || bands.getHeight() == 0) {
            throw new IllegalArgumentException("Must have non-zero width and height");
        }

        double[][] luminosity = LuminosityConverter.convertRGBToLuminosity(bands);
        IntegralImage image = new IntegralImage(luminosity);

        SimpleSurf surf = new SimpleSurf(options.getOctaveStart(), options.getOctaveEnd());
        return surf.extractFeaturePoints(image, options.getSurfThreshold());
    }

    private static void validateOptions(MatchingOptions options) {
        if (options.getOctaveStart() <= 0 || options.getOctaveEnd() < 0
                || options.getOctaveStart() > options.getOctaveEnd()
                || options.getOctaveEnd() > OctaveMap.MAX_OCTAVE) {
            throw new IllegalArgumentException("Octave numbers are invalid");
        }
        if (options.getSurfThreshold() < 0) {
            throw new IllegalArgumentException("SURF threshold must not be negative");
        }
    }
}
