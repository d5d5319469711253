package com.matching.SURF;

import com.matching.integralImage.IntegralImage;
import com.matching.scaleSpace.OctaveLayer;
import com.matching.scaleSpace.OctaveMap;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Bộ phát hiện và so khớp điểm đặc trưng SURF đơn giản.
 * <p>
 * Mỗi instance sở hữu một {@link OctaveMap} cho khoảng octave [octaveStart, octaveEnd];
 * map này được tính lại ở mỗi lần trích xuất nên instance không an toàn khi dùng đa luồng.
 */
@Slf4j
@Getter
public class SimpleSurf {
    private final int octaveStart;
    private final int octaveEnd;

    @Getter(lombok.AccessLevel.NONE)
    private final OctaveMap octaveMap;
    @Getter(lombok.AccessLevel.NONE)
    private final SurfDescriptorBuilder descriptorBuilder;
    @Getter(lombok.AccessLevel.NONE)
    private final SurfFeatureMatcher matcher;

    public SimpleSurf(int octaveStart, int octaveEnd) {
        if (octaveStart < 1 || octaveEnd < octaveStart || octaveEnd > OctaveMap.MAX_OCTAVE) {
            throw new IllegalArgumentException(String.format(
                    "Octave numbers are invalid: start=%d, end=%d", octaveStart, octaveEnd));
        }
        this.octaveStart = octaveStart;
        this.octaveEnd = octaveEnd;
        this.octaveMap = new OctaveMap(octaveStart, octaveEnd);
        this.descriptorBuilder = new SurfDescriptorBuilder();
        this.matcher = new SurfFeatureMatcher();
    }

    public SimpleSurf() {
        this(SurfConfig.OCTAVE_START, SurfConfig.OCTAVE_END);
    }

    public FeaturePointsCollection extractFeaturePoints(IntegralImage image, double threshold) {
        FeaturePointsCollection collection = new FeaturePointsCollection();
        extractFeaturePoints(image, collection, threshold);
        return collection;
    }

    /**
     * Finds Hessian extrema over every interval triplet of every octave and appends
     * one described feature point per extremum. The collection is never cleared.
     */
    public void extractFeaturePoints(IntegralImage image, FeaturePointsCollection collection, double threshold) {
        if (image == null || collection == null) {
            throw new IllegalArgumentException("Integral image and output collection must be specified");
        }
        long startTime = System.currentTimeMillis();
        int before = collection.size();

        octaveMap.computeMap(image);

        for (int oct = octaveStart; oct <= octaveEnd; oct++) {
            int found = 0;
            for (int k = 0; k < OctaveMap.INTERVALS - 2; k++) {
                OctaveLayer bot = octaveMap.getLayer(oct, k);
                OctaveLayer mid = octaveMap.getLayer(oct, k + 1);
                OctaveLayer top = octaveMap.getLayer(oct, k + 2);

                for (int i = 0; i < mid.getHeight(); i++) {
                    for (int j = 0; j < mid.getWidth(); j++) {
                        if (octaveMap.pointIsExtremum(i, j, bot, mid, top, threshold)) {
                            FeaturePoint point = new FeaturePoint(j, i, mid.getScale(), mid.getRadius(), mid.getSign(i, j));
                            descriptorBuilder.buildDescriptor(point, image);
                            collection.addPoint(point);
                            found++;
                        }
                    }
                }
            }
            log.debug("Octave {}: {} feature points", oct, found);
        }

        log.info("Extracted {} feature points from {}x{} image in {} ms (octaves {}..{}, threshold={})",
                collection.size() - before, image.getWidth(), image.getHeight(),
                System.currentTimeMillis() - startTime, octaveStart, octaveEnd, threshold);
    }

    public MatchedPointsCollection matchFeaturePoints(FeaturePointsCollection firstCollection,
                                                      FeaturePointsCollection secondCollection,
                                                      double threshold) {
        return matcher.match(firstCollection, secondCollection, threshold);
    }

    public void matchFeaturePoints(MatchedPointsCollection matched,
                                   FeaturePointsCollection firstCollection,
                                   FeaturePointsCollection secondCollection,
                                   double threshold) {
        matcher.match(matched, firstCollection, secondCollection, threshold);
    }

    /** Khoảng cách Euclid giữa hai descriptor 64 chiều. */
    public static double euclideanDistance(FeaturePoint firstPoint, FeaturePoint secondPoint) {
        double sum = 0.0;
        for (int i = 0; i < SurfConfig.DESCRIPTOR_SIZE; i++) {
            double d = firstPoint.getDescriptorValue(i) - secondPoint.getDescriptorValue(i);
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
