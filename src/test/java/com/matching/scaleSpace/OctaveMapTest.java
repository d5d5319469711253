package com.matching.scaleSpace;

import com.matching.SyntheticImages;
import com.matching.integralImage.IntegralImage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OctaveMapTest {

    private static final int SIZE = 25;
    private static final int CENTER = 12;

    @Test
    void layerGeometry() {
        OctaveLayer first = new OctaveLayer(1, 1);
        assertThat(first.getFilterSize()).isEqualTo(9);
        assertThat(first.getRadius()).isEqualTo(4);
        assertThat(first.getScale()).isEqualTo(2.0);

        OctaveLayer last = new OctaveLayer(2, 4);
        assertThat(last.getFilterSize()).isEqualTo(51);
        assertThat(last.getRadius()).isEqualTo(25);
        assertThat(last.getScale()).isEqualTo(4.0);
    }

    @Test
    void rejectsInvalidOctaveRange() {
        assertThatThrownBy(() -> new OctaveMap(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OctaveMap(3, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OctaveMap(1, 32)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void largestOctaveKeepsPositiveFilterSizes() {
        OctaveLayer widest = new OctaveLayer(OctaveMap.MAX_OCTAVE, OctaveMap.INTERVALS);

        assertThat(widest.getFilterSize()).isEqualTo(3 * ((1 << OctaveMap.MAX_OCTAVE) * OctaveMap.INTERVALS + 1));
        assertThat(widest.getFilterSize()).isPositive();
        assertThat(widest.getRadius()).isPositive();

        assertThatThrownBy(() -> new OctaveLayer(OctaveMap.MAX_OCTAVE + 1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OctaveLayer(32, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OctaveLayer(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void layersExistOnlyInsideTheRange() {
        OctaveMap map = new OctaveMap(2, 3);

        assertThat(map.getLayer(2, 0).getInterval()).isEqualTo(1);
        assertThat(map.getLayer(3, OctaveMap.INTERVALS - 1).getInterval()).isEqualTo(OctaveMap.INTERVALS);
        assertThatThrownBy(() -> map.getLayer(1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> map.getLayer(2, OctaveMap.INTERVALS)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void uniformImageHasZeroDeterminant() {
        OctaveMap map = new OctaveMap(1, 1);
        map.computeMap(new IntegralImage(SyntheticImages.constant(40, 40, 1.0)));

        for (int i = 0; i < OctaveMap.INTERVALS; i++) {
            OctaveLayer layer = map.getLayer(1, i);
            assertThat(layer.getWidth()).isEqualTo(40);
            assertThat(layer.getHeight()).isEqualTo(40);
            for (int r = 0; r < 40; r++)
                for (int c = 0; c < 40; c++)
                    assertThat(layer.getDetHessian(r, c)).isZero();
        }
    }

    @Test
    void brightBlobHasPositiveDeterminantAndNegativeTrace() {
        OctaveMap map = new OctaveMap(1, 1);
        map.computeMap(new IntegralImage(SyntheticImages.twoBlobs()));
        OctaveLayer mid = map.getLayer(1, 1);

        assertThat(mid.getDetHessian(20, 44)).isCloseTo(0.64, within(1e-9));
        assertThat(mid.getSign(20, 44)).isFalse();
        assertThat(mid.getDetHessian(44, 20)).isCloseTo(0.64, within(1e-9));
        assertThat(mid.getSign(44, 20)).isTrue();
    }

    @Test
    void strictMaximumOverAllNeighboursIsExtremum() {
        OctaveMap map = new OctaveMap(1, 1);
        OctaveLayer[] layers = peakLayers(1.0, 0.5, 0.5);

        assertThat(map.pointIsExtremum(CENTER, CENTER, layers[0], layers[1], layers[2], 0.1)).isTrue();
        assertThat(map.pointIsExtremum(CENTER, CENTER + 1, layers[0], layers[1], layers[2], 0.0)).isFalse();
    }

    @Test
    void thresholdIsAMinimum() {
        OctaveMap map = new OctaveMap(1, 1);
        OctaveLayer[] layers = peakLayers(1.0, 0.5, 0.5);

        assertThat(map.pointIsExtremum(CENTER, CENTER, layers[0], layers[1], layers[2], 1.0)).isTrue();
        assertThat(map.pointIsExtremum(CENTER, CENTER, layers[0], layers[1], layers[2], 1.01)).isFalse();
    }

    @Test
    void equalNeighbourInAnyLayerIsNotExtremum() {
        OctaveMap map = new OctaveMap(1, 1);

        OctaveLayer[] topTie = peakLayers(1.0, 0.5, 1.0);
        assertThat(map.pointIsExtremum(CENTER, CENTER, topTie[0], topTie[1], topTie[2], 0.0)).isFalse();

        OctaveLayer[] bottomTie = peakLayers(1.0, 1.0, 0.5);
        assertThat(map.pointIsExtremum(CENTER, CENTER, bottomTie[0], bottomTie[1], bottomTie[2], 0.0)).isFalse();

        OctaveLayer[] midTie = peakLayers(1.0, 0.5, 0.5);
        double[][] det = new double[SIZE][SIZE];
        det[CENTER][CENTER] = 1.0;
        det[CENTER - 1][CENTER + 1] = 1.0;
        midTie[1] = new OctaveLayer(1, 2, det, new boolean[SIZE][SIZE]);
        assertThat(map.pointIsExtremum(CENTER, CENTER, midTie[0], midTie[1], midTie[2], 0.0)).isFalse();
    }

    @Test
    void pointTooCloseToTheBorderIsNotExtremum() {
        OctaveMap map = new OctaveMap(1, 1);
        // top layer of the first triplet has radius 10
        OctaveLayer[] layers = peakLayers(1.0, 0.5, 0.5);
        int row = 10;
        layers[1] = withPeak(1, 2, row, CENTER, 1.0);

        assertThat(map.pointIsExtremum(row, CENTER, layers[0], layers[1], layers[2], 0.0)).isFalse();
    }

    private static OctaveLayer[] peakLayers(double mid, double bottom, double top) {
        return new OctaveLayer[]{
                withPeak(1, 1, CENTER, CENTER, bottom),
                withPeak(1, 2, CENTER, CENTER, mid),
                withPeak(1, 3, CENTER, CENTER, top),
        };
    }

    private static OctaveLayer withPeak(int octave, int interval, int row, int col, double value) {
        double[][] det = new double[SIZE][SIZE];
        boolean[][] signs = new boolean[SIZE][SIZE];
        det[row][col] = value;
        return new OctaveLayer(octave, interval, det, signs);
    }
}
