package com.matching.scaleSpace;

import com.matching.integralImage.IntegralImage;
import lombok.Getter;

import java.util.Arrays;

/**
 * Một lớp (octave, interval) của không gian tỷ lệ Hessian.
 * Lưu định thức Hessian xấp xỉ bằng bộ lọc hộp và dấu của vết (Laplacian) cho từng pixel.
 *
 * filterSize = 3 * (2^octave * interval + 1), radius = (filterSize - 1) / 2, scale = 2^octave
 */
@Getter
public class OctaveLayer {
    // Weight of dxy relative to dxx, dyy in the approximated determinant
    private static final double DXY_WEIGHT = 0.9;

    private final int octave;
    private final int interval;
    private final int filterSize;
    private final int radius;
    private final double scale;

    private int width;
    private int height;

    @Getter(lombok.AccessLevel.NONE)
    private double[][] detHessians;
    @Getter(lombok.AccessLevel.NONE)
    private boolean[][] signs;

    public OctaveLayer(int octave, int interval) {
        if (octave < 1 || octave > OctaveMap.MAX_OCTAVE || interval < 1 || interval > OctaveMap.INTERVALS) {
            throw new IllegalArgumentException(String.format(
                    "Octave numbers are invalid: octave=%d, interval=%d", octave, interval));
        }
        this.octave = octave;
        this.interval = interval;
        this.filterSize = 3 * ((1 << octave) * interval + 1);
        this.radius = (filterSize - 1) / 2;
        this.scale = Math.pow(2.0, octave);
    }

    /**
     * Layer with precomputed determinant and sign grids, both [height][width].
     */
    OctaveLayer(int octave, int interval, double[][] detHessians, boolean[][] signs) {
        this(octave, interval);
        this.height = detHessians.length;
        this.width = detHessians[0].length;
        this.detHessians = detHessians;
        this.signs = signs;
    }

    public void computeLayer(IntegralImage image) {
        this.width = image.getWidth();
        this.height = image.getHeight();
        this.detHessians = new double[height][width];
        this.signs = new boolean[height][width];
        for (boolean[] row : signs) Arrays.fill(row, true);

        int lobe = filterSize / 3;
        int longPart = 2 * lobe - 1;
        double normalization = (double) filterSize * filterSize;

        // Bộ lọc phải nằm trọn trong ảnh
        for (int r = radius; r < height - radius; r++) {
            for (int c = radius; c < width - radius; c++) {
                double dxx = image.getRectangleSum(r - lobe + 1, c - radius, filterSize, longPart)
                        - 3 * image.getRectangleSum(r - lobe + 1, c - (lobe - 1) / 2, lobe, longPart);
                double dyy = image.getRectangleSum(r - radius, c - lobe + 1, longPart, filterSize)
                        - 3 * image.getRectangleSum(r - (lobe - 1) / 2, c - lobe + 1, longPart, lobe);
                double dxy = image.getRectangleSum(r - lobe, c - lobe, lobe, lobe)
                        + image.getRectangleSum(r + 1, c + 1, lobe, lobe)
                        - image.getRectangleSum(r - lobe, c + 1, lobe, lobe)
                        - image.getRectangleSum(r + 1, c - lobe, lobe, lobe);

                dxx /= normalization;
                dyy /= normalization;
                dxy /= normalization;

                detHessians[r][c] = dxx * dyy - DXY_WEIGHT * DXY_WEIGHT * dxy * dxy;
                signs[r][c] = dxx + dyy >= 0;
            }
        }
    }

    public double getDetHessian(int row, int col) {
        return detHessians[row][col];
    }

    public boolean getSign(int row, int col) {
        return signs[row][col];
    }

    @Override
    public String toString() {
        return String.format("OctaveLayer[octave=%d, interval=%d, filter=%d, radius=%d, scale=%.0f, %dx%d]",
                octave, interval, filterSize, radius, scale, width, height);
    }
}
