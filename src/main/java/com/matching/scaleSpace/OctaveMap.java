package com.matching.scaleSpace;

import com.matching.integralImage.IntegralImage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Kim tự tháp Hessian: INTERVALS lớp cho mỗi octave trong khoảng [octaveStart, octaveEnd].
 */
@Slf4j
@Getter
public class OctaveMap {
    public static final int INTERVALS = 4;
    // Largest octave whose filter sizes (up to 3 * (2^27 * 4 + 1)) still fit in an int
    public static final int MAX_OCTAVE = 27;

    private final int octaveStart;
    private final int octaveEnd;

    @Getter(lombok.AccessLevel.NONE)
    private final OctaveLayer[][] layers;

    public OctaveMap(int octaveStart, int octaveEnd) {
        if (octaveStart < 1 || octaveEnd < octaveStart || octaveEnd > MAX_OCTAVE) {
            throw new IllegalArgumentException(String.format(
                    "Octave numbers are invalid: start=%d, end=%d", octaveStart, octaveEnd));
        }
        this.octaveStart = octaveStart;
        this.octaveEnd = octaveEnd;
        this.layers = new OctaveLayer[octaveEnd][INTERVALS];

        for (int oct = octaveStart; oct <= octaveEnd; oct++)
            for (int i = 1; i <= INTERVALS; i++)
                layers[oct - 1][i - 1] = new OctaveLayer(oct, i);
    }

    public void computeMap(IntegralImage image) {
        for (int oct = octaveStart; oct <= octaveEnd; oct++) {
            for (int i = 0; i < INTERVALS; i++) {
                layers[oct - 1][i].computeLayer(image);
            }
            log.debug("Computed Hessian layers of octave {} for {}x{} image", oct, image.getWidth(), image.getHeight());
        }
    }

    /**
     * @param octave   octave number, 1-based, inside [octaveStart, octaveEnd]
     * @param interval interval index, 0-based, below INTERVALS
     */
    public OctaveLayer getLayer(int octave, int interval) {
        if (octave < octaveStart || octave > octaveEnd || interval < 0 || interval >= INTERVALS) {
            throw new IllegalArgumentException(String.format("No layer for octave %d, interval %d", octave, interval));
        }
        return layers[octave - 1][interval];
    }

    /**
     * Kiểm tra điểm (row, col) của lớp giữa có phải cực đại địa phương trên 26 lân cận
     * (3x3 của lớp dưới, lớp giữa, lớp trên) và không nhỏ hơn ngưỡng hay không.
     */
    public boolean pointIsExtremum(int row, int col, OctaveLayer bot, OctaveLayer mid, OctaveLayer top, double threshold) {
        // Every neighbour must lie inside the top (widest) filter's support
        int radius = top.getRadius();
        if (row <= radius || col <= radius || row + radius >= top.getHeight() || col + radius >= top.getWidth())
            return false;

        double curPoint = mid.getDetHessian(row, col);
        if (curPoint < threshold) return false;

        for (int i = -1; i <= 1; i++) {
            for (int j = -1; j <= 1; j++) {
                double topPoint = top.getDetHessian(row + i, col + j);
                double midPoint = mid.getDetHessian(row + i, col + j);
                double botPoint = bot.getDetHessian(row + i, col + j);

                if (topPoint >= curPoint || botPoint >= curPoint) return false;
                if ((i != 0 || j != 0) && midPoint >= curPoint) return false;
            }
        }
        return true;
    }
}
