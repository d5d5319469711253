package com.matching.registration;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Cặp tọa độ tương ứng: (pixel, line) trên ảnh thứ nhất, (x, y) trên ảnh thứ hai.
 * Tọa độ lấy tại tâm pixel (+0.5).
 */
@AllArgsConstructor
@Getter
public class GroundControlPoint {
    private final double pixel;
    private final double line;
    private final double x;
    private final double y;
    private final double z;

    @Override
    public String toString() {
        return String.format("GCP[(%.1f, %.1f) -> (%.1f, %.1f)]", pixel, line, x, y);
    }
}
