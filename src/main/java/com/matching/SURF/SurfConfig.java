package com.matching.SURF;

public class SurfConfig {
    // Descriptor
    public static final int DESCRIPTOR_SIZE = 64;      // 4x4 quadrants x (dx, dy, |dx|, |dy|)
    public static final int DESCRIPTOR_GRID = 4;       // 4x4 quadrants
    public static final int SUB_QUADRANT_GRID = 5;     // 5x5 samples per quadrant
    public static final int HAAR_SCALE = 20;           // descriptor side = 20 * scale
    public static final int HAAR_FILTER_SCALE = 2;     // Haar wavelet side = 2 * scale

    // Matching
    public static final double RATIO_THRESHOLD = 0.8;  // best / secondBest must stay below

    // Default pipeline parameters
    public static final int OCTAVE_START = 2;
    public static final int OCTAVE_END = 2;
    public static final double SURF_THRESHOLD = 0.001;
    public static final double MATCHING_THRESHOLD = 0.015;

    // Luminosity weights
    public static final double RED_WEIGHT = 0.21;
    public static final double GREEN_WEIGHT = 0.72;
    public static final double BLUE_WEIGHT = 0.07;
    public static final double MAX_SAMPLE_VALUE = 255.0;
}
