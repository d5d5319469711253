package com.matching.imageOperator;

import com.matching.SURF.SurfConfig;

/**
 * Chuyển ba band RGB thành ảnh độ sáng chuẩn hóa:
 * (0.21 * R + 0.72 * G + 0.07 * B) / 255
 */
public class LuminosityConverter {

    public static double[][] convertRGBToLuminosity(RasterBand red, RasterBand green, RasterBand blue) {
        if (red == null) throw new IllegalArgumentException("Raster bands are not specified");
        return convertRGBToLuminosity(red, green, blue, red.getXSize(), red.getYSize(), red.getYSize(), red.getXSize());
    }

    /**
     * Reads the window (0, 0, xSize, ySize) of each band into a height x width buffer
     * and combines the three samples per pixel.
     * <p>
     * Only the red band's extent is checked against the requested size; green and blue are read as they are.
     *
     * @throws IllegalArgumentException if a band is missing, the red band is smaller than requested
     *                                  or the buffer size is not positive
     */
    public static double[][] convertRGBToLuminosity(RasterBand red, RasterBand green, RasterBand blue,
                                                    int xSize, int ySize, int height, int width) {
        if (red == null || green == null || blue == null) {
            throw new IllegalArgumentException("Raster bands are not specified");
        }
        if (xSize > red.getXSize() || ySize > red.getYSize()) {
            throw new IllegalArgumentException("Red band has less size than has been requested");
        }
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Buffer isn't specified");
        }

        double[][] redLayer = red.read(0, 0, xSize, ySize, width, height);
        double[][] greenLayer = green.read(0, 0, xSize, ySize, width, height);
        double[][] blueLayer = blue.read(0, 0, xSize, ySize, width, height);

        double[][] image = new double[height][width];
        for (int row = 0; row < height; row++)
            for (int col = 0; col < width; col++) {
                image[row][col] = (redLayer[row][col] * SurfConfig.RED_WEIGHT
                        + greenLayer[row][col] * SurfConfig.GREEN_WEIGHT
                        + blueLayer[row][col] * SurfConfig.BLUE_WEIGHT) / SurfConfig.MAX_SAMPLE_VALUE;
            }
        return image;
    }

    public static double[][] convertRGBToLuminosity(ImageBands bands) {
        if (bands == null) throw new IllegalArgumentException("Raster bands are not specified");
        return convertRGBToLuminosity(bands.getRed(), bands.getGreen(), bands.getBlue());
    }
}
