package com.matching.imageOperator;

/**
 * Một kênh ảnh (band) có thể đọc theo cửa sổ.
 */
public interface RasterBand {

    int getXSize();

    int getYSize();

    /**
     * Reads the window (xOff, yOff, xSize, ySize) into a bufHeight x bufWidth buffer,
     * resampling with nearest neighbour when the sizes differ.
     *
     * @return samples indexed [row][col]
     * @throws IllegalArgumentException if the window leaves the band or the buffer is empty
     */
    double[][] read(int xOff, int yOff, int xSize, int ySize, int bufWidth, int bufHeight);

    default double[][] readAll() {
        return read(0, 0, getXSize(), getYSize(), getXSize(), getYSize());
    }

    static void checkWindow(RasterBand band, int xOff, int yOff, int xSize, int ySize, int bufWidth, int bufHeight) {
        if (xOff < 0 || yOff < 0 || xSize <= 0 || ySize <= 0
                || xOff + xSize > band.getXSize() || yOff + ySize > band.getYSize()) {
            throw new IllegalArgumentException(String.format(
                    "Window (%d, %d, %d, %d) is outside of %dx%d band",
                    xOff, yOff, xSize, ySize, band.getXSize(), band.getYSize()));
        }
        if (bufWidth <= 0 || bufHeight <= 0) {
            throw new IllegalArgumentException(String.format("Buffer size %dx%d is invalid", bufWidth, bufHeight));
        }
    }
}
