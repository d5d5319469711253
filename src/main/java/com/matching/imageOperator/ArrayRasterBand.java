package com.matching.imageOperator;

import java.util.Arrays;

/**
 * Band trong bộ nhớ, dữ liệu double[row][col].
 */
public class ArrayRasterBand implements RasterBand {
    private final double[][] data;
    private final int xSize;
    private final int ySize;

    public ArrayRasterBand(double[][] data) {
        if (data == null || data.length == 0 || data[0] == null || data[0].length == 0) {
            throw new IllegalArgumentException("Band data is empty");
        }
        this.ySize = data.length;
        this.xSize = data[0].length;
        this.data = new double[ySize][];
        for (int r = 0; r < ySize; r++) {
            if (data[r] == null || data[r].length != xSize) {
                throw new IllegalArgumentException("Band row " + r + " has a different width");
            }
            this.data[r] = data[r].clone();
        }
    }

    /** Band filled with a single value. */
    public static ArrayRasterBand constant(int xSize, int ySize, double value) {
        double[][] data = new double[ySize][xSize];
        for (double[] row : data) Arrays.fill(row, value);
        return new ArrayRasterBand(data);
    }

    @Override
    public int getXSize() {
        return xSize;
    }

    @Override
    public int getYSize() {
        return ySize;
    }

    @Override
    public double[][] read(int xOff, int yOff, int xSize, int ySize, int bufWidth, int bufHeight) {
        RasterBand.checkWindow(this, xOff, yOff, xSize, ySize, bufWidth, bufHeight);

        double[][] buffer = new double[bufHeight][bufWidth];
        for (int r = 0; r < bufHeight; r++) {
            int srcRow = yOff + Math.min((int) ((r + 0.5) * ySize / bufHeight), ySize - 1);
            for (int c = 0; c < bufWidth; c++) {
                int srcCol = xOff + Math.min((int) ((c + 0.5) * xSize / bufWidth), xSize - 1);
                buffer[r][c] = data[srcRow][srcCol];
            }
        }
        return buffer;
    }
}
