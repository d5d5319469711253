package com.matching.integralImage;

import lombok.Getter;

/**
 * Ảnh tích phân (summed-area table) của một ảnh xám double[row][col].
 * Cho phép tính tổng một cửa sổ chữ nhật và đáp ứng Haar wavelet trong O(1).
 * Các ô nằm ngoài ảnh được coi là 0.
 */
@Getter
public class IntegralImage {
    private final int width;
    private final int height;

    @Getter(lombok.AccessLevel.NONE)
    private final double[][] sums;

    public IntegralImage(double[][] image) {
        if (image == null || image.length == 0 || image[0] == null || image[0].length == 0) {
            throw new IllegalArgumentException("Image buffer is empty");
        }
        this.height = image.length;
        this.width = image[0].length;
        this.sums = new double[height][width];

        for (int r = 0; r < height; r++) {
            if (image[r] == null || image[r].length != width) {
                throw new IllegalArgumentException("Image row " + r + " has a different width");
            }
            double rowSum = 0;
            for (int c = 0; c < width; c++) {
                rowSum += image[r][c];
                sums[r][c] = (r > 0 ? sums[r - 1][c] : 0) + rowSum;
            }
        }
    }

    /**
     * Tổng của ảnh trên vùng [0..row] x [0..col].
     * Chỉ số âm cho 0, chỉ số vượt biên được kẹp về hàng/cột cuối.
     */
    public double getValue(int row, int col) {
        if (row < 0 || col < 0) return 0;
        return sums[Math.min(row, height - 1)][Math.min(col, width - 1)];
    }

    /**
     * Sum of the window whose top-left cell is (row, col).
     * The window is clipped to the image first.
     */
    public double getRectangleSum(int row, int col, int nWidth, int nHeight) {
        if (nWidth <= 0 || nHeight <= 0) return 0;

        int firstRow = Math.max(row, 0);
        int firstCol = Math.max(col, 0);
        int lastRow = Math.min(row + nHeight, height) - 1;
        int lastCol = Math.min(col + nWidth, width) - 1;
        if (lastRow < firstRow || lastCol < firstCol) return 0;

        double a = getValue(firstRow - 1, firstCol - 1);
        double b = getValue(firstRow - 1, lastCol);
        double c = getValue(lastRow, firstCol - 1);
        double d = getValue(lastRow, lastCol);
        return d - b - c + a;
    }

    /** Horizontal Haar response: right half minus left half of the size x size window. */
    public double haarWaveletX(int row, int col, int size) {
        return getRectangleSum(row, col + size / 2, size / 2, size)
                - getRectangleSum(row, col, size / 2, size);
    }

    /** Vertical Haar response: bottom half minus top half of the size x size window. */
    public double haarWaveletY(int row, int col, int size) {
        return getRectangleSum(row + size / 2, col, size, size / 2)
                - getRectangleSum(row, col, size, size / 2);
    }
}
