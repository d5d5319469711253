package com.matching.imageOperator;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_NEAREST;
import static org.bytedeco.opencv.global.opencv_imgproc.resize;

/**
 * Band dựa trên một Mat OpenCV một kênh (độ sâu bất kỳ).
 * Mat không bị sao chép, người gọi giữ quyền sở hữu.
 */
public class MatRasterBand implements RasterBand {
    private final Mat mat;

    public MatRasterBand(Mat mat) {
        if (mat == null || mat.empty()) throw new IllegalArgumentException("Mat is empty");
        if (mat.channels() != 1) {
            throw new IllegalArgumentException("Mat band must have one channel, got " + mat.channels());
        }
        this.mat = mat;
    }

    @Override
    public int getXSize() {
        return mat.cols();
    }

    @Override
    public int getYSize() {
        return mat.rows();
    }

    @Override
    public double[][] read(int xOff, int yOff, int xSize, int ySize, int bufWidth, int bufHeight) {
        RasterBand.checkWindow(this, xOff, yOff, xSize, ySize, bufWidth, bufHeight);

        Mat window = new Mat(mat, new Rect(xOff, yOff, xSize, ySize));
        Mat samples = new Mat();
        window.convertTo(samples, CV_64F);

        Mat resized = samples;
        if (bufWidth != xSize || bufHeight != ySize) {
            resized = new Mat();
            resize(samples, resized, new Size(bufWidth, bufHeight), 0, 0, INTER_NEAREST);
        }

        double[][] buffer = new double[bufHeight][bufWidth];
        DoubleIndexer idx = resized.createIndexer();
        for (int r = 0; r < bufHeight; r++)
            for (int c = 0; c < bufWidth; c++)
                buffer[r][c] = idx.get(r, c);
        idx.release();

        if (resized != samples) resized.release();
        samples.release();
        window.release();
        return buffer;
    }
}
