package com.matching.imageOperator;

import lombok.Getter;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_core.split;
import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_UNCHANGED;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imdecode;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imread;

/**
 * Ba band đỏ, lục, lam của một ảnh, đã sao chép sang bộ nhớ Java.
 * OpenCV lưu theo thứ tự BGR(A); ảnh một kênh dùng cùng một band cho cả ba vai trò.
 */
@Getter
public class ImageBands {
    private final RasterBand red;
    private final RasterBand green;
    private final RasterBand blue;

    public ImageBands(RasterBand red, RasterBand green, RasterBand blue) {
        if (red == null || green == null || blue == null) {
            throw new IllegalArgumentException("Raster bands are not specified");
        }
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    /** Gray image: one band plays red, green and blue. */
    public static ImageBands gray(RasterBand band) {
        return new ImageBands(band, band, band);
    }

    public int getWidth() {
        return red.getXSize();
    }

    public int getHeight() {
        return red.getYSize();
    }

    public static ImageBands fromFile(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Image file not found: " + path);
        }
        Mat img = imread(path.toString(), IMREAD_UNCHANGED);
        if (img == null || img.empty()) {
            throw new IllegalArgumentException("Cannot decode image: " + path.getFileName());
        }
        try {
            return fromMat(img);
        } finally {
            img.release();
        }
    }

    /** Decodes an encoded image (PNG, JPEG, TIFF...) held in memory. */
    public static ImageBands fromBytes(byte[] data) {
        if (data == null || data.length == 0) throw new IllegalArgumentException("Image data is empty");

        BytePointer pointer = new BytePointer(data);
        Mat encoded = new Mat(1, data.length, CV_8UC1, pointer);
        Mat img = imdecode(encoded, IMREAD_UNCHANGED);
        try {
            if (img == null || img.empty()) {
                throw new IllegalArgumentException("Cannot decode image data (" + data.length + " bytes)");
            }
            return fromMat(img);
        } finally {
            if (img != null) img.release();
            encoded.release();
            pointer.close();
        }
    }

    public static ImageBands fromMat(Mat img) {
        if (img == null || img.empty()) throw new IllegalArgumentException("Image is empty");

        int channels = img.channels();
        if (channels < 3) {
            // Gray, or gray + alpha
            if (channels == 1) return gray(copyBand(img));
            MatVector planes = new MatVector();
            split(img, planes);
            try {
                return gray(copyBand(planes.get(0)));
            } finally {
                planes.close();
            }
        }

        MatVector planes = new MatVector();
        split(img, planes);
        try {
            return new ImageBands(copyBand(planes.get(2)), copyBand(planes.get(1)), copyBand(planes.get(0)));
        } finally {
            planes.close();
        }
    }

    private static RasterBand copyBand(Mat plane) {
        return new ArrayRasterBand(new MatRasterBand(plane).readAll());
    }
}
