package com.matching.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC4;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imwrite;

class ImageBandsTest {

    @Test
    void colourMatIsSplitFromBgr() {
        Mat mat = new Mat(5, 7, CV_8UC3, new Scalar(10, 20, 30, 0));

        ImageBands bands = ImageBands.fromMat(mat);

        assertThat(bands.getWidth()).isEqualTo(7);
        assertThat(bands.getHeight()).isEqualTo(5);
        assertThat(bands.getRed().readAll()[4][6]).isEqualTo(30.0);
        assertThat(bands.getGreen().readAll()[0][0]).isEqualTo(20.0);
        assertThat(bands.getBlue().readAll()[2][3]).isEqualTo(10.0);
        mat.release();
    }

    @Test
    void grayMatUsesOneBandForAllChannels() {
        Mat mat = new Mat(4, 4, CV_8UC1, new Scalar(99.0));

        ImageBands bands = ImageBands.fromMat(mat);

        assertThat(bands.getRed()).isSameAs(bands.getGreen()).isSameAs(bands.getBlue());
        assertThat(bands.getRed().readAll()[1][1]).isEqualTo(99.0);
        mat.release();
    }

    @Test
    void readsImageFile(@TempDir Path dir) {
        Mat mat = new Mat(6, 9, CV_8UC3, new Scalar(10, 20, 30, 0));
        Path file = dir.resolve("image.png");
        assertThat(imwrite(file.toString(), mat)).isTrue();
        mat.release();

        ImageBands bands = ImageBands.fromFile(file);

        assertThat(bands.getWidth()).isEqualTo(9);
        assertThat(bands.getHeight()).isEqualTo(6);
        assertThat(bands.getRed().readAll()[0][0]).isEqualTo(30.0);
    }

    @Test
    void decodesImageBytes(@TempDir Path dir) throws Exception {
        Mat mat = new Mat(3, 4, CV_8UC1, new Scalar(42.0));
        Path file = dir.resolve("gray.png");
        assertThat(imwrite(file.toString(), mat)).isTrue();
        mat.release();

        ImageBands bands = ImageBands.fromBytes(Files.readAllBytes(file));

        assertThat(bands.getWidth()).isEqualTo(4);
        assertThat(bands.getHeight()).isEqualTo(3);
        assertThat(bands.getBlue().readAll()[2][3]).isEqualTo(42.0);
        assertThatThrownBy(() -> ImageBands.fromBytes(new byte[]{1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ImageBands.fromBytes(new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void alphaChannelIsIgnored() {
        Mat mat = new Mat(2, 2, CV_8UC4, new Scalar(1, 2, 3, 255));

        ImageBands bands = ImageBands.fromMat(mat);

        assertThat(bands.getRed().readAll()[0][0]).isEqualTo(3.0);
        assertThat(bands.getBlue().readAll()[1][1]).isEqualTo(1.0);
        mat.release();
    }

    @Test
    void rejectsMissingOrUndecodableFiles(@TempDir Path dir) throws Exception {
        Path garbage = dir.resolve("garbage.png");
        Files.write(garbage, new byte[]{1, 2, 3, 4});

        assertThatThrownBy(() -> ImageBands.fromFile(dir.resolve("missing.png")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> ImageBands.fromFile(garbage))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Cannot decode");
        assertThatThrownBy(() -> new ImageBands(null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
