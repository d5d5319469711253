package com.matching.SURF;

import com.matching.integralImage.IntegralImage;

/**
 * Tạo bộ mô tả SURF 64 chiều cho một điểm đặc trưng.
 * Vùng mô tả cạnh 20 * scale được chia lưới 4x4 quadrant, mỗi quadrant lấy mẫu 5x5 điểm.
 * Mỗi quadrant đóng góp (Σdx, Σdy, Σ|dx|, Σ|dy|) của đáp ứng Haar wavelet. Không chuẩn hóa.
 */
public class SurfDescriptorBuilder {

    public void buildDescriptor(FeaturePoint point, IntegralImage image) {
        if (point == null || image == null) {
            throw new IllegalArgumentException("Feature point and integral image must be specified");
        }
        if (!(point.getScale() > 0)) {
            throw new IllegalArgumentException("Feature point scale must be positive: " + point);
        }
        point.setDescriptor(computeDescriptor(point, image));
    }

    double[] computeDescriptor(FeaturePoint point, IntegralImage image) {
        int haarFilterSize = (int) (SurfConfig.HAAR_FILTER_SCALE * point.getScale());
        int descSide = (int) (SurfConfig.HAAR_SCALE * point.getScale());
        // Small scales truncate to zero steps, keep sampling the full 4x4 / 5x5 grid anyway
        int quadStep = Math.max(descSide / SurfConfig.DESCRIPTOR_GRID, 1);
        int subQuadStep = Math.max(quadStep / SurfConfig.SUB_QUADRANT_GRID, 1);

        int leftTopRow = point.getY() - descSide / 2;
        int leftTopCol = point.getX() - descSide / 2;

        double[] descriptor = new double[SurfConfig.DESCRIPTOR_SIZE];
        int count = 0;

        for (int qr = 0; qr < SurfConfig.DESCRIPTOR_GRID; qr++) {
            for (int qc = 0; qc < SurfConfig.DESCRIPTOR_GRID; qc++) {
                int r = leftTopRow + qr * quadStep;
                int c = leftTopCol + qc * quadStep;

                double dx = 0, dy = 0, absDx = 0, absDy = 0;

                for (int sr = 0; sr < SurfConfig.SUB_QUADRANT_GRID; sr++) {
                    for (int sc = 0; sc < SurfConfig.SUB_QUADRANT_GRID; sc++) {
                        // Tâm xấp xỉ của sub-quadrant
                        int centerRow = r + sr * subQuadStep + subQuadStep / 2;
                        int centerCol = c + sc * subQuadStep + subQuadStep / 2;

                        // Góc trên trái của cửa sổ Haar
                        int curRow = centerRow - haarFilterSize / 2;
                        int curCol = centerCol - haarFilterSize / 2;

                        double curDx = image.haarWaveletX(curRow, curCol, haarFilterSize);
                        double curDy = image.haarWaveletY(curRow, curCol, haarFilterSize);

                        dx += curDx;
                        dy += curDy;
                        absDx += Math.abs(curDx);
                        absDy += Math.abs(curDy);
                    }
                }

                descriptor[count++] = dx;
                descriptor[count++] = dy;
                descriptor[count++] = absDx;
                descriptor[count++] = absDy;
            }
        }
        return descriptor;
    }
}
