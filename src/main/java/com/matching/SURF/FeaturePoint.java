package com.matching.SURF;

import lombok.Getter;

import java.util.Arrays;

/**
 * Điểm đặc trưng SURF tìm được trên một lớp Hessian.
 * Tọa độ (x, y) tính theo pixel của ảnh làm việc, descriptor gồm 64 giá trị.
 */
@Getter
public class FeaturePoint {
    private final int x, y;
    private final double scale;
    private final int radius;
    private final boolean sign; // true khi vết Hessian (Laplacian) >= 0

    @Getter(lombok.AccessLevel.NONE)
    private double[] descriptor;

    public FeaturePoint(int x, int y, double scale, int radius, boolean sign) {
        this.x = x;
        this.y = y;
        this.scale = scale;
        this.radius = radius;
        this.sign = sign;
    }

    /** Deep copy, descriptor included. */
    public FeaturePoint(FeaturePoint other) {
        this(other.x, other.y, other.scale, other.radius, other.sign);
        if (other.descriptor != null) this.descriptor = other.descriptor.clone();
    }

    /**
     * Gán descriptor đúng một lần.
     * @throws IllegalArgumentException nếu độ dài khác 64
     * @throws IllegalStateException nếu descriptor đã được gán
     */
    public void setDescriptor(double[] values) {
        if (values == null || values.length != SurfConfig.DESCRIPTOR_SIZE) {
            throw new IllegalArgumentException("Descriptor must have exactly " + SurfConfig.DESCRIPTOR_SIZE + " values");
        }
        if (this.descriptor != null) {
            throw new IllegalStateException("Descriptor is already set for " + this);
        }
        this.descriptor = values.clone();
    }

    public boolean hasDescriptor() {
        return descriptor != null;
    }

    public double[] getDescriptor() {
        return descriptor == null ? null : descriptor.clone();
    }

    /** Reads one descriptor value without copying the array. */
    public double getDescriptorValue(int index) {
        if (descriptor == null) throw new IllegalStateException("Descriptor is not set for " + this);
        return descriptor[index];
    }

    @Override
    public String toString() {
        return String.format("FeaturePoint[(%d, %d) scale=%.1f radius=%d sign=%s]",
                x, y, scale, radius, sign ? "+" : "-");
    }

    public boolean equal(FeaturePoint that) {
        if (that == null) return false;
        return this.x == that.x && this.y == that.y && this.scale == that.scale
                && this.radius == that.radius && this.sign == that.sign
                && Arrays.equals(this.descriptor, that.descriptor);
    }
}
