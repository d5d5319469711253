package com.matching.SURF;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Các cặp điểm đã khớp giữa hai ảnh.
 * Mỗi cặp luôn giữ đúng vai trò (điểm ảnh thứ nhất, điểm ảnh thứ hai) của lời gọi match.
 */
public class MatchedPointsCollection {
    private final List<PointPair> pairs = new ArrayList<>();

    public void addPoints(FeaturePoint first, FeaturePoint second) {
        if (first == null || second == null) {
            throw new IllegalArgumentException("Both points of a matched pair must be specified");
        }
        pairs.add(new PointPair(first, second));
    }

    public PointPair getPair(int index) {
        return pairs.get(index);
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    public List<PointPair> getPairs() {
        return Collections.unmodifiableList(pairs);
    }

    @Override
    public String toString() {
        return String.format("MatchedPointsCollection[pairs=%d]", pairs.size());
    }

    @Getter
    public static class PointPair {
        private final FeaturePoint first;
        private final FeaturePoint second;

        public PointPair(FeaturePoint first, FeaturePoint second) {
            this.first = first;
            this.second = second;
        }

        @Override
        public String toString() {
            return first + " <-> " + second;
        }
    }
}
