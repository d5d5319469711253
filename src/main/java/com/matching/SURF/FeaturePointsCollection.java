package com.matching.SURF;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Append-only list of feature points, kept in extraction order
 * (octave ascending, interval ascending, row-major inside a layer).
 */
public class FeaturePointsCollection implements Iterable<FeaturePoint> {
    private final List<FeaturePoint> points = new ArrayList<>();

    public void addPoint(FeaturePoint point) {
        if (point == null) throw new IllegalArgumentException("Feature point isn't specified");
        points.add(point);
    }

    public FeaturePoint getPoint(int index) {
        return points.get(index);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public List<FeaturePoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    @Override
    public Iterator<FeaturePoint> iterator() {
        return getPoints().iterator();
    }

    @Override
    public String toString() {
        return String.format("FeaturePointsCollection[size=%d]", points.size());
    }
}
