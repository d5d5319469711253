package com.matching.SURF;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * So khớp hai tập điểm đặc trưng SURF.
 * <p>
 * Tập nhỏ hơn được duyệt ở vòng ngoài. Với mỗi điểm ngoài, tìm láng giềng gần nhất và gần thứ hai
 * trong các điểm trong chưa bị chiếm và cùng dấu Laplacian (Lowe ratio test, ngưỡng 0.8).
 * Điểm trong được chiếm ngay khi khớp: điểm ngoài duyệt trước được ưu tiên (greedy, không tối ưu toàn cục).
 * Sau đó khoảng cách được chuẩn hóa theo giá trị lớn nhất và lọc theo ngưỡng của người gọi.
 */
@Slf4j
public class SurfFeatureMatcher {

    public MatchedPointsCollection match(FeaturePointsCollection firstCollection,
                                         FeaturePointsCollection secondCollection,
                                         double threshold) {
        MatchedPointsCollection matched = new MatchedPointsCollection();
        match(matched, firstCollection, secondCollection, threshold);
        return matched;
    }

    /**
     * Appends the surviving pairs to {@code matched}, labelled (first, second).
     *
     * @throws IllegalArgumentException if the output collection or one of the inputs is null
     */
    public void match(MatchedPointsCollection matched,
                      FeaturePointsCollection firstCollection,
                      FeaturePointsCollection secondCollection,
                      double threshold) {
        if (matched == null) {
            throw new IllegalArgumentException("Matched points collection isn't specified");
        }
        if (firstCollection == null || secondCollection == null) {
            throw new IllegalArgumentException("Feature point collections are not specified");
        }
        if (firstCollection.isEmpty() || secondCollection.isEmpty()) return;

        // Outer = collection with fewer points; equal sizes scan the second one
        boolean isSwap = secondCollection.size() <= firstCollection.size();
        FeaturePointsCollection outer = isSwap ? secondCollection : firstCollection;
        FeaturePointsCollection inner = isSwap ? firstCollection : secondCollection;

        List<MatchedPointPairInfo> tentative = findTentativeMatches(outer, inner);
        normalizeDistances(tentative);

        int before = matched.size();
        for (MatchedPointPairInfo info : tentative) {
            if (info.getDistance() <= threshold) {
                FeaturePoint outerPoint = new FeaturePoint(outer.getPoint(info.getOuterIndex()));
                FeaturePoint innerPoint = new FeaturePoint(inner.getPoint(info.getInnerIndex()));
                if (isSwap) matched.addPoints(innerPoint, outerPoint);
                else matched.addPoints(outerPoint, innerPoint);
            }
        }
        log.debug("match: outer={}, inner={}, swap={}, tentative={}, kept={}",
                outer.size(), inner.size(), isSwap, tentative.size(), matched.size() - before);
    }

    List<MatchedPointPairInfo> findTentativeMatches(FeaturePointsCollection outer, FeaturePointsCollection inner) {
        List<MatchedPointPairInfo> tentative = new ArrayList<>();
        boolean[] alreadyMatched = new boolean[inner.size()];

        for (int i = 0; i < outer.size(); i++) {
            FeaturePoint p = outer.getPoint(i);

            double bestDist = Double.MAX_VALUE;
            double secondBest = Double.MAX_VALUE;
            int bestIndex = -1;
            int candidates = 0;

            for (int j = 0; j < inner.size(); j++) {
                if (alreadyMatched[j]) continue;
                FeaturePoint q = inner.getPoint(j);
                if (p.isSign() != q.isSign()) continue;

                double dist = SimpleSurf.euclideanDistance(p, q);
                candidates++;
                if (dist < bestDist) {
                    secondBest = bestDist;
                    bestDist = dist;
                    bestIndex = j;
                } else if (dist < secondBest) {
                    secondBest = dist;
                }
            }

            // Cần ít nhất 2 ứng viên, secondBest = 0 nghĩa là hai láng giềng trùng nhau -> mơ hồ
            if (candidates < 2 || secondBest <= 0) continue;

            if (bestDist / secondBest < SurfConfig.RATIO_THRESHOLD) {
                tentative.add(new MatchedPointPairInfo(i, bestIndex, bestDist));
                alreadyMatched[bestIndex] = true;
            }
        }
        return tentative;
    }

    void normalizeDistances(List<MatchedPointPairInfo> infos) {
        double max = 0;
        for (MatchedPointPairInfo info : infos)
            if (info.getDistance() > max) max = info.getDistance();

        if (max != 0) {
            for (MatchedPointPairInfo info : infos) info.normalize(max);
        }
    }
}
