package astro.aspects.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 一张星盘的点集合
 *
 * 点的顺序就是相位计算时的遍历顺序。同一张盘内点标识不能重复。
 */
public final class Chart {

    private final String owner;
    private final List<ChartPoint> points;

    public Chart(String owner, List<ChartPoint> points) {
        if (owner == null) {
            throw new IllegalArgumentException("Chart owner must not be null");
        }
        if (points == null) {
            throw new IllegalArgumentException("Chart points must not be null");
        }
        Set<PointId> seen = EnumSet.noneOf(PointId.class);
        for (ChartPoint point : points) {
            if (point == null) {
                throw new IllegalArgumentException("Chart " + owner + " contains a null point");
            }
            if (!seen.add(point.getId())) {
                throw new IllegalArgumentException("Duplicate point " + point.getId() + " in chart " + owner);
            }
        }
        this.owner = owner;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public String getOwner() {
        return owner;
    }

    public List<ChartPoint> getPoints() {
        return points;
    }

    public Optional<ChartPoint> find(PointId id) {
        for (ChartPoint point : points) {
            if (point.getId() == id) {
                return Optional.of(point);
            }
        }
        return Optional.empty();
    }

    /**
     * 只保留给定集合中的点，顺序不变
     *
     * @param activePoints 启用的点，为null表示全部保留，空集合不保留任何点
     * @return 过滤后的星盘
     */
    public Chart restrictTo(Set<PointId> activePoints) {
        if (activePoints == null) {
            return this;
        }
        List<ChartPoint> kept = new ArrayList<>();
        for (ChartPoint point : points) {
            if (activePoints.contains(point.getId())) {
                kept.add(point);
            }
        }
        return new Chart(owner, kept);
    }

    @Override
    public String toString() {
        return "Chart{owner='" + owner + "', points=" + points.size() + '}';
    }
}
