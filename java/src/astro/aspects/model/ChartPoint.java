package astro.aspects.model;

import astro.helper.AngleUtils;

/**
 * 星盘中的一个点
 *
 * 黄经与速度来自外部星历。速度可为空，表示不适用（例如宫头）。
 */
public final class ChartPoint {

    private final PointId id;
    private final double absolutePosition;  // 度
    private final Double speed;             // 度/日，可为空

    public ChartPoint(PointId id, double absolutePosition, Double speed) {
        if (id == null) {
            throw new IllegalArgumentException("Point id must not be null");
        }
        AngleUtils.requireFinite(absolutePosition, "position of " + id);
        if (speed != null) {
            AngleUtils.requireFinite(speed, "speed of " + id);
        }
        this.id = id;
        this.absolutePosition = absolutePosition;
        this.speed = speed;
    }

    public static ChartPoint of(PointId id, double absolutePosition, double speed) {
        return new ChartPoint(id, absolutePosition, speed);
    }

    /**
     * 无速度的点（轴点、宫头）
     */
    public static ChartPoint fixed(PointId id, double absolutePosition) {
        return new ChartPoint(id, absolutePosition, null);
    }

    public PointId getId() { return id; }
    public double getAbsolutePosition() { return absolutePosition; }
    public Double getSpeed() { return speed; }
    public boolean hasSpeed() { return speed != null; }

    /**
     * 速度，缺失时按0处理
     */
    public double getSpeedOrZero() {
        return speed == null ? 0.0 : speed;
    }

    @Override
    public String toString() {
        return "ChartPoint{" +
                "id=" + id +
                ", absolutePosition=" + absolutePosition +
                ", speed=" + speed +
                '}';
    }
}
