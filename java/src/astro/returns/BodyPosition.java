package astro.returns;

/**
 * 天体在某一时刻的黄经与黄经速度
 */
public final class BodyPosition {

    private final double longitude;  // 度
    private final double speed;      // 度/日

    public BodyPosition(double longitude, double speed) {
        this.longitude = longitude;
        this.speed = speed;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getSpeed() {
        return speed;
    }

    @Override
    public String toString() {
        return String.format("BodyPosition[lon=%.6f°, speed=%.6f°/d]", longitude, speed);
    }
}
