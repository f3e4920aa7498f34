package astro.returns;

import org.orekit.time.DateTimeComponents;

/**
 * 回归时刻
 *
 * 调用方据此在该时刻重新查询星历，构建回归盘。
 */
public class ReturnEvent {
    private final Body body;
    private final double targetLongitude;
    private final double julianDay;
    private final DateTimeComponents utc;
    private final ReturnSearchResult search;

    public ReturnEvent(Body body, double targetLongitude, double julianDay,
                       DateTimeComponents utc, ReturnSearchResult search) {
        this.body = body;
        this.targetLongitude = targetLongitude;
        this.julianDay = julianDay;
        this.utc = utc;
        this.search = search;
    }

    public Body getBody() { return body; }
    public double getTargetLongitude() { return targetLongitude; }
    public double getJulianDay() { return julianDay; }
    public DateTimeComponents getUtc() { return utc; }
    public ReturnSearchResult getSearch() { return search; }

    @Override
    public String toString() {
        return String.format("ReturnEvent[%s -> %.4f° at %s (jd=%.6f)]",
            body, targetLongitude, utc, julianDay);
    }
}
