package astro.helper;

import org.hipparchus.util.FastMath;
import org.orekit.time.DateComponents;
import org.orekit.time.DateTimeComponents;
import org.orekit.time.TimeComponents;

/**
 * 儒略日转换
 *
 * 儒略日按世界时（UT）理解，日期使用格里高利历。不做时区换算，
 * 本地时间到UT的转换由调用方负责。
 */
public final class JulianDays {

    /** J2000.0 历元 (2000-01-01T12:00) 的儒略日 */
    public static final double J2000_JD = 2451545.0;

    public static final double SECONDS_PER_DAY = 86400.0;

    // TimeComponents 要求秒数严格小于一天
    private static final double LAST_SECOND_OF_DAY = SECONDS_PER_DAY - 1.0e-6;

    private JulianDays() {
    }

    /**
     * 日期时间转儒略日
     *
     * @param dateTime UT日期时间
     * @return 儒略日
     */
    public static double fromDateTime(DateTimeComponents dateTime) {
        DateComponents date = dateTime.getDate();
        TimeComponents time = dateTime.getTime();
        // J2000 day 0 是 2000-01-01，当天 00:00 对应 JD 2451544.5
        return J2000_JD - 0.5 + date.getJ2000Day() + time.getSecondsInUTCDay() / SECONDS_PER_DAY;
    }

    /**
     * 日期时间转儒略日
     */
    public static double fromDateTime(int year, int month, int day, int hour, int minute, double second) {
        return fromDateTime(new DateTimeComponents(
            new DateComponents(year, month, day),
            new TimeComponents(hour, minute, second)
        ));
    }

    /**
     * 儒略日转日期时间
     *
     * @param julianDay 儒略日
     * @return UT日期时间
     */
    public static DateTimeComponents toDateTime(double julianDay) {
        AngleUtils.requireFinite(julianDay, "julianDay");

        double daysFromJ2000Midnight = julianDay - (J2000_JD - 0.5);
        int dayOffset = (int) FastMath.floor(daysFromJ2000Midnight);
        double secondInDay = (daysFromJ2000Midnight - dayOffset) * SECONDS_PER_DAY;
        secondInDay = FastMath.max(0.0, FastMath.min(secondInDay, LAST_SECOND_OF_DAY));

        return new DateTimeComponents(
            new DateComponents(DateComponents.J2000_EPOCH, dayOffset),
            new TimeComponents(secondInDay)
        );
    }
}
