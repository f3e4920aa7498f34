package astro.returns;

import astro.helper.AngleUtils;
import astro.helper.JulianDays;
import org.hipparchus.util.FastMath;

/**
 * 低精度解析星历
 *
 * 太阳使用平黄经加中心差（精度约0.01°），月亮使用主要周期项（精度约0.1°）。
 * 不需要外部数据文件，用于测试和没有星历数据的环境。只支持太阳和月亮。
 */
public class LowPrecisionEphemeris implements EphemerisOracle {

    private static final double DAYS_PER_CENTURY = 36525.0;

    // 速度用中心差分计算的步长（日）
    private static final double SPEED_STEP_DAYS = 0.01;

    @Override
    public BodyPosition positionAt(double julianDay, Body body) {
        AngleUtils.requireFinite(julianDay, "julianDay");
        switch (body) {
            case SUN:
            case MOON:
                double longitude = longitude(julianDay, body);
                double before = longitude(julianDay - SPEED_STEP_DAYS, body);
                double after = longitude(julianDay + SPEED_STEP_DAYS, body);
                double speed = AngleUtils.signedShortestDistance(before, after) / (2.0 * SPEED_STEP_DAYS);
                return new BodyPosition(longitude, speed);
            default:
                throw new EphemerisException("Low precision ephemeris does not support " + body);
        }
    }

    private static double longitude(double julianDay, Body body) {
        double t = (julianDay - JulianDays.J2000_JD) / DAYS_PER_CENTURY;
        return body == Body.SUN ? sunLongitude(t) : moonLongitude(t);
    }

    /**
     * 太阳几何黄经
     *
     * @param t 自J2000起的儒略世纪数
     */
    static double sunLongitude(double t) {
        double meanLongitude = 280.46646 + 36000.76983 * t + 0.0003032 * t * t;
        double meanAnomaly = FastMath.toRadians(357.52911 + 35999.05029 * t - 0.0001537 * t * t);

        double center = (1.914602 - 0.004817 * t - 0.000014 * t * t) * FastMath.sin(meanAnomaly)
                      + (0.019993 - 0.000101 * t) * FastMath.sin(2 * meanAnomaly)
                      + 0.000289 * FastMath.sin(3 * meanAnomaly);

        return AngleUtils.normalize(meanLongitude + center);
    }

    /**
     * 月亮黄经（主要周期项）
     *
     * @param t 自J2000起的儒略世纪数
     */
    static double moonLongitude(double t) {
        double meanLongitude = 218.3164477 + 481267.88123421 * t;
        double d = radians(297.8501921 + 445267.1114034 * t);   // 平距角
        double m = radians(357.5291092 + 35999.0502909 * t);    // 太阳平近点角
        double mp = radians(134.9633964 + 477198.8675055 * t);  // 月亮平近点角
        double f = radians(93.2720950 + 483202.0175233 * t);    // 升交角距

        double sum = 6.288774 * FastMath.sin(mp)
                   + 1.274027 * FastMath.sin(2 * d - mp)
                   + 0.658314 * FastMath.sin(2 * d)
                   + 0.213618 * FastMath.sin(2 * mp)
                   - 0.185116 * FastMath.sin(m)
                   - 0.114332 * FastMath.sin(2 * f)
                   + 0.058793 * FastMath.sin(2 * d - 2 * mp)
                   + 0.057066 * FastMath.sin(2 * d - m - mp)
                   + 0.053322 * FastMath.sin(2 * d + mp)
                   + 0.045758 * FastMath.sin(2 * d - m)
                   - 0.040923 * FastMath.sin(m - mp)
                   - 0.034720 * FastMath.sin(d)
                   - 0.030383 * FastMath.sin(m + mp);

        return AngleUtils.normalize(meanLongitude + sum);
    }

    private static double radians(double degrees) {
        return FastMath.toRadians(AngleUtils.normalize(degrees));
    }
}
