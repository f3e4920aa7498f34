package astro.returns;

import astro.helper.JulianDays;
import org.orekit.time.DateComponents;
import org.orekit.time.DateTimeComponents;

import java.time.Year;
import java.util.logging.Logger;

/**
 * 回归盘时刻计算器
 *
 * 太阳回归：生日周年附近太阳回到本命黄经的时刻。
 * 月亮回归：指定月份内月亮回到本命黄经的时刻。
 */
public class ReturnCalculator {

    private static final Logger logger = Logger.getLogger(ReturnCalculator.class.getName());

    private final ReturnSolver solver;
    private final ReturnSearchConfig config;

    public ReturnCalculator(EphemerisOracle oracle) {
        this(oracle, new ReturnSearchConfig());
    }

    public ReturnCalculator(EphemerisOracle oracle, ReturnSearchConfig config) {
        this.solver = new ReturnSolver(oracle);
        this.config = config;
    }

    /**
     * 太阳回归
     *
     * 窗口从周年日（同月同日同时刻）前 solarLeadDays 天开始。闰年导致周年日的太阳黄经
     * 前后偏移，窗口需要覆盖两侧。
     *
     * @param natalSunLongitude 本命太阳黄经（度）
     * @param natalUtc 出生时刻（UT）
     * @param returnYear 回归年份
     * @return 回归时刻
     */
    public ReturnEvent solarReturn(double natalSunLongitude, DateTimeComponents natalUtc, int returnYear) {
        DateComponents natalDate = natalUtc.getDate();
        int day = natalDate.getDay();
        // 2月29日出生，非闰年按2月28日
        if (natalDate.getMonth() == 2 && day == 29 && !Year.isLeap(returnYear)) {
            day = 28;
        }
        DateTimeComponents anniversary = new DateTimeComponents(
            new DateComponents(returnYear, natalDate.getMonth(), day),
            natalUtc.getTime()
        );
        double searchStart = JulianDays.fromDateTime(anniversary) - config.getSolarLeadDays();

        ReturnEvent event = planetReturn(Body.SUN, natalSunLongitude, searchStart, config.getSolarWindowDays());
        logger.info("Solar return " + returnYear + ": " + event);
        return event;
    }

    /**
     * 月亮回归
     *
     * 窗口从该月1日 00:00 UT 开始，长度为 lunarWindowDays 天。
     *
     * @param natalMoonLongitude 本命月亮黄经（度）
     * @param returnYear 年份
     * @param returnMonth 月份（1-12）
     * @return 回归时刻
     */
    public ReturnEvent lunarReturn(double natalMoonLongitude, int returnYear, int returnMonth) {
        double searchStart = JulianDays.fromDateTime(returnYear, returnMonth, 1, 0, 0, 0.0);

        ReturnEvent event = planetReturn(Body.MOON, natalMoonLongitude, searchStart, config.getLunarWindowDays());
        logger.info("Lunar return " + returnYear + "-" + returnMonth + ": " + event);
        return event;
    }

    /**
     * 任意天体在给定窗口内的回归
     *
     * 窗口内天体必须保持顺行。
     */
    public ReturnEvent planetReturn(Body body, double targetLongitude, double searchStart, double windowDays) {
        ReturnSearchResult result = solver.solveDetailed(
            targetLongitude, body, searchStart, windowDays,
            config.getTolerance(), config.getMaxIterations()
        );
        return new ReturnEvent(body, targetLongitude, result.getJulianDay(),
                               JulianDays.toDateTime(result.getJulianDay()), result);
    }

    public ReturnSearchConfig getConfig() {
        return config;
    }
}
