package astro.returns;

import astro.helper.AngleUtils;
import org.hipparchus.util.FastMath;

import java.util.logging.Logger;

/**
 * 行星回归时刻求解器
 *
 * 在 [searchStart, searchStart + windowDays] 内二分搜索天体黄经等于目标值的时刻。
 *
 * 前提：窗口内天体黄经单调增加（太阳、月亮在短窗口内成立）。窗口内出现逆行时
 * 结果不保证正确，也不会报错。
 *
 * 求解器本身无状态，不同线程可以同时对不同天体求解。
 */
public class ReturnSolver {

    private static final Logger logger = Logger.getLogger(ReturnSolver.class.getName());

    /** 默认黄经容差（度），约8.6角秒 */
    public static final double DEFAULT_TOLERANCE = 1e-4;

    /** 默认最大迭代次数 */
    public static final int DEFAULT_MAX_ITERATIONS = 50;

    private final EphemerisOracle oracle;

    public ReturnSolver(EphemerisOracle oracle) {
        if (oracle == null) {
            throw new IllegalArgumentException("Ephemeris oracle must not be null");
        }
        this.oracle = oracle;
    }

    /**
     * 使用默认容差和迭代次数求解
     *
     * @return 回归时刻（儒略日）
     */
    public double solve(double targetLongitude, Body body, double searchStart, double windowDays) {
        return solve(targetLongitude, body, searchStart, windowDays, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * 求解回归时刻
     *
     * @param targetLongitude 目标黄经（度），不要求归一化
     * @param body 天体
     * @param searchStart 搜索起点（儒略日）
     * @param windowDays 搜索窗口长度（日）
     * @param tolerance 黄经容差（度）
     * @param maxIterations 最大迭代次数
     * @return 回归时刻（儒略日）
     */
    public double solve(double targetLongitude, Body body, double searchStart, double windowDays,
                        double tolerance, int maxIterations) {
        return solveDetailed(targetLongitude, body, searchStart, windowDays, tolerance, maxIterations)
            .getJulianDay();
    }

    /**
     * 求解回归时刻并返回诊断信息
     *
     * 每次迭代查询一次星历，查询次数不超过 maxIterations。星历异常直接抛出，
     * 不返回部分结果。
     */
    public ReturnSearchResult solveDetailed(double targetLongitude, Body body, double searchStart,
                                            double windowDays, double tolerance, int maxIterations) {
        validate(targetLongitude, body, searchStart, windowDays, tolerance, maxIterations);

        double target = AngleUtils.normalize(targetLongitude);
        double start = searchStart;
        double end = searchStart + windowDays;
        double distance = Double.NaN;

        for (int i = 1; i <= maxIterations; i++) {
            double mid = (start + end) / 2.0;

            double currentLongitude = AngleUtils.normalize(oracle.positionAt(mid, body).getLongitude());
            // 当前黄经超过目标多少度，负值表示尚未到达
            distance = AngleUtils.signedShortestDistance(target, currentLongitude);

            if (FastMath.abs(distance) < tolerance) {
                return converged(body, mid, end - start, i, distance);
            }

            if (distance < 0) {
                start = mid;
            } else {
                end = mid;
            }

            // 区间已收缩到容差以内，接受当前估计
            if ((end - start) < tolerance) {
                return converged(body, mid, end - start, i, distance);
            }
        }

        double estimate = (start + end) / 2.0;
        logger.warning(String.format(
            "%s return search did not converge after %d iterations: jd=%.6f, width=%.3e d, residual=%.3e°",
            body, maxIterations, estimate, end - start, distance));
        return new ReturnSearchResult(estimate, end - start, maxIterations, distance, false);
    }

    public EphemerisOracle getOracle() {
        return oracle;
    }

    private static ReturnSearchResult converged(Body body, double julianDay, double width,
                                                int iterations, double residual) {
        logger.fine(() -> String.format("%s return found at jd=%.6f after %d iterations (residual %.3e°)",
            body, julianDay, iterations, residual));
        return new ReturnSearchResult(julianDay, width, iterations, residual, true);
    }

    private static void validate(double targetLongitude, Body body, double searchStart, double windowDays,
                                 double tolerance, int maxIterations) {
        if (body == null) {
            throw new IllegalArgumentException("Body must not be null");
        }
        AngleUtils.requireFinite(targetLongitude, "targetLongitude");
        AngleUtils.requireFinite(searchStart, "searchStart");
        AngleUtils.requireFinite(windowDays, "windowDays");
        AngleUtils.requireFinite(tolerance, "tolerance");
        if (windowDays <= 0.0) {
            throw new IllegalArgumentException("windowDays must be > 0, got " + windowDays);
        }
        if (tolerance <= 0.0) {
            throw new IllegalArgumentException("tolerance must be > 0, got " + tolerance);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, got " + maxIterations);
        }
    }
}
