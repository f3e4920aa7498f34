package astro.helper;

import org.hipparchus.util.FastMath;

/**
 * 圆周角度工具
 *
 * 黄经等以360°为周期的坐标上的基础运算。所有输入都不要求预先归一化，
 * 输出在 [0, 360) 内，带符号的距离在 (-180, 180] 内。
 */
public final class AngleUtils {

    /** 一整圈（度） */
    public static final double FULL_CIRCLE = 360.0;

    /** 半圈（度） */
    public static final double HALF_CIRCLE = 180.0;

    /**
     * 起点与终点重合时区间视为整圈：任何候选点都在区间内
     */
    public static final boolean ZERO_SPAN_IS_FULL_CIRCLE = true;

    private static final int HOUSE_COUNT = 12;

    private AngleUtils() {
    }

    /**
     * 归一化到 [0, 360)
     *
     * @param angle 任意角度（度）
     * @return 归一化后的角度
     */
    public static double normalize(double angle) {
        return ((angle % FULL_CIRCLE) + FULL_CIRCLE) % FULL_CIRCLE;
    }

    /**
     * b 相对 a 的最短有向距离
     *
     * @param a 参考点（度）
     * @param b 目标点（度）
     * @return (-180, 180] 内的距离，正值表示 b 在 a 的前方（黄经增加方向）
     */
    public static double signedShortestDistance(double a, double b) {
        double distance = normalize(b - a);
        if (distance > HALF_CIRCLE) {
            distance -= FULL_CIRCLE;
        }
        return distance;
    }

    /**
     * 两点间的无向圆周距离，相位匹配使用的就是这个量
     *
     * @param a 第一个点（度）
     * @param b 第二个点（度）
     * @return [0, 180] 内的距离
     */
    public static double unsignedCircularDistance(double a, double b) {
        double diff = normalize(a - b);
        if (diff > HALF_CIRCLE) {
            diff -= FULL_CIRCLE;
        }
        return FastMath.abs(diff);
    }

    /**
     * 判断候选点是否落在从 start 顺时针（黄经增加方向）走到 end 的区间内
     *
     * 区间左闭右开：candidate 等于 start 时返回 true，等于 end 时返回 false。
     * start 与 end 重合时见 {@link #ZERO_SPAN_IS_FULL_CIRCLE}。
     *
     * @param start 区间起点（度）
     * @param end 区间终点（度）
     * @param candidate 候选点（度）
     * @return 是否在区间内
     */
    public static boolean isBetween(double start, double end, double candidate) {
        double s = normalize(start);
        double e = normalize(end);
        double c = normalize(candidate);

        if (c == s) {
            return true;
        }

        double span = normalize(e - s);
        if (span == 0.0) {
            return ZERO_SPAN_IS_FULL_CIRCLE;
        }

        if (c == e) {
            return false;
        }
        return normalize(c - s) < span;
    }

    /**
     * 最短弧上的中点（组合盘使用）
     *
     * @param a 第一个点（度）
     * @param b 第二个点（度）
     * @return 中点，[0, 360)
     */
    public static double midpoint(double a, double b) {
        return normalize(a + signedShortestDistance(a, b) / 2.0);
    }

    /**
     * 查找候选点所在的宫位
     *
     * 宫头由外部提供，这里只做区间判断。
     *
     * @param candidate 候选点（度）
     * @param cusps 12个宫头，按第1宫到第12宫排列
     * @return 1到12的宫位序号
     */
    public static int findHouse(double candidate, double[] cusps) {
        if (cusps == null || cusps.length != HOUSE_COUNT) {
            throw new IllegalArgumentException("Expected " + HOUSE_COUNT + " house cusps");
        }
        requireFinite(candidate, "candidate");
        for (int i = 0; i < HOUSE_COUNT; i++) {
            requireFinite(cusps[i], "cusp " + (i + 1));
        }

        for (int i = 0; i < HOUSE_COUNT; i++) {
            double start = cusps[i];
            double end = cusps[(i + 1) % HOUSE_COUNT];
            if (isBetween(start, end, candidate)) {
                return i + 1;
            }
        }

        throw new IllegalArgumentException("No house contains point " + candidate);
    }

    /**
     * 校验数值有限（非NaN、非无穷）
     *
     * @param value 数值
     * @param what 出错时用于描述的名称
     * @return 原值
     */
    public static double requireFinite(double value, String what) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(what + " must be finite, got " + value);
        }
        return value;
    }
}
