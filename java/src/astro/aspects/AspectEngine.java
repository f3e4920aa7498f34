package astro.aspects;

import astro.aspects.model.ActiveAspect;
import astro.aspects.model.AspectMatch;
import astro.aspects.model.AspectMovement;
import astro.aspects.model.AspectRecord;
import astro.aspects.model.AspectStats;
import astro.aspects.model.Chart;
import astro.aspects.model.ChartAspects;
import astro.aspects.model.ChartPoint;
import astro.aspects.model.PointId;
import astro.helper.AngleUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * 相位引擎
 *
 * 对一张盘内的所有点对（单盘），或两张盘之间的所有点对（双盘）做相位匹配与运动判断。
 * 输出按点对遍历顺序排列，不按容许度排序。
 */
public class AspectEngine {

    private static final Logger logger = Logger.getLogger(AspectEngine.class.getName());

    private final AspectCatalog catalog;
    private final AspectSettings settings;

    /**
     * 使用默认设置创建相位引擎
     */
    public AspectEngine() {
        this(AspectSettingsLoader.defaults());
    }

    /**
     * 创建相位引擎
     *
     * @param settings 相位设置，提供目录的默认容许度和默认启用的相位
     */
    public AspectEngine(AspectSettings settings) {
        this.settings = settings;
        this.catalog = AspectCatalog.fromSettings(settings);
    }

    public AspectCatalog getCatalog() {
        return catalog;
    }

    public AspectSettings getSettings() {
        return settings;
    }

    /**
     * 单盘相位
     *
     * @param chart 星盘
     * @param activeAspects 启用的相位及容许度，不能为空
     * @param axisOrbLimit 轴点相位的容许度上限，为null时不过滤
     * @return 相位记录
     */
    public List<AspectRecord> singleChartAspects(Chart chart, List<ActiveAspect> activeAspects,
                                                 Double axisOrbLimit) {
        return computeSingle(chart, activeAspects, axisOrbLimit).records;
    }

    /**
     * 双盘相位（两张盘都按各自速度运动）
     */
    public List<AspectRecord> dualChartAspects(Chart first, Chart second,
                                               List<ActiveAspect> activeAspects,
                                               Double axisOrbLimit) {
        return dualChartAspects(first, second, activeAspects, axisOrbLimit, false, false);
    }

    /**
     * 双盘相位
     *
     * 两张盘的点做完整笛卡尔积，不跳过对轴点对。
     *
     * @param first 第一张盘
     * @param second 第二张盘
     * @param activeAspects 启用的相位及容许度，不能为空
     * @param axisOrbLimit 轴点相位的容许度上限，为null时不过滤
     * @param firstIsFixed 第一张盘视为静止（速度置0）
     * @param secondIsFixed 第二张盘视为静止（速度置0）
     * @return 相位记录
     */
    public List<AspectRecord> dualChartAspects(Chart first, Chart second,
                                               List<ActiveAspect> activeAspects,
                                               Double axisOrbLimit,
                                               boolean firstIsFixed, boolean secondIsFixed) {
        return computeDual(first, second, activeAspects, axisOrbLimit, firstIsFixed, secondIsFixed).records;
    }

    /**
     * 单盘相位分析（带统计信息）
     */
    public ChartAspects analyzeSingleChart(Chart chart, AspectConfig config) {
        long startNs = System.nanoTime();

        Chart active = chart.restrictTo(config.getActivePoints());
        List<ActiveAspect> aspects = resolveActiveAspects(config);
        Computation result = computeSingle(active, aspects, config.getAxisOrbLimit());

        return new ChartAspects(
            false,
            chart.getOwner(),
            chart.getOwner(),
            result.records,
            pointIds(active, null),
            aspects,
            result.toStats(System.nanoTime() - startNs)
        );
    }

    /**
     * 双盘相位分析（带统计信息）
     */
    public ChartAspects analyzeDualChart(Chart first, Chart second, AspectConfig config) {
        long startNs = System.nanoTime();

        Chart activeFirst = first.restrictTo(config.getActivePoints());
        Chart activeSecond = second.restrictTo(config.getActivePoints());
        List<ActiveAspect> aspects = resolveActiveAspects(config);
        Computation result = computeDual(activeFirst, activeSecond, aspects, config.getAxisOrbLimit(),
                                         config.isFirstIsFixed(), config.isSecondIsFixed());

        return new ChartAspects(
            true,
            first.getOwner(),
            second.getOwner(),
            result.records,
            pointIds(activeFirst, activeSecond),
            aspects,
            result.toStats(System.nanoTime() - startNs)
        );
    }

    private Computation computeSingle(Chart chart, List<ActiveAspect> activeAspects, Double axisOrbLimit) {
        requireChart(chart);
        AspectCatalog narrowed = narrowCatalog(activeAspects);
        validateAxisOrbLimit(axisOrbLimit);

        Computation computation = new Computation(axisOrbLimit);
        List<ChartPoint> points = chart.getPoints();

        for (int i = 0; i < points.size(); i++) {
            for (int j = i + 1; j < points.size(); j++) {
                ChartPoint p1 = points.get(i);
                ChartPoint p2 = points.get(j);

                // 上升/下降、天顶/天底、南北交点恒为180°，不作为对分相报告
                if (p1.getId().isOppositeAxisOf(p2.getId())) {
                    computation.pairsExcluded++;
                    continue;
                }

                computation.examine(narrowed, chart.getOwner(), p1, p1.getSpeedOrZero(),
                                    chart.getOwner(), p2, p2.getSpeedOrZero());
            }
        }

        logger.fine(() -> String.format("Single chart %s: %d aspects (%d pairs, %d excluded, %d axis-filtered)",
            chart.getOwner(), computation.records.size(), computation.pairsExamined,
            computation.pairsExcluded, computation.axisFiltered));
        return computation;
    }

    private Computation computeDual(Chart first, Chart second, List<ActiveAspect> activeAspects,
                                    Double axisOrbLimit, boolean firstIsFixed, boolean secondIsFixed) {
        requireChart(first);
        requireChart(second);
        AspectCatalog narrowed = narrowCatalog(activeAspects);
        validateAxisOrbLimit(axisOrbLimit);

        Computation computation = new Computation(axisOrbLimit);

        for (ChartPoint p1 : first.getPoints()) {
            for (ChartPoint p2 : second.getPoints()) {
                double speed1 = firstIsFixed ? 0.0 : p1.getSpeedOrZero();
                double speed2 = secondIsFixed ? 0.0 : p2.getSpeedOrZero();
                computation.examine(narrowed, first.getOwner(), p1, speed1,
                                    second.getOwner(), p2, speed2);
            }
        }

        logger.fine(() -> String.format("Dual chart %s / %s: %d aspects (%d pairs, %d axis-filtered)",
            first.getOwner(), second.getOwner(), computation.records.size(),
            computation.pairsExamined, computation.axisFiltered));
        return computation;
    }

    private List<ActiveAspect> resolveActiveAspects(AspectConfig config) {
        List<ActiveAspect> aspects = config.getActiveAspects();
        return aspects == null ? settings.defaultActiveAspects() : aspects;
    }

    private AspectCatalog narrowCatalog(List<ActiveAspect> activeAspects) {
        if (activeAspects == null || activeAspects.isEmpty()) {
            throw new IllegalArgumentException("Active aspect selection must not be empty");
        }
        return catalog.narrow(activeAspects);
    }

    private static void requireChart(Chart chart) {
        if (chart == null) {
            throw new IllegalArgumentException("Chart must not be null");
        }
    }

    private static void validateAxisOrbLimit(Double axisOrbLimit) {
        if (axisOrbLimit == null) {
            return;
        }
        AngleUtils.requireFinite(axisOrbLimit, "axisOrbLimit");
        if (axisOrbLimit < 0.0) {
            throw new IllegalArgumentException("axisOrbLimit must be >= 0, got " + axisOrbLimit);
        }
    }

    private static List<PointId> pointIds(Chart first, Chart second) {
        Set<PointId> ids = new LinkedHashSet<>();
        for (ChartPoint point : first.getPoints()) {
            ids.add(point.getId());
        }
        if (second != null) {
            for (ChartPoint point : second.getPoints()) {
                ids.add(point.getId());
            }
        }
        return new ArrayList<>(ids);
    }

    /**
     * 一次计算的中间状态（内部类）
     */
    private static final class Computation {
        private final Double axisOrbLimit;
        private final List<AspectRecord> records = new ArrayList<>();
        private int pairsExamined = 0;
        private int pairsExcluded = 0;
        private int matches = 0;
        private int axisFiltered = 0;

        Computation(Double axisOrbLimit) {
            this.axisOrbLimit = axisOrbLimit;
        }

        void examine(AspectCatalog narrowed,
                     String owner1, ChartPoint p1, double speed1,
                     String owner2, ChartPoint p2, double speed2) {
            pairsExamined++;

            AspectMatch match = AspectMatcher.match(narrowed, p1.getAbsolutePosition(), p2.getAbsolutePosition());
            if (!match.isMatched()) {
                return;
            }
            matches++;

            AspectMovement movement;
            if (p1.getId().isAxis() && p2.getId().isAxis()) {
                // 轴点之间的相对几何关系不随时间变化
                movement = AspectMovement.STATIC;
            } else {
                movement = MovementClassifier.classify(
                    p1.getAbsolutePosition(), p2.getAbsolutePosition(),
                    match.getExactDegree(), speed1, speed2
                );
            }

            AspectRecord record = new AspectRecord(
                p1.getId(), owner1, p1.getAbsolutePosition(), speed1,
                p2.getId(), owner2, p2.getAbsolutePosition(), speed2,
                match.getName(), match.getOrbit(), match.getDiff(), movement
            );

            if (axisOrbLimit != null && record.involvesAxis() && Math.abs(record.getOrbit()) >= axisOrbLimit) {
                axisFiltered++;
                return;
            }
            records.add(record);
        }

        AspectStats toStats(long elapsedNs) {
            return new AspectStats(
                TimeUnit.NANOSECONDS.toMillis(elapsedNs),
                pairsExamined,
                pairsExcluded,
                matches,
                axisFiltered
            );
        }
    }
}
