package astro;

import astro.aspects.AspectConfig;
import astro.aspects.AspectEngine;
import astro.aspects.model.ActiveAspect;
import astro.aspects.model.AspectName;
import astro.aspects.model.AspectRecord;
import astro.aspects.model.AspectStats;
import astro.aspects.model.Chart;
import astro.aspects.model.ChartAspects;
import astro.aspects.model.ChartPoint;
import astro.aspects.model.PointId;
import astro.helper.OrekitDataLoader;
import astro.returns.EphemerisOracle;
import astro.returns.LowPrecisionEphemeris;
import astro.returns.OrekitEphemerisOracle;
import astro.returns.ReturnCalculator;
import astro.returns.ReturnEvent;
import org.orekit.time.DateTimeComponents;

import java.util.*;

/**
 * Python调用入口
 *
 * 提供JPype可以直接调用的静态方法。输入使用普通Map（点名称 -> 黄经/速度），
 * 输出为Python友好的Map，键名与星盘JSON格式一致。
 */
public class PythonBridge {

    private static final AspectEngine engine = new AspectEngine();

    private static EphemerisOracle oracle;

    /**
     * 单盘相位
     *
     * @param owner 星盘名称
     * @param positions 点名称 -> 黄经（度），遍历顺序即计算顺序
     * @param speeds 点名称 -> 速度（度/日），可为null或缺项
     * @param activeAspects 相位名称 -> 容许度，为null时使用默认设置
     * @param axisOrbLimit 轴点容许度上限，可为null
     * @return 结果Map
     */
    public static Map<String, Object> computeSingleChartAspects(
            String owner,
            Map<String, Double> positions,
            Map<String, Double> speeds,
            Map<String, Double> activeAspects,
            Double axisOrbLimit) {

        try {
            AspectConfig config = new AspectConfig();
            config.setActiveAspects(toActiveAspects(activeAspects));
            config.setAxisOrbLimit(axisOrbLimit);

            ChartAspects result = engine.analyzeSingleChart(toChart(owner, positions, speeds), config);
            return convertToPythonMap(result);

        } catch (Exception e) {
            return errorMap(e);
        }
    }

    /**
     * 双盘相位（合盘、行运）
     */
    public static Map<String, Object> computeDualChartAspects(
            String firstOwner,
            Map<String, Double> firstPositions,
            Map<String, Double> firstSpeeds,
            String secondOwner,
            Map<String, Double> secondPositions,
            Map<String, Double> secondSpeeds,
            Map<String, Double> activeAspects,
            Double axisOrbLimit,
            boolean firstIsFixed,
            boolean secondIsFixed) {

        try {
            AspectConfig config = new AspectConfig();
            config.setActiveAspects(toActiveAspects(activeAspects));
            config.setAxisOrbLimit(axisOrbLimit);
            config.setFirstIsFixed(firstIsFixed);
            config.setSecondIsFixed(secondIsFixed);

            ChartAspects result = engine.analyzeDualChart(
                toChart(firstOwner, firstPositions, firstSpeeds),
                toChart(secondOwner, secondPositions, secondSpeeds),
                config
            );
            return convertToPythonMap(result);

        } catch (Exception e) {
            return errorMap(e);
        }
    }

    /**
     * 太阳回归时刻
     *
     * @param natalSunLongitude 本命太阳黄经（度）
     * @param natalUtcIso 出生时刻（UT，ISO 8601格式，例如 1990-06-15T01:36:00）
     * @param returnYear 回归年份
     * @return 结果Map
     */
    public static Map<String, Object> computeSolarReturn(double natalSunLongitude,
                                                         String natalUtcIso,
                                                         int returnYear) {
        try {
            DateTimeComponents natal = DateTimeComponents.parseDateTime(natalUtcIso);
            ReturnEvent event = new ReturnCalculator(resolveOracle())
                .solarReturn(natalSunLongitude, natal, returnYear);
            return convertToPythonMap(event);
        } catch (Exception e) {
            return errorMap(e);
        }
    }

    /**
     * 月亮回归时刻
     */
    public static Map<String, Object> computeLunarReturn(double natalMoonLongitude,
                                                         int returnYear,
                                                         int returnMonth) {
        try {
            ReturnEvent event = new ReturnCalculator(resolveOracle())
                .lunarReturn(natalMoonLongitude, returnYear, returnMonth);
            return convertToPythonMap(event);
        } catch (Exception e) {
            return errorMap(e);
        }
    }

    /**
     * 指定星历实现（测试或已有Orekit环境时使用）
     */
    public static synchronized void setOracle(EphemerisOracle ephemerisOracle) {
        oracle = ephemerisOracle;
    }

    /**
     * 有Orekit数据时使用Orekit星历，否则退回低精度解析星历
     */
    private static synchronized EphemerisOracle resolveOracle() {
        if (oracle == null) {
            if (OrekitDataLoader.configureFromEnvironment()) {
                oracle = new OrekitEphemerisOracle();
            } else {
                oracle = new LowPrecisionEphemeris();
            }
        }
        return oracle;
    }

    private static Chart toChart(String owner, Map<String, Double> positions, Map<String, Double> speeds) {
        if (positions == null) {
            throw new IllegalArgumentException("Positions of chart " + owner + " must not be null");
        }
        List<ChartPoint> points = new ArrayList<>();
        for (Map.Entry<String, Double> entry : positions.entrySet()) {
            PointId id = PointId.fromLabel(entry.getKey())
                .orElseThrow(() -> new IllegalArgumentException("Unknown point '" + entry.getKey() + "'"));
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Missing position for point " + id);
            }
            Double speed = speeds == null ? null : speeds.get(entry.getKey());
            points.add(new ChartPoint(id, entry.getValue(), speed));
        }
        return new Chart(owner, points);
    }

    private static List<ActiveAspect> toActiveAspects(Map<String, Double> activeAspects) {
        if (activeAspects == null) {
            return null;
        }
        List<ActiveAspect> result = new ArrayList<>();
        for (Map.Entry<String, Double> entry : activeAspects.entrySet()) {
            AspectName name = AspectName.fromLabel(entry.getKey())
                .orElseThrow(() -> new IllegalArgumentException("Unknown aspect '" + entry.getKey() + "'"));
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Missing orb for aspect " + name);
            }
            result.add(ActiveAspect.of(name, entry.getValue()));
        }
        return result;
    }

    /**
     * 转换为Python友好的Map
     */
    private static Map<String, Object> convertToPythonMap(ChartAspects result) {
        Map<String, Object> map = new HashMap<>();

        List<Map<String, Object>> aspectList = new ArrayList<>();
        for (AspectRecord record : result.getAspects()) {
            Map<String, Object> aspectMap = new LinkedHashMap<>();
            aspectMap.put("p1_name", record.getPoint1Name());
            aspectMap.put("p1_owner", record.getPoint1Owner());
            aspectMap.put("p1_abs_pos", record.getPoint1AbsPos());
            aspectMap.put("p2_name", record.getPoint2Name());
            aspectMap.put("p2_owner", record.getPoint2Owner());
            aspectMap.put("p2_abs_pos", record.getPoint2AbsPos());
            aspectMap.put("aspect", record.getAspect().getLabel());
            aspectMap.put("orbit", record.getOrbit());
            aspectMap.put("aspect_degrees", record.getExactDegree());
            aspectMap.put("diff", record.getDiff());
            aspectMap.put("p1", record.getPoint1().getId());
            aspectMap.put("p2", record.getPoint2().getId());
            aspectMap.put("p1_speed", record.getPoint1Speed());
            aspectMap.put("p2_speed", record.getPoint2Speed());
            aspectMap.put("aspect_movement", record.getMovement().getLabel());
            aspectList.add(aspectMap);
        }
        map.put("aspects", aspectList);

        List<Map<String, Object>> activeList = new ArrayList<>();
        for (ActiveAspect active : result.getActiveAspects()) {
            Map<String, Object> activeMap = new LinkedHashMap<>();
            activeMap.put("name", active.getName().getLabel());
            activeMap.put("orb", active.getOrb());
            activeList.add(activeMap);
        }
        map.put("active_aspects", activeList);

        List<String> points = new ArrayList<>();
        for (PointId id : result.getActivePoints()) {
            points.add(id.getLabel());
        }
        map.put("active_points", points);

        // 统计信息
        AspectStats stats = result.getStats();
        Map<String, Object> statsMap = new HashMap<>();
        statsMap.put("computationTimeMs", stats.getComputationTimeMs());
        statsMap.put("pairsExamined", stats.getPairsExamined());
        statsMap.put("nAspects", result.getAspects().size());
        map.put("stats", statsMap);

        return map;
    }

    private static Map<String, Object> convertToPythonMap(ReturnEvent event) {
        Map<String, Object> map = new HashMap<>();
        map.put("body", event.getBody().name());
        map.put("targetLongitude", event.getTargetLongitude());
        map.put("julianDay", event.getJulianDay());
        map.put("utc", event.getUtc().toString());
        map.put("iterations", event.getSearch().getIterations());
        map.put("converged", event.getSearch().isConverged());
        return map;
    }

    private static Map<String, Object> errorMap(Exception e) {
        Map<String, Object> errorResult = new HashMap<>();
        errorResult.put("error", true);
        errorResult.put("errorMessage", e.getMessage());
        errorResult.put("errorType", e.getClass().getName());
        return errorResult;
    }
}
