package astro.aspects;

import astro.aspects.model.ActiveAspect;
import astro.aspects.model.AspectMovement;
import astro.aspects.model.AspectName;
import astro.aspects.model.AspectRecord;
import astro.aspects.model.Chart;
import astro.aspects.model.ChartAspects;
import astro.aspects.model.ChartPoint;
import astro.aspects.model.PointId;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AspectEngineTest {

    private final AspectEngine engine = new AspectEngine();

    private static List<ActiveAspect> only(AspectName name, double orb) {
        return Collections.singletonList(ActiveAspect.of(name, orb));
    }

    @Test
    void testSingleChart_skipsOppositeAxisPairs() {
        Chart chart = new Chart("natal", Arrays.asList(
            ChartPoint.fixed(PointId.ASCENDANT, 0.0),
            ChartPoint.fixed(PointId.DESCENDANT, 180.0)
        ));

        List<AspectRecord> records = engine.singleChartAspects(chart, only(AspectName.OPPOSITION, 10.0), null);
        assertTrue(records.isEmpty());

        AspectConfig config = new AspectConfig();
        config.setActiveAspects(only(AspectName.OPPOSITION, 10.0));
        ChartAspects result = engine.analyzeSingleChart(chart, config);
        assertEquals(1, result.getStats().getPairsExcluded());
        assertEquals(0, result.getStats().getPairsExamined());
    }

    @Test
    void testSingleChart_nodesAreSkippedButOtherOppositionsReported() {
        Chart chart = new Chart("natal", Arrays.asList(
            ChartPoint.of(PointId.TRUE_NORTH_LUNAR_NODE, 40.0, -0.05),
            ChartPoint.of(PointId.TRUE_SOUTH_LUNAR_NODE, 220.0, -0.05),
            ChartPoint.of(PointId.SUN, 221.0, 1.0)
        ));

        List<AspectRecord> records = engine.singleChartAspects(chart, only(AspectName.OPPOSITION, 10.0), null);

        assertEquals(1, records.size());
        assertEquals(PointId.TRUE_NORTH_LUNAR_NODE, records.get(0).getPoint1());
        assertEquals(PointId.SUN, records.get(0).getPoint2());
        assertEquals(1.0, records.get(0).getOrbit(), 1e-9);
    }

    @Test
    void testSingleChart_axisPairIsAlwaysStatic() {
        Chart chart = new Chart("natal", Arrays.asList(
            ChartPoint.of(PointId.ASCENDANT, 0.0, 360.0),
            ChartPoint.of(PointId.MEDIUM_COELI, 272.0, 350.0)
        ));

        List<AspectRecord> records = engine.singleChartAspects(chart, only(AspectName.SQUARE, 5.0), null);

        assertEquals(1, records.size());
        assertEquals(AspectName.SQUARE, records.get(0).getAspect());
        assertEquals(AspectMovement.STATIC, records.get(0).getMovement());
    }

    @Test
    void testSingleChart_preservesPairOrder() {
        Chart chart = new Chart("natal", Arrays.asList(
            ChartPoint.of(PointId.SUN, 0.0, 1.0),
            ChartPoint.of(PointId.MOON, 120.0, 13.0),
            ChartPoint.of(PointId.MARS, 240.0, 0.6)
        ));

        List<AspectRecord> records = engine.singleChartAspects(chart, only(AspectName.TRINE, 8.0), null);

        assertEquals(3, records.size());
        assertEquals(PointId.SUN, records.get(0).getPoint1());
        assertEquals(PointId.MOON, records.get(0).getPoint2());
        assertEquals(PointId.SUN, records.get(1).getPoint1());
        assertEquals(PointId.MARS, records.get(1).getPoint2());
        assertEquals(PointId.MOON, records.get(2).getPoint1());
        assertEquals(PointId.MARS, records.get(2).getPoint2());
        for (AspectRecord record : records) {
            assertEquals("natal", record.getPoint1Owner());
            assertEquals(120, record.getExactDegree());
        }
    }

    @Test
    void testSingleChart_missingSpeedCountsAsZero() {
        Chart chart = new Chart("natal", Arrays.asList(
            new ChartPoint(PointId.SUN, 10.0, null),
            ChartPoint.of(PointId.MOON, 18.0, 13.0)
        ));

        AspectRecord record = engine.singleChartAspects(chart, only(AspectName.CONJUNCTION, 10.0), null).get(0);

        assertEquals(0.0, record.getPoint1Speed(), 0.0);
        assertEquals(AspectMovement.SEPARATING, record.getMovement());
    }

    @Test
    void testAxisOrbLimit_filtersOnlyAxisAspects() {
        Chart chart = new Chart("natal", Arrays.asList(
            ChartPoint.of(PointId.SUN, 0.0, 1.0),
            ChartPoint.fixed(PointId.ASCENDANT, 63.0),
            ChartPoint.of(PointId.MOON, 127.0, 13.0)
        ));
        List<ActiveAspect> aspects = Arrays.asList(
            ActiveAspect.of(AspectName.SEXTILE, 6.0),
            ActiveAspect.of(AspectName.TRINE, 8.0)
        );

        List<AspectRecord> unfiltered = engine.singleChartAspects(chart, aspects, null);
        assertEquals(3, unfiltered.size());

        List<AspectRecord> filtered = engine.singleChartAspects(chart, aspects, 3.0);
        assertEquals(1, filtered.size(), "orbit equal to the limit is dropped");
        assertEquals(PointId.SUN, filtered.get(0).getPoint1());
        assertEquals(PointId.MOON, filtered.get(0).getPoint2());
        assertFalse(filtered.get(0).involvesAxis());

        List<AspectRecord> relaxed = engine.singleChartAspects(chart, aspects, 4.5);
        assertEquals(3, relaxed.size());
    }

    @Test
    void testDualChart_fixedChartUsesZeroSpeed() {
        Chart natal = new Chart("natal", Collections.singletonList(ChartPoint.of(PointId.SUN, 10.0, 1.0)));
        Chart transit = new Chart("transit", Collections.singletonList(ChartPoint.of(PointId.MOON, 68.0, 0.5)));
        List<ActiveAspect> aspects = only(AspectName.SEXTILE, 6.0);

        AspectRecord moving = engine.dualChartAspects(natal, transit, aspects, null).get(0);
        assertEquals(AspectMovement.SEPARATING, moving.getMovement());
        assertEquals(1.0, moving.getPoint1Speed(), 0.0);

        AspectRecord fixed = engine.dualChartAspects(natal, transit, aspects, null, true, false).get(0);
        assertEquals(AspectMovement.APPLYING, fixed.getMovement());
        assertEquals(0.0, fixed.getPoint1Speed(), 0.0);
        assertEquals(0.5, fixed.getPoint2Speed(), 0.0);
        assertEquals("natal", fixed.getPoint1Owner());
        assertEquals("transit", fixed.getPoint2Owner());
        assertEquals(2.0, fixed.getOrbit(), 1e-9);
    }

    @Test
    void testDualChart_axisOrbLimitApplies() {
        Chart natal = new Chart("natal", Arrays.asList(
            ChartPoint.fixed(PointId.ASCENDANT, 0.0),
            ChartPoint.of(PointId.SUN, 5.0, 0.3)
        ));
        Chart transit = new Chart("transit", Collections.singletonList(ChartPoint.of(PointId.MARS, 63.0, 1.0)));
        List<ActiveAspect> aspects = only(AspectName.SEXTILE, 6.0);

        assertEquals(2, engine.dualChartAspects(natal, transit, aspects, null).size());

        List<AspectRecord> filtered = engine.dualChartAspects(natal, transit, aspects, 3.0);
        assertEquals(1, filtered.size());
        assertEquals(PointId.SUN, filtered.get(0).getPoint1());
        assertEquals(PointId.MARS, filtered.get(0).getPoint2());
        assertEquals(2.0, filtered.get(0).getOrbit(), 1e-9);
    }

    @Test
    void testDualChart_fixedSecondChart() {
        Chart natal = new Chart("natal", Arrays.asList(
            ChartPoint.fixed(PointId.ASCENDANT, 0.0),
            ChartPoint.of(PointId.SUN, 5.0, 0.3)
        ));
        Chart transit = new Chart("transit", Collections.singletonList(ChartPoint.of(PointId.MARS, 63.0, 1.0)));
        List<ActiveAspect> aspects = only(AspectName.SEXTILE, 6.0);

        List<AspectRecord> moving = engine.dualChartAspects(natal, transit, aspects, null, false, false);
        assertEquals(AspectMovement.SEPARATING, moving.get(0).getMovement());
        assertEquals(AspectMovement.APPLYING, moving.get(1).getMovement());

        List<AspectRecord> fixed = engine.dualChartAspects(natal, transit, aspects, null, false, true);
        assertEquals(2, fixed.size());
        for (AspectRecord record : fixed) {
            assertEquals(0.0, record.getPoint2Speed(), 0.0);
        }
        assertEquals(PointId.ASCENDANT, fixed.get(0).getPoint1());
        assertEquals(AspectMovement.STATIC, fixed.get(0).getMovement());
        assertEquals(PointId.SUN, fixed.get(1).getPoint1());
        assertEquals(0.3, fixed.get(1).getPoint1Speed(), 0.0);
        assertEquals(AspectMovement.SEPARATING, fixed.get(1).getMovement());
    }

    @Test
    void testDualChart_reportsOppositeAxesAcrossCharts() {
        Chart first = new Chart("a", Collections.singletonList(ChartPoint.fixed(PointId.ASCENDANT, 0.0)));
        Chart second = new Chart("b", Collections.singletonList(ChartPoint.fixed(PointId.DESCENDANT, 181.0)));

        List<AspectRecord> records = engine.dualChartAspects(first, second, only(AspectName.OPPOSITION, 10.0), null);

        assertEquals(1, records.size());
        assertEquals(AspectMovement.STATIC, records.get(0).getMovement());
    }

    @Test
    void testAnalyzeSingleChart_defaultsAndPointRestriction() {
        Chart chart = new Chart("natal", Arrays.asList(
            ChartPoint.of(PointId.SUN, 0.0, 1.0),
            ChartPoint.of(PointId.MARS, 60.0, 0.6),
            ChartPoint.of(PointId.MOON, 120.0, 13.0)
        ));
        AspectConfig config = new AspectConfig();
        config.setActivePoints(EnumSet.of(PointId.SUN, PointId.MOON));

        ChartAspects result = engine.analyzeSingleChart(chart, config);

        assertFalse(result.isDualChart());
        assertEquals(Arrays.asList(PointId.SUN, PointId.MOON), result.getActivePoints());
        assertEquals(6, result.getActiveAspects().size());
        assertEquals(1, result.getStats().getPairsExamined());
        assertEquals(1, result.getAspects().size());
        assertEquals(1, result.getAspects(AspectName.TRINE).size());
    }

    @Test
    void testRestrictTo_nullKeepsAllAndEmptyKeepsNone() {
        Chart chart = new Chart("natal", Arrays.asList(
            ChartPoint.of(PointId.SUN, 0.0, 1.0),
            ChartPoint.of(PointId.MOON, 120.0, 13.0)
        ));

        assertEquals(2, chart.restrictTo(null).getPoints().size());
        assertTrue(chart.restrictTo(EnumSet.noneOf(PointId.class)).getPoints().isEmpty());
    }

    @Test
    void testAnalyzeDualChart_sameOwnerIsStillDual() {
        Chart chart = new Chart("natal", Collections.singletonList(ChartPoint.of(PointId.SUN, 0.0, 1.0)));

        ChartAspects result = engine.analyzeDualChart(chart, chart, new AspectConfig());

        assertTrue(result.isDualChart());
        assertEquals(1, result.getAspects().size());
        assertEquals(AspectName.CONJUNCTION, result.getAspects().get(0).getAspect());
        assertEquals(AspectMovement.STATIC, result.getAspects().get(0).getMovement());
    }

    @Test
    void testInvalidArguments() {
        Chart chart = new Chart("natal", Collections.singletonList(ChartPoint.of(PointId.SUN, 0.0, 1.0)));

        assertThrows(IllegalArgumentException.class,
            () -> engine.singleChartAspects(chart, Collections.emptyList(), null));
        assertThrows(IllegalArgumentException.class,
            () -> engine.singleChartAspects(chart, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> engine.singleChartAspects(chart, only(AspectName.TRINE, 8.0), -1.0));
        assertThrows(IllegalArgumentException.class,
            () -> new Chart("natal", Arrays.asList(
                ChartPoint.of(PointId.SUN, 0.0, 1.0),
                ChartPoint.of(PointId.SUN, 10.0, 1.0))));
        assertThrows(IllegalArgumentException.class,
            () -> ChartPoint.of(PointId.MOON, Double.NaN, 13.0));
    }
}
