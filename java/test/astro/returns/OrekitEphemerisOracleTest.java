package astro.returns;

import astro.helper.AngleUtils;
import astro.helper.JulianDays;
import astro.helper.OrekitDataLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * 需要Orekit数据目录（-Dorekit.data.path 或 OREKIT_DATA_PATH），没有时跳过
 */
class OrekitEphemerisOracleTest {

    private static OrekitEphemerisOracle oracle;

    @BeforeAll
    static void setUp() {
        assumeTrue(OrekitDataLoader.configureFromEnvironment(), "Orekit data not configured");
        oracle = new OrekitEphemerisOracle();
    }

    @Test
    void testPositionAt_agreesWithAnalyticEphemeris() {
        LowPrecisionEphemeris analytic = new LowPrecisionEphemeris();
        double jd = JulianDays.fromDateTime(1990, 6, 15, 1, 36, 0.0);

        BodyPosition sun = oracle.positionAt(jd, Body.SUN);
        BodyPosition moon = oracle.positionAt(jd, Body.MOON);

        assertEquals(0.0, AngleUtils.signedShortestDistance(
            analytic.positionAt(jd, Body.SUN).getLongitude(), sun.getLongitude()), 0.05);
        assertEquals(0.0, AngleUtils.signedShortestDistance(
            analytic.positionAt(jd, Body.MOON).getLongitude(), moon.getLongitude()), 0.5);
        assertTrue(sun.getSpeed() > 0.95 && sun.getSpeed() < 1.02);
        assertTrue(moon.getSpeed() > 11.0 && moon.getSpeed() < 16.0);
    }

    @Test
    void testSolarReturn_withOrekit() {
        ReturnSolver solver = new ReturnSolver(oracle);
        double start = JulianDays.fromDateTime(1991, 6, 13, 1, 36, 0.0);

        double jd = solver.solve(83.72, Body.SUN, start, 4.0);

        double sun = oracle.positionAt(jd, Body.SUN).getLongitude();
        assertEquals(0.0, AngleUtils.signedShortestDistance(83.72, sun), 1e-3);
    }
}
