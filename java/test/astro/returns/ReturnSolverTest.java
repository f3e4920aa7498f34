package astro.returns;

import astro.helper.AngleUtils;
import astro.helper.RecordingOracle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReturnSolverTest {

    private static final double T0 = 2450000.5;
    private static final double SOLAR_RATE = 0.9856;

    /**
     * 黄经随时间线性增加的星历
     */
    private static EphemerisOracle linear(double longitudeAtT0, double rate) {
        return (julianDay, body) -> new BodyPosition(
            AngleUtils.normalize(longitudeAtT0 + rate * (julianDay - T0)), rate);
    }

    @Test
    void testSolve_linearMotionRecoversCrossing() {
        double crossing = T0 + 1.234;
        double target = 123.4 + SOLAR_RATE * 1.234;
        ReturnSolver solver = new ReturnSolver(linear(123.4, SOLAR_RATE));

        ReturnSearchResult result = solver.solveDetailed(target, Body.SUN, T0, 3.0,
            ReturnSolver.DEFAULT_TOLERANCE, ReturnSolver.DEFAULT_MAX_ITERATIONS);

        assertTrue(result.isConverged());
        assertEquals(crossing, result.getJulianDay(), ReturnSolver.DEFAULT_TOLERANCE / SOLAR_RATE);
        assertTrue(result.getIterations() <= ReturnSolver.DEFAULT_MAX_ITERATIONS);
        assertTrue(Math.abs(result.getLastResidual()) < ReturnSolver.DEFAULT_TOLERANCE
            || result.getIntervalWidth() < ReturnSolver.DEFAULT_TOLERANCE);
    }

    @Test
    void testSolve_crossingAtWindowStart() {
        ReturnSolver solver = new ReturnSolver(linear(123.4, SOLAR_RATE));

        double jd = solver.solve(123.4, Body.SUN, T0, 3.0);

        assertEquals(T0, jd, ReturnSolver.DEFAULT_TOLERANCE / SOLAR_RATE);
    }

    @Test
    void testSolve_targetIsNormalized() {
        ReturnSolver solver = new ReturnSolver(linear(123.4, SOLAR_RATE));
        double target = 123.4 + SOLAR_RATE * 1.234;

        double plain = solver.solve(target, Body.SUN, T0, 3.0);
        double shifted = solver.solve(target + 720.0, Body.SUN, T0, 3.0);
        double negative = solver.solve(target - 360.0, Body.SUN, T0, 3.0);

        assertEquals(plain, shifted, 1e-6);
        assertEquals(plain, negative, 1e-6);
    }

    @Test
    void testSolve_wrapsThroughZeroAries() {
        ReturnSolver solver = new ReturnSolver(linear(359.5, 1.0));

        double jd = solver.solve(0.2, Body.SUN, T0, 3.0);

        assertEquals(T0 + 0.7, jd, 1e-4);
    }

    @Test
    void testSolve_fastBodyOverLongWindow() {
        double rate = 13.2;
        double crossing = T0 + 7.3;
        double target = AngleUtils.normalize(40.0 + rate * 7.3);
        RecordingOracle recorder = new RecordingOracle(linear(40.0, rate));
        ReturnSolver solver = new ReturnSolver(recorder);

        double jd = solver.solve(target, Body.MOON, T0, 31.0);

        assertEquals(crossing, jd, 1e-4);
        assertTrue(recorder.getCount() <= ReturnSolver.DEFAULT_MAX_ITERATIONS);
    }

    @Test
    void testSolve_iterationCapReturnsBestEstimate() {
        double crossing = T0 + 1.234;
        double target = 123.4 + SOLAR_RATE * 1.234;
        RecordingOracle recorder = new RecordingOracle(linear(123.4, SOLAR_RATE));
        ReturnSolver solver = new ReturnSolver(recorder);

        ReturnSearchResult result = solver.solveDetailed(target, Body.SUN, T0, 3.0, 1e-12, 10);

        assertFalse(result.isConverged());
        assertEquals(10, result.getIterations());
        assertEquals(10, recorder.getCount(), "one ephemeris query per iteration");
        assertEquals(3.0 / 1024.0, result.getIntervalWidth(), 1e-9);
        assertEquals(crossing, result.getJulianDay(), result.getIntervalWidth() / 2.0 + 1e-9);

        // 每次查询都落在窗口内
        for (double[] row : recorder.getResults()) {
            assertTrue(row[0] > T0 && row[0] < T0 + 3.0);
            assertEquals(SOLAR_RATE, row[2], 0.0);
        }
    }

    @Test
    void testSolve_oracleFailurePropagates() {
        EphemerisException failure = new EphemerisException("no data for epoch");
        ReturnSolver solver = new ReturnSolver((julianDay, body) -> {
            throw failure;
        });

        EphemerisException thrown = assertThrows(EphemerisException.class,
            () -> solver.solve(10.0, Body.SUN, T0, 3.0));
        assertSame(failure, thrown);
    }

    @Test
    void testSolve_rejectsInvalidArguments() {
        ReturnSolver solver = new ReturnSolver(linear(0.0, 1.0));

        assertThrows(IllegalArgumentException.class, () -> new ReturnSolver(null));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(10.0, null, T0, 3.0));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(Double.NaN, Body.SUN, T0, 3.0));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(10.0, Body.SUN, T0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(10.0, Body.SUN, T0, -1.0));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(10.0, Body.SUN, T0, 3.0, 0.0, 50));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(10.0, Body.SUN, T0, 3.0, 1e-4, 0));
    }
}
