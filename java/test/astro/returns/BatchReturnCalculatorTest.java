package astro.returns;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchReturnCalculatorTest {

    private static List<ReturnRequest> requests() {
        return Arrays.asList(
            new ReturnRequest("moon-2020-06", Body.MOON, 339.55196, 2459001.5, 31.0),
            new ReturnRequest("sun-1991", Body.SUN, 83.72, 2448420.5667, 4.0),
            new ReturnRequest("sun-2020", Body.SUN, 83.72, 2459013.5667, 4.0)
        );
    }

    private static ReturnSearchConfig config(boolean parallel) {
        ReturnSearchConfig config = new ReturnSearchConfig();
        config.setUseParallel(parallel);
        return config;
    }

    @Test
    void testComputeAll_parallelMatchesSequential() {
        LowPrecisionEphemeris ephemeris = new LowPrecisionEphemeris();

        Map<String, ReturnEvent> sequential = new BatchReturnCalculator(ephemeris, config(false)).computeAll(requests());
        Map<String, ReturnEvent> parallel = new BatchReturnCalculator(ephemeris, config(true)).computeAll(requests());

        assertEquals(Arrays.asList("moon-2020-06", "sun-1991", "sun-2020"), new ArrayList<>(parallel.keySet()));
        for (String id : sequential.keySet()) {
            assertEquals(sequential.get(id).getJulianDay(), parallel.get(id).getJulianDay(), 0.0, id);
            assertTrue(parallel.get(id).getSearch().isConverged(), id);
        }
        assertEquals(2448422.8086, parallel.get("sun-1991").getJulianDay(), 0.01);
        assertEquals(2459014.8164, parallel.get("sun-2020").getJulianDay(), 0.01);
        assertEquals(2459012.68, parallel.get("moon-2020-06").getJulianDay(), 0.05);
    }

    @Test
    void testComputeAll_failurePropagates() {
        List<ReturnRequest> withFailure = new ArrayList<>(requests());
        withFailure.add(new ReturnRequest("mars", Body.MARS, 10.0, 2451545.0, 30.0));
        LowPrecisionEphemeris ephemeris = new LowPrecisionEphemeris();

        assertThrows(EphemerisException.class,
            () -> new BatchReturnCalculator(ephemeris, config(true)).computeAll(withFailure));
        assertThrows(EphemerisException.class,
            () -> new BatchReturnCalculator(ephemeris, config(false)).computeAll(withFailure));
    }

    @Test
    void testComputeAll_rejectsDuplicateIds() {
        List<ReturnRequest> duplicated = Arrays.asList(
            new ReturnRequest("a", Body.SUN, 10.0, 2451545.0, 4.0),
            new ReturnRequest("a", Body.MOON, 10.0, 2451545.0, 31.0)
        );

        assertThrows(IllegalArgumentException.class,
            () -> new BatchReturnCalculator(new LowPrecisionEphemeris(), config(true)).computeAll(duplicated));
    }

    @Test
    void testComputeAll_emptyBatch() {
        Map<String, ReturnEvent> result = new BatchReturnCalculator(new LowPrecisionEphemeris(), config(true))
            .computeAll(new ArrayList<>());
        assertTrue(result.isEmpty());
    }
}
