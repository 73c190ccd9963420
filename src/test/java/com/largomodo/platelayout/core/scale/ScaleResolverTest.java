package com.largomodo.platelayout.core.scale;

import com.largomodo.platelayout.core.config.ScaleSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

class ScaleResolverTest {

    private ScaleResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ScaleResolver();
    }

    @Test
    void testFixedScaleSkipsProbing() {
        FirstPageProbe probe = mock(FirstPageProbe.class);

        ScaleResolution resolution = resolver.resolve(ScaleSpec.fixed(0.4), 2.0, probe);

        assertEquals(0.4, resolution.factor());
        assertFalse(resolution.auto());
        assertTrue(resolution.feasible());
        verifyNoInteractions(probe);
    }

    @Test
    void testAutoFindsLargestScaleForTarget() {
        // page 0 holds floor(1 / scale) images
        FirstPageProbe probe = scale -> new FirstPageProbe.Result(Math.min(20, (int) (1 / scale)), true);

        ScaleResolution resolution = resolver.resolve(ScaleSpec.auto(4), 1.0, probe);

        assertTrue(resolution.auto());
        assertEquals(0.25, resolution.factor(), 1e-3, "Largest scale that still fits four images");
        assertEquals(4, resolution.achieved());
        assertTrue(resolution.feasible());
    }

    @Test
    void testUpperBoundAcceptedWithoutBisection() {
        FirstPageProbe probe = spy(new FixedCount(12));

        ScaleResolution resolution = resolver.resolve(ScaleSpec.auto(12), 0.8, probe);

        assertEquals(0.8, resolution.factor(), "Upper bound wins when it already fits the target");
        assertTrue(resolution.feasible());
        verify(probe, times(3)).probe(anyDouble());
    }

    @Test
    void testTargetAboveCapacityIsInfeasible() {
        ScaleResolution resolution = resolver.resolve(ScaleSpec.auto(5), 1.0, new FixedCount(2));

        assertEquals(5, resolution.target());
        assertEquals(2, resolution.achieved(), "Nearest reachable count");
        assertFalse(resolution.feasible());
        assertEquals(1.0, resolution.factor(), "Capacity does not depend on scale, so the largest scale is kept");
    }

    @Test
    void testTargetBelowFixedCapacityIsInfeasible() {
        ScaleResolution resolution = resolver.resolve(ScaleSpec.auto(5), 1.0, new FixedCount(12));

        assertEquals(12, resolution.achieved(), "Fixed capacity strategies cannot hit a smaller target");
        assertFalse(resolution.feasible());
    }

    @Test
    void testNonUniformAtMinimumFallsBackToMinimum() {
        FirstPageProbe probe = scale -> new FirstPageProbe.Result(3, false);

        ScaleResolution resolution = resolver.resolve(ScaleSpec.auto(3).withMinScale(0.1), 1.0, probe);

        assertEquals(0.1, resolution.factor());
    }

    @Test
    void testResolutionIsRepeatable() {
        FirstPageProbe probe = scale -> new FirstPageProbe.Result((int) (2 / scale), true);

        ScaleResolution first = resolver.resolve(ScaleSpec.auto(7), 3.0, probe);
        ScaleResolution second = resolver.resolve(ScaleSpec.auto(7), 3.0, probe);

        assertEquals(first, second, "The resolver keeps no state between calls");
    }

    private static class FixedCount implements FirstPageProbe {
        private final int count;

        FixedCount(int count) {
            this.count = count;
        }

        @Override
        public Result probe(double scale) {
            return new Result(count, true);
        }
    }
}
