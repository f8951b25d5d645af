package com.probgraph.inference;

import com.probgraph.library.Poisson;
import com.probgraph.model.Apply1;
import com.probgraph.model.Universe;
import com.probgraph.util.RandomSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class MetropolisHastingsTest {

    @BeforeEach
    public void setUp() {
        RandomSource.setSeed(1234L);
    }

    @Test
    public void testRandomWalkOverInfiniteSupport() {
        Universe universe = new Universe("counts");
        Poisson count = new Poisson("count", universe, 3.0);
        Apply1<Integer, Boolean> small = new Apply1<>("small", universe, count, k -> k <= 2);

        InferenceResult result = new MetropolisHastings(50000, 1000, 1).infer(universe,
                Collections.singletonList(small));

        // e^-3 * (1 + 3 + 4.5)
        assertEquals(Math.exp(-3.0) * 8.5, result.probability(small, true), 0.04);
        assertEquals("metropolis_hastings", result.getAlgorithm());
        assertEquals(50000, result.getIterations());
    }

    @Test
    public void testPoissonMeanIsRecovered() {
        Universe universe = new Universe("counts");
        Poisson count = new Poisson("count", universe, 3.0);

        InferenceResult result = new MetropolisHastings(50000, 1000, 5).infer(universe,
                Collections.singletonList(count));
        assertEquals(3.0, result.distribution(count).expectation(Integer::doubleValue), 0.3);
    }

    @Test
    public void testObservedElementsKeepTheirObservation() {
        Universe universe = new Universe("counts");
        Poisson count = new Poisson("count", universe, 3.0);
        count.observe(5);

        InferenceResult result = new MetropolisHastings(100, 0, 1).infer(universe,
                Collections.singletonList(count));
        assertEquals(1.0, result.probability(count, 5), 0.0);
    }

    @Test
    public void testInvalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MetropolisHastings(0, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new MetropolisHastings(10, -1, 1));
        assertThrows(IllegalArgumentException.class, () -> new MetropolisHastings(10, 0, 0));
    }
}
