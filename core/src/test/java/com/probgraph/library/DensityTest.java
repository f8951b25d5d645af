package com.probgraph.library;

import com.probgraph.learning.BetaParameter;
import com.probgraph.learning.DirichletParameter;
import com.probgraph.model.Universe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DensityTest {

    private Universe universe;

    @BeforeEach
    public void setUp() {
        universe = new Universe("densities");
    }

    @Test
    public void testFlipDensitySumsToOne() {
        Flip flip = new Flip("flip", universe, 0.3);
        double total = 0.0;
        for (Boolean b : flip.support()) {
            total += flip.density(b);
        }
        assertEquals(1.0, total, 1e-12);
        assertEquals(0.3, flip.density(true), 1e-12);
    }

    @Test
    public void testSelectNormalizesAndMergesWeights() {
        Select<Integer> select = new Select<>("select", universe, Arrays.asList(2.0, 3.0, 5.0),
                Arrays.asList(0, 1, 2));
        assertEquals(0.2, select.density(0), 1e-12);
        assertEquals(0.5, select.density(2), 1e-12);
        assertEquals(0.0, select.density(7), 0.0);

        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("a", 1.0);
        weights.put("b", 3.0);
        Select<String> fromMap = new Select<>("fromMap", universe, weights);
        assertEquals(0.75, fromMap.density("b"), 1e-12);

        Select<String> merged = new Select<>("merged", universe, Arrays.asList(1.0, 1.0, 2.0),
                Arrays.asList("x", "y", "x"));
        assertEquals(Arrays.asList("x", "y"), merged.support());
        assertEquals(0.75, merged.density("x"), 1e-12);
    }

    @Test
    public void testSelectRejectsBadWeights() {
        assertThrows(IllegalArgumentException.class,
                () -> new Select<>("neg", universe, Arrays.asList(-1.0, 2.0), Arrays.asList(0, 1)));
        assertThrows(IllegalArgumentException.class,
                () -> new Select<>("zero", universe, Arrays.asList(0.0, 0.0), Arrays.asList(0, 1)));
        assertThrows(IllegalArgumentException.class,
                () -> new Select<>("short", universe, Arrays.asList(1.0), Arrays.asList(0, 1)));
        assertTrue(universe.activeElements().isEmpty());
    }

    @Test
    public void testPoissonDensitySumsToOne() {
        Poisson poisson = new Poisson("poisson", universe, 3.0);
        double total = 0.0;
        for (int k = 0; k < 100; k++) {
            total += poisson.density(k);
        }
        assertEquals(1.0, total, 1e-8);
        assertEquals(0.0, poisson.density(-1), 0.0);
        assertEquals(Math.exp(-3.0) * 4.5, poisson.density(2), 1e-12);
    }

    @Test
    public void testBetaDensityIntegratesToOne() {
        BetaParameter beta = new BetaParameter("beta", universe, 2.0, 5.0);
        int steps = 100000;
        double total = 0.0;
        for (int i = 0; i < steps; i++) {
            total += beta.density((i + 0.5) / steps) / steps;
        }
        assertEquals(1.0, total, 1e-6);
        assertEquals(0.0, beta.density(-0.1), 0.0);
        assertEquals(0.0, beta.density(1.5), 0.0);
    }

    @Test
    public void testUniformBetaAndDirichletDensities() {
        BetaParameter beta = new BetaParameter("beta", universe, 1.0, 1.0);
        assertEquals(1.0, beta.density(0.0), 1e-12);
        assertEquals(1.0, beta.density(0.42), 1e-12);

        DirichletParameter dirichlet = new DirichletParameter("dirichlet", universe, 1.0, 1.0, 1.0);
        // Gamma(3) over the 2-simplex
        assertEquals(2.0, dirichlet.density(new double[] { 0.2, 0.3, 0.5 }), 1e-9);
        assertEquals(0.0, dirichlet.density(new double[] { 0.2, 0.3, 0.6 }), 0.0);
        assertEquals(0.0, dirichlet.density(new double[] { 0.5, 0.5 }), 0.0);
    }

    @Test
    public void testConstantIsPointMass() {
        Constant<String> constant = new Constant<>("constant", universe, "only");
        assertEquals(1.0, constant.density("only"), 0.0);
        assertEquals(0.0, constant.density("other"), 0.0);
        assertFalse(constant.isStochastic());
    }
}
