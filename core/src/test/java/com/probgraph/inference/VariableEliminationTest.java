package com.probgraph.inference;

import com.probgraph.library.Constant;
import com.probgraph.library.Flip;
import com.probgraph.library.Poisson;
import com.probgraph.library.Select;
import com.probgraph.model.Apply2;
import com.probgraph.model.Chain;
import com.probgraph.model.Chains;
import com.probgraph.model.Universe;
import com.probgraph.model.UnsupportedCapabilityException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class VariableEliminationTest {

    private final VariableElimination engine = new VariableElimination();

    @Test
    public void testPriorMarginal() {
        Universe universe = new Universe("u");
        Select<String> weather = new Select<>("weather", universe, Arrays.asList(0.5, 0.3, 0.2),
                Arrays.asList("sun", "rain", "snow"));

        InferenceResult result = engine.infer(universe, Collections.singletonList(weather));
        assertEquals("variable_elimination", result.getAlgorithm());
        assertEquals(0.3, result.probability(weather, "rain"), 1e-12);
        assertEquals("sun", result.distribution(weather).mostLikely());
    }

    @Test
    public void testPosteriorThroughChain() {
        Universe universe = new Universe("u");
        Flip cause = new Flip("cause", universe, 0.3);
        Chain<Boolean, Boolean> effect = Chains.chain("effect", universe, cause,
                c -> new Flip(null, universe, c ? 0.9 : 0.2));
        effect.observe(true);

        InferenceResult result = engine.infer(universe, Collections.singletonList(cause));
        assertEquals(0.27 / 0.41, result.probability(cause, true), 1e-9);
    }

    @Test
    public void testSeveralTargetsInOneRun() {
        Universe universe = new Universe("u");
        Flip a = new Flip("a", universe, 0.5);
        Flip b = new Flip("b", universe, 0.5);
        Apply2<Boolean, Boolean, Boolean> both = new Apply2<>("both", universe, a, b, (x, y) -> x && y);
        both.observe(false);

        InferenceResult result = engine.infer(universe, Arrays.asList(a, b));
        assertEquals(1.0 / 3.0, result.probability(a, true), 1e-9);
        assertEquals(1.0 / 3.0, result.probability(b, true), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> result.distribution(both));
    }

    @Test
    public void testUnobserveRestoresPrior() {
        Universe universe = new Universe("u");
        Flip a = new Flip("a", universe, 0.5);
        Flip b = new Flip("b", universe, 0.5);
        Apply2<Boolean, Boolean, Boolean> both = new Apply2<>("both", universe, a, b, (x, y) -> x && y);
        both.observe(true);
        assertEquals(1.0, engine.infer(universe, Collections.singletonList(a)).probability(a, true), 1e-9);

        both.unobserve();
        assertEquals(0.5, engine.infer(universe, Collections.singletonList(a)).probability(a, true), 1e-9);
    }

    @Test
    public void testImpossibleEvidenceFails() {
        Universe universe = new Universe("u");
        Constant<Boolean> always = new Constant<>("always", universe, true);
        always.observe(false);
        assertThrows(IllegalStateException.class, () -> engine.infer(universe, Collections.singletonList(always)));
    }

    @Test
    public void testInfiniteSupportIsUnsupported() {
        Universe universe = new Universe("u");
        new Poisson("count", universe, 2.0);
        Flip flip = new Flip("flip", universe, 0.5);
        assertThrows(UnsupportedCapabilityException.class,
                () -> engine.infer(universe, Collections.singletonList(flip)));
    }
}
