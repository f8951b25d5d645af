package com.probgraph.model;

import com.probgraph.factor.Factor;
import com.probgraph.factor.VariableContext;
import com.probgraph.inference.ForwardSampler;
import com.probgraph.inference.InferenceResult;
import com.probgraph.inference.VariableElimination;
import com.probgraph.library.Constant;
import com.probgraph.library.Flip;
import com.probgraph.util.RandomSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

public class ApplyTest {

    private Universe universe;

    @BeforeEach
    public void setUp() {
        RandomSource.setSeed(7L);
        universe = new Universe("apply");
    }

    @Test
    public void testValuesAreDistinctResultsOverParentSupports() {
        Flip a = new Flip("a", universe, 0.3);
        Flip b = new Flip("b", universe, 0.6);
        Apply2<Boolean, Boolean, Boolean> xor = new Apply2<>("xor", universe, a, b, (x, y) -> x ^ y);

        VariableContext context = new VariableContext();
        List<Boolean> values = context.values(xor);
        assertEquals(2, values.size());
        assertEquals(new HashSet<>(Arrays.asList(true, false)), new HashSet<>(values));
    }

    @Test
    public void testFactorIsIndicatorOfFunction() {
        Flip a = new Flip("a", universe, 0.3);
        Flip b = new Flip("b", universe, 0.6);
        Apply2<Boolean, Boolean, Boolean> xor = new Apply2<>("xor", universe, a, b, (x, y) -> x ^ y);

        VariableContext context = new VariableContext();
        List<Factor> factors = context.factors(xor);
        assertEquals(1, factors.size());
        Factor f = factors.get(0);
        assertEquals(3, f.arity());
        assertEquals(8, f.size());
        // one non-zero cell per parent assignment
        assertEquals(4.0, f.sum(), 1e-12);
        assertSame(context.variable(a), f.getVariables().get(0));
        assertSame(context.variable(xor), f.getVariables().get(2));
    }

    @Test
    public void testExactMarginalOfApply() {
        Flip a = new Flip("a", universe, 0.3);
        Flip b = new Flip("b", universe, 0.6);
        Apply2<Boolean, Boolean, Boolean> xor = new Apply2<>("xor", universe, a, b, (x, y) -> x ^ y);

        InferenceResult result = new VariableElimination().infer(universe, Collections.singletonList(xor));
        assertEquals(0.3 * 0.4 + 0.7 * 0.6, result.probability(xor, true), 1e-9);
    }

    @Test
    public void testRepeatedParentSharesOneDimension() {
        Flip a = new Flip("a", universe, 0.3);
        Apply2<Boolean, Boolean, Boolean> same = new Apply2<>("same", universe, a, a, Objects::equals);

        VariableContext context = new VariableContext();
        assertEquals(Collections.singletonList(true), context.values(same));
        Factor f = context.factors(same).get(0);
        assertEquals(2, f.arity());
        assertSame(context.variable(a), f.getVariables().get(0));

        InferenceResult result = new VariableElimination().infer(universe, Collections.singletonList(same));
        assertEquals(1.0, result.probability(same, true), 1e-9);
    }

    @Test
    public void testRepeatedParentKeepsArgumentOrder() {
        Flip a = new Flip("a", universe, 0.3);
        Flip b = new Flip("b", universe, 0.6);
        ApplyN<Boolean, String> word = new ApplyN<>("word", universe, Arrays.asList(a, b, a),
                xs -> (xs.get(0) ? "1" : "0") + (xs.get(1) ? "1" : "0") + (xs.get(2) ? "1" : "0"));

        assertEquals(new HashSet<>(Arrays.asList("000", "010", "101", "111")),
                new HashSet<>(new VariableContext().values(word)));
        InferenceResult result = new VariableElimination().infer(universe, Collections.singletonList(word));
        assertEquals(0.3 * 0.4, result.probability(word, "101"), 1e-9);
        assertEquals(0.0, result.probability(word, "100"), 1e-12);
    }

    @Test
    public void testValueFollowsParents() {
        Flip a = new Flip("a", universe, 0.5);
        Apply1<Boolean, String> label = new Apply1<>("label", universe, a, x -> x ? "heads" : "tails");

        for (int i = 0; i < 20; i++) {
            ForwardSampler.sample(universe, Collections.singletonList(label), true);
            assertEquals(a.value() ? "heads" : "tails", label.value());
        }
    }

    @Test
    public void testGenerateBeforeParentFails() {
        Flip a = new Flip("a", universe, 0.5);
        Apply1<Boolean, Boolean> not = new Apply1<>("not", universe, a, x -> !x);
        assertThrows(IllegalStateException.class, not::regenerateValue);
    }

    @Test
    public void testApply3AndApplyN() {
        Constant<Integer> one = new Constant<>("one", universe, 1);
        Constant<Integer> two = new Constant<>("two", universe, 2);
        Constant<Integer> three = new Constant<>("three", universe, 3);

        Apply3<Integer, Integer, Integer, Integer> product = new Apply3<>("product", universe, one, two, three,
                (x, y, z) -> x * y * z);
        ApplyN<Integer, Integer> sum = new ApplyN<>("sum", universe, Arrays.asList(one, two, three),
                xs -> xs.stream().mapToInt(Integer::intValue).sum());

        VariableContext context = new VariableContext();
        assertEquals(Collections.singletonList(6), context.values(product));
        assertEquals(Collections.singletonList(6), context.values(sum));

        ForwardSampler.sample(universe, Collections.emptyList(), true);
        assertEquals(6, product.value());
        assertEquals(6, sum.value());
        assertEquals(Arrays.asList(one, two, three), sum.args());
    }

    @Test
    public void testApplyIsDeterministic() {
        Flip a = new Flip("a", universe, 0.5);
        Apply1<Boolean, Boolean> not = new Apply1<>("not", universe, a, x -> !x);
        assertFalse(not.isStochastic());
        assertEquals(1.0, not.density(true), 0.0);
        assertTrue(not.enumerable().isPresent());
        assertTrue(not.factorMaker().isPresent());
    }
}
