package com.probgraph.model;

import com.probgraph.factor.Factor;
import com.probgraph.factor.VariableContext;
import com.probgraph.inference.ForwardSampler;
import com.probgraph.inference.InferenceResult;
import com.probgraph.inference.VariableElimination;
import com.probgraph.library.Constant;
import com.probgraph.library.Flip;
import com.probgraph.library.Poisson;
import com.probgraph.library.Select;
import com.probgraph.util.RandomSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

public class ChainTest {

    private Universe universe;

    @BeforeEach
    public void setUp() {
        RandomSource.setSeed(11L);
        universe = new Universe("chains");
    }

    private Flip weighted(boolean heads) {
        return new Flip(null, universe, heads ? 0.9 : 0.2);
    }

    @Test
    public void testCachingChainReusesSubordinates() {
        Flip parent = new Flip("parent", universe, 0.5);
        CachingChain<Boolean, Boolean> chain = new CachingChain<>("chain", universe, parent, this::weighted);

        Element<Boolean, ?> first = chain.get(true);
        Element<Boolean, ?> other = chain.get(false);
        Element<Boolean, ?> again = chain.get(true);

        assertSame(first, again);
        assertNotSame(first, other);
        assertEquals(2, chain.cachedCount());
        assertEquals(2, universe.temporaryCount());
    }

    @Test
    public void testNonCachingChainRebuildsOnChange() {
        Flip parent = new Flip("parent", universe, 0.5);
        NonCachingChain<Boolean, Boolean> chain = new NonCachingChain<>("chain", universe, parent, this::weighted);

        Element<Boolean, ?> first = chain.get(true);
        assertSame(first, chain.get(true));
        chain.get(false);
        Element<Boolean, ?> again = chain.get(true);

        assertNotSame(first, again);
        // replaced subordinates are dropped
        assertEquals(1, universe.temporaryCount());
    }

    @Test
    public void testChainsSelectsPolicyFromParent() {
        Flip small = new Flip("small", universe, 0.5);
        Poisson large = new Poisson("large", universe, 2.0);

        Chain<Boolean, Boolean> cached = Chains.chain("cached", universe, small, this::weighted);
        Chain<Integer, Boolean> uncached = Chains.chain("uncached", universe, large, n -> weighted(n > 2));

        assertTrue(cached instanceof CachingChain);
        assertTrue(uncached instanceof NonCachingChain);
    }

    @Test
    public void testCacheEvictsLeastRecentlyUsed() {
        Select<Integer> parent = new Select<>("parent", universe, Arrays.asList(1.0, 1.0, 1.0),
                Arrays.asList(0, 1, 2));
        CachingChain<Integer, Boolean> chain = new CachingChain<>("chain", universe, parent, n -> weighted(n > 0),
                2);

        Element<Boolean, ?> zero = chain.get(0);
        chain.get(1);
        chain.get(2);

        assertEquals(2, chain.getCapacity());
        assertEquals(2, chain.cachedCount());
        assertEquals(2, universe.temporaryCount());
        assertNotSame(zero, chain.get(0));
    }

    @Test
    public void testSubordinatesAreOwnedByChain() {
        Flip parent = new Flip("parent", universe, 0.5);
        Chain<Boolean, Boolean> chain = Chains.chain("chain", universe, parent, this::weighted);

        Element<Boolean, ?> sub = chain.get(true);
        assertTrue(sub.isTemporary());
        assertSame(chain, sub.getOwner().get());
        assertFalse(universe.activeElements().contains(sub));
    }

    @Test
    public void testValueTracksSelectedSubordinate() {
        Flip parent = new Flip("parent", universe, 0.5);
        Chain<Boolean, Boolean> chain = Chains.chain("chain", universe, parent, this::weighted);

        for (int i = 0; i < 20; i++) {
            ForwardSampler.sample(universe, Collections.singletonList(chain), true);
            assertEquals(chain.get(parent.value()).value(), chain.value());
            assertEquals(Collections.singletonList(chain.get(parent.value())), chain.dynamicArgs());
        }
    }

    @Test
    public void testExpansionCoversEveryParentValue() {
        Flip parent = new Flip("parent", universe, 0.5);
        Chain<Boolean, Boolean> chain = Chains.chain("chain", universe, parent, this::weighted);

        VariableContext context = new VariableContext();
        Map<Boolean, Element<Boolean, ?>> expansion = chain.expansion(context);
        assertEquals(new HashSet<>(Arrays.asList(true, false)), expansion.keySet());
        assertSame(expansion, chain.expansion(context));
        assertEquals(3, chain.expandedArgs(context).size());

        List<Factor> factors = context.factors(chain);
        assertEquals(2, factors.size());
        for (Factor f : factors) {
            assertEquals(3, f.arity());
            assertSame(context.variable(parent), f.getVariables().get(0));
            assertSame(context.variable(chain), f.getVariables().get(1));
        }
    }

    @Test
    public void testChainValuesUnionSubordinateValues() {
        Flip parent = new Flip("parent", universe, 0.5);
        Chain<Boolean, Integer> chain = Chains.chain("chain", universe, parent,
                b -> b ? new Select<Integer>(null, universe, Arrays.asList(1.0, 1.0), Arrays.asList(1, 2))
                        : new Select<Integer>(null, universe, Arrays.asList(1.0, 1.0), Arrays.asList(2, 3)));

        List<Integer> values = new VariableContext().values(chain);
        assertEquals(new HashSet<>(Arrays.asList(1, 2, 3)), new HashSet<>(values));
        assertEquals(3, values.size());
    }

    @Test
    public void testParentAsSubordinate() {
        Flip parent = new Flip("parent", universe, 0.3);
        Constant<Boolean> never = new Constant<>("never", universe, false);
        Function<Boolean, Element<Boolean, ?>> pick = b -> b ? parent : never;
        Chain<Boolean, Boolean> chain = Chains.chain("chain", universe, parent, pick);

        VariableContext context = new VariableContext();
        List<Factor> factors = context.factors(chain);
        assertEquals(2, factors.size());
        // the parent's own branch has no separate subordinate dimension
        assertEquals(new HashSet<>(Arrays.asList(2, 3)),
                new HashSet<>(Arrays.asList(factors.get(0).arity(), factors.get(1).arity())));

        InferenceResult result = new VariableElimination().infer(universe, Collections.singletonList(chain));
        assertEquals(0.3, result.probability(chain, true), 1e-9);
    }

    @Test
    public void testRestoringSnapshotRestoresNonCachingSelection() {
        Flip parent = new Flip("parent", universe, 0.5);
        NonCachingChain<Boolean, Boolean> chain = new NonCachingChain<>("chain", universe, parent, this::weighted);

        Element<Boolean, ?> first = chain.get(true);
        Element.ElementState saved = chain.snapshot();
        chain.get(false);
        chain.restore(saved);

        assertSame(first, chain.get(true));
        assertEquals(1, universe.temporaryCount());
    }
}
