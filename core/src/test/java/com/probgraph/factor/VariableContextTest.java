package com.probgraph.factor;

import com.probgraph.library.Flip;
import com.probgraph.library.Poisson;
import com.probgraph.model.Capability;
import com.probgraph.model.CachingChain;
import com.probgraph.model.Chain;
import com.probgraph.model.CyclicDependencyException;
import com.probgraph.model.Element;
import com.probgraph.model.Universe;
import com.probgraph.model.UnsupportedCapabilityException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class VariableContextTest {

    @Test
    public void testOneVariablePerElement() {
        Universe universe = new Universe("u");
        Flip flip = new Flip("flip", universe, 0.4);
        VariableContext context = new VariableContext();

        Variable<Boolean> first = context.variable(flip);
        Variable<Boolean> second = context.variable(flip);
        assertSame(first, second);
        assertSame(flip, first.getElement());
        assertEquals(1, context.variableCount());
    }

    @Test
    public void testDomainMatchesEnumeratedValues() {
        Universe universe = new Universe("u");
        Flip flip = new Flip("flip", universe, 0.4);
        VariableContext context = new VariableContext();

        List<Boolean> values = context.values(flip);
        Variable<Boolean> variable = context.variable(flip);
        assertEquals(values, variable.getDomain());
        assertEquals(0, variable.indexOf(Boolean.TRUE));
        assertEquals(1, variable.indexOf(Boolean.FALSE));
        assertEquals(-1, variable.indexOf("neither"));
    }

    @Test
    public void testFreshContextsHaveFreshVariables() {
        Universe universe = new Universe("u");
        Flip flip = new Flip("flip", universe, 0.4);
        assertNotSame(new VariableContext().variable(flip), new VariableContext().variable(flip));
    }

    @Test
    public void testMissingCapabilityIsReported() {
        Universe universe = new Universe("u");
        Poisson poisson = new Poisson("poisson", universe, 2.0);
        VariableContext context = new VariableContext();

        UnsupportedCapabilityException e = assertThrows(UnsupportedCapabilityException.class,
                () -> context.values(poisson));
        assertSame(poisson, e.getElement());
        assertEquals(Capability.ENUMERATION, e.getCapability());

        e = assertThrows(UnsupportedCapabilityException.class, () -> context.factors(poisson));
        assertEquals(Capability.FACTORS, e.getCapability());
    }

    @Test
    public void testSelfReferentialChainIsCyclic() {
        Universe universe = new Universe("u");
        Flip parent = new Flip("parent", universe, 0.5);
        List<Chain<Boolean, Boolean>> holder = new ArrayList<>();
        Chain<Boolean, Boolean> loop = new CachingChain<>("loop", universe, parent, b -> holder.get(0));
        holder.add(loop);

        assertThrows(CyclicDependencyException.class, () -> new VariableContext().values(loop));
    }

    @Test
    public void testConcurrentContextSharesVariables() throws Exception {
        Universe universe = new Universe("u");
        Flip flip = new Flip("flip", universe, 0.4);
        VariableContext context = VariableContext.concurrent();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Variable<Boolean>>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> context.variable(flip));
            }
            List<Future<Variable<Boolean>>> results = pool.invokeAll(tasks);
            Variable<Boolean> expected = context.variable(flip);
            for (Future<Variable<Boolean>> f : results) {
                assertSame(expected, f.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void testMemoIsComputedOncePerOwner() {
        Universe universe = new Universe("u");
        Element<Boolean, ?> owner = new Flip("owner", universe, 0.5);
        VariableContext context = new VariableContext();
        Object first = context.memo(owner, Object::new);
        assertSame(first, context.memo(owner, Object::new));
    }
}
