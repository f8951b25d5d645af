package com.probgraph.model;

import com.probgraph.factor.Factor;
import com.probgraph.factor.Variable;
import com.probgraph.factor.VariableContext;
import com.probgraph.model.capability.Enumerable;
import com.probgraph.model.capability.FactorMaker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Deterministic combination of parent elements through a pure function. The
 * value is recomputed from the parents' current values on every call, with no
 * caching at this layer.
 */
public abstract class Apply<T> extends Deterministic<T> implements Enumerable<T>, FactorMaker {

    private final List<Element<?, ?>> parents;

    protected Apply(String name, Universe universe, List<Element<?, ?>> parents) {
        super(name, universe);
        if (parents == null || parents.isEmpty()) {
            throw new IllegalArgumentException("Apply needs at least one parent");
        }
        this.parents = Collections.unmodifiableList(new ArrayList<>(parents));
    }

    /**
     * The function applied to parent values, in parent order.
     */
    protected abstract T compute(List<Object> parentValues);

    @Override
    public List<Element<?, ?>> args() {
        return parents;
    }

    @Override
    public T generateValue(Void randomness) {
        List<Object> current = new ArrayList<>(parents.size());
        for (Element<?, ?> p : parents) {
            if (!p.isGenerated()) {
                throw new IllegalStateException(
                        "Parent " + p.getName() + " of " + getName() + " has no value yet");
            }
            current.add(p.value());
        }
        return compute(current);
    }

    @Override
    public Optional<Enumerable<T>> enumerable() {
        return Optional.of(this);
    }

    @Override
    public Optional<FactorMaker> factorMaker() {
        return Optional.of(this);
    }

    @Override
    public List<T> makeValues(VariableContext context) {
        List<Element<?, ?>> distinct = distinctParents();
        int[] slots = slots(distinct);
        List<List<?>> domains = new ArrayList<>(distinct.size());
        for (Element<?, ?> p : distinct) {
            domains.add(context.values(p));
        }
        Set<T> results = new LinkedHashSet<>();
        int[] dims = dims(domains);
        if (isEmpty(dims)) {
            return new ArrayList<>(results);
        }
        int[] assignment = new int[dims.length];
        do {
            results.add(compute(select(domains, slots, assignment)));
        } while (Factor.nextAssignment(assignment, dims));
        return new ArrayList<>(results);
    }

    /**
     * A single 0/1 factor over each distinct parent variable followed by this
     * element's variable. A parent listed more than once contributes one
     * dimension, read at every position it occupies.
     */
    @Override
    public List<Factor> makeFactors(VariableContext context) {
        List<Element<?, ?>> distinct = distinctParents();
        int[] slots = slots(distinct);
        List<Variable<?>> variables = new ArrayList<>();
        List<List<?>> domains = new ArrayList<>();
        for (Element<?, ?> p : distinct) {
            Variable<?> v = context.variable(p);
            variables.add(v);
            domains.add(v.getDomain());
        }
        Variable<T> self = context.variable(this);
        variables.add(self);

        Factor.Builder builder = Factor.builder(variables);
        int[] parentDims = dims(domains);
        if (isEmpty(parentDims)) {
            return Collections.singletonList(builder.build());
        }
        int[] assignment = new int[parentDims.length];
        int[] cell = new int[variables.size()];
        do {
            T result = compute(select(domains, slots, assignment));
            int resultIndex = self.indexOf(result);
            System.arraycopy(assignment, 0, cell, 0, assignment.length);
            for (int i = 0; i < self.size(); i++) {
                cell[cell.length - 1] = i;
                builder.set(i == resultIndex ? 1.0 : 0.0, cell);
            }
        } while (Factor.nextAssignment(assignment, parentDims));
        return Collections.singletonList(builder.build());
    }

    private List<Element<?, ?>> distinctParents() {
        List<Element<?, ?>> distinct = new ArrayList<>(parents.size());
        for (Element<?, ?> p : parents) {
            if (!distinct.contains(p)) {
                distinct.add(p);
            }
        }
        return distinct;
    }

    // Position of each parent in the distinct list.
    private int[] slots(List<Element<?, ?>> distinct) {
        int[] slots = new int[parents.size()];
        for (int i = 0; i < slots.length; i++) {
            slots[i] = distinct.indexOf(parents.get(i));
        }
        return slots;
    }

    private static int[] dims(List<List<?>> domains) {
        int[] dims = new int[domains.size()];
        for (int i = 0; i < dims.length; i++) {
            dims[i] = domains.get(i).size();
        }
        return dims;
    }

    private static boolean isEmpty(int[] dims) {
        for (int d : dims) {
            if (d == 0) {
                return true;
            }
        }
        return false;
    }

    private static List<Object> select(List<List<?>> domains, int[] slots, int[] assignment) {
        List<Object> values = new ArrayList<>(slots.length);
        for (int slot : slots) {
            values.add(domains.get(slot).get(assignment[slot]));
        }
        return values;
    }
}
