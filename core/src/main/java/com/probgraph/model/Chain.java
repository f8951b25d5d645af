package com.probgraph.model;

import com.probgraph.factor.Factor;
import com.probgraph.factor.Variable;
import com.probgraph.factor.VariableContext;
import com.probgraph.model.capability.Enumerable;
import com.probgraph.model.capability.FactorMaker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Dependent branch: the parent's current value selects a subordinate element
 * and the chain takes the subordinate's value. Subclasses decide when a
 * subordinate is built and when one is reused.
 *
 * @param <P> parent value type
 * @param <T> value type of the chain and its subordinates
 */
public abstract class Chain<P, T> extends Deterministic<T> implements Enumerable<T>, FactorMaker {

    private final Element<P, ?> parent;
    private final Function<? super P, ? extends Element<T, ?>> fn;

    protected Chain(String name, Universe universe, Element<P, ?> parent,
            Function<? super P, ? extends Element<T, ?>> fn) {
        super(name, universe);
        if (parent == null || fn == null) {
            throw new IllegalArgumentException("Chain needs a parent and a subordinate function");
        }
        this.parent = parent;
        this.fn = fn;
    }

    public Element<P, ?> getParent() {
        return parent;
    }

    /**
     * The subordinate for {@code parentValue} under this chain's policy.
     */
    public abstract Element<T, ?> get(P parentValue);

    /**
     * Builds a fresh subordinate. Elements created by the function are owned
     * by this chain.
     */
    protected Element<T, ?> construct(P parentValue) {
        Element<T, ?> result = getUniverse().withinContext(this, () -> fn.apply(parentValue));
        if (result == null) {
            throw new IllegalStateException("Chain " + getName() + " produced no element for " + parentValue);
        }
        return result;
    }

    @Override
    public List<Element<?, ?>> args() {
        return Collections.singletonList(parent);
    }

    @Override
    public List<Element<?, ?>> dynamicArgs() {
        if (!parent.isGenerated()) {
            return Collections.emptyList();
        }
        return Collections.singletonList(get(parent.value()));
    }

    @Override
    public T generateValue(Void randomness) {
        if (!parent.isGenerated()) {
            throw new IllegalStateException("Parent " + parent.getName() + " of " + getName() + " has no value yet");
        }
        Element<T, ?> subordinate = get(parent.value());
        if (!subordinate.isGenerated()) {
            throw new IllegalStateException(
                    "Subordinate " + subordinate.getName() + " of " + getName() + " has not been generated");
        }
        return subordinate.value();
    }

    /**
     * Subordinate for every enumerated parent value, fixed for the run.
     */
    public Map<P, Element<T, ?>> expansion(VariableContext context) {
        return context.memo(this, () -> {
            Map<P, Element<T, ?>> expanded = new LinkedHashMap<>();
            for (P p : context.values(parent)) {
                expanded.put(p, get(p));
            }
            return expanded;
        });
    }

    @Override
    public List<Element<?, ?>> expandedArgs(VariableContext context) {
        Set<Element<?, ?>> all = new LinkedHashSet<>();
        all.add(parent);
        all.addAll(expansion(context).values());
        return new ArrayList<>(all);
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
        Set<T> values = new LinkedHashSet<>();
        for (Element<T, ?> subordinate : expansion(context).values()) {
            values.addAll(context.values(subordinate));
        }
        return new ArrayList<>(values);
    }

    /**
     * One selector factor per parent value p over (parent, chain,
     * subordinate(p)): weight 1 where the parent is not p, otherwise 1 exactly
     * when the chain equals the subordinate. A subordinate that is the parent
     * itself gives a factor over (parent, chain) instead.
     */
    @Override
    public List<Factor> makeFactors(VariableContext context) {
        Variable<P> parentVar = context.variable(parent);
        Variable<T> self = context.variable(this);
        List<Factor> factors = new ArrayList<>();

        for (Map.Entry<P, Element<T, ?>> entry : expansion(context).entrySet()) {
            int selected = parentVar.indexOf(entry.getKey());
            Variable<T> sub = context.variable(entry.getValue());
            if (sub.equals(parentVar)) {
                factors.add(selfSelector(parentVar, self, selected));
                continue;
            }
            Factor.Builder builder = Factor.builder(parentVar, self, sub);
            for (int p = 0; p < parentVar.size(); p++) {
                for (int c = 0; c < self.size(); c++) {
                    for (int s = 0; s < sub.size(); s++) {
                        double w = p != selected || Objects.equals(self.valueAt(c), sub.valueAt(s)) ? 1.0 : 0.0;
                        builder.set(w, p, c, s);
                    }
                }
            }
            factors.add(builder.build());
        }
        return factors;
    }

    private static Factor selfSelector(Variable<?> parentVar, Variable<?> self, int selected) {
        Factor.Builder builder = Factor.builder(parentVar, self);
        for (int p = 0; p < parentVar.size(); p++) {
            for (int c = 0; c < self.size(); c++) {
                double w = p != selected || Objects.equals(self.valueAt(c), parentVar.valueAt(p)) ? 1.0 : 0.0;
                builder.set(w, p, c);
            }
        }
        return builder.build();
    }
}
