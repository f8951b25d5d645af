package com.probgraph.factor;

import com.probgraph.model.Capability;
import com.probgraph.model.CyclicDependencyException;
import com.probgraph.model.Element;
import com.probgraph.model.UnsupportedCapabilityException;
import com.probgraph.model.capability.Enumerable;
import com.probgraph.model.capability.FactorMaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Memo table for one factor-based inference run: element to variable, element
 * to enumerated values, and chain to expansion.
 *
 * <p>
 * Two factors built from the same element in the same context always share
 * one {@link Variable}, so they agree on index semantics. A plain context is
 * meant for a single thread; {@link #concurrent()} returns one that several
 * threads may share and that still hands out a single variable per element.
 */
public class VariableContext {

    private static final Logger logger = LoggerFactory.getLogger(VariableContext.class);

    private final Map<Element<?, ?>, Variable<?>> variables;
    private final Map<Element<?, ?>, List<?>> values;
    private final Map<Element<?, ?>, Object> expansions;
    private final ThreadLocal<Set<Element<?, ?>>> inProgress = ThreadLocal.withInitial(HashSet::new);
    private final AtomicInteger nextVariableId = new AtomicInteger();

    public VariableContext() {
        this(new HashMap<>(), new HashMap<>(), new HashMap<>());
    }

    private VariableContext(Map<Element<?, ?>, Variable<?>> variables, Map<Element<?, ?>, List<?>> values,
            Map<Element<?, ?>, Object> expansions) {
        this.variables = variables;
        this.values = values;
        this.expansions = expansions;
    }

    public static VariableContext concurrent() {
        return new VariableContext(new ConcurrentHashMap<>(), new ConcurrentHashMap<>(), new ConcurrentHashMap<>());
    }

    /**
     * Enumerated support of {@code element}, computed on first request.
     *
     * @throws UnsupportedCapabilityException if the element cannot enumerate
     * @throws CyclicDependencyException      if enumeration comes back to an
     *                                        element still being enumerated
     */
    @SuppressWarnings("unchecked")
    public <T> List<T> values(Element<T, ?> element) {
        // Values are computed outside the map: enumeration recurses into
        // arguments, which a computeIfAbsent would not allow.
        List<?> cached = values.get(element);
        if (cached != null) {
            return (List<T>) cached;
        }
        Enumerable<T> enumerable = element.enumerable()
                .orElseThrow(() -> new UnsupportedCapabilityException(element, Capability.ENUMERATION));

        Set<Element<?, ?>> active = inProgress.get();
        if (!active.add(element)) {
            throw new CyclicDependencyException(element);
        }
        List<T> computed;
        try {
            computed = Collections.unmodifiableList(new ArrayList<>(enumerable.makeValues(this)));
        } finally {
            active.remove(element);
        }
        List<?> previous = values.putIfAbsent(element, computed);
        if (logger.isTraceEnabled()) {
            logger.trace("Enumerated {} values for {}", computed.size(), element.getName());
        }
        return previous != null ? (List<T>) previous : computed;
    }

    @SuppressWarnings("unchecked")
    public <T> Variable<T> variable(Element<T, ?> element) {
        Variable<?> cached = variables.get(element);
        if (cached != null) {
            return (Variable<T>) cached;
        }
        List<T> domain = values(element);
        Variable<T> created = new Variable<>(nextVariableId.getAndIncrement(), element, domain);
        Variable<?> previous = variables.putIfAbsent(element, created);
        return previous != null ? (Variable<T>) previous : created;
    }

    /**
     * Fresh factors for {@code element}. Factors are transient and not cached.
     */
    public List<Factor> factors(Element<?, ?> element) {
        FactorMaker maker = element.factorMaker()
                .orElseThrow(() -> new UnsupportedCapabilityException(element, Capability.FACTORS));
        return maker.makeFactors(this);
    }

    /**
     * Per-run memo owned by {@code owner}, used by chains to fix the
     * subordinate chosen for each parent value for the whole run.
     */
    @SuppressWarnings("unchecked")
    public <X> X memo(Element<?, ?> owner, Supplier<X> compute) {
        Object cached = expansions.get(owner);
        if (cached != null) {
            return (X) cached;
        }
        X computed = compute.get();
        Object previous = expansions.putIfAbsent(owner, computed);
        return previous != null ? (X) previous : computed;
    }

    public int variableCount() {
        return variables.size();
    }
}
