package com.probgraph.model;

import com.probgraph.factor.VariableContext;
import com.probgraph.model.capability.Enumerable;
import com.probgraph.model.capability.FactorMaker;
import com.probgraph.model.capability.Parameter;
import com.probgraph.model.capability.Parameterized;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A random variable in a {@link Universe}.
 *
 * <p>
 * Every element defines how a randomness value is drawn, how that randomness
 * maps to a value, and the density of a value. Optional capabilities
 * (enumeration, factor construction, parameter learning) are exposed through
 * the typed lookups {@link #enumerable()}, {@link #factorMaker()},
 * {@link #asParameter()} and {@link #asParameterized()}; subclasses that
 * provide a capability override the lookup. Inference engines only ever ask
 * through these lookups.
 *
 * <p>
 * Identity is fixed at construction: the id and name never change and are
 * never handed to another element of the same universe. Equality is identity.
 *
 * @param <T> value type
 * @param <R> randomness type, {@link Void} for deterministic elements
 */
public abstract class Element<T, R> {

    private final Universe universe;
    private final long id;
    private final String name;
    private final Element<?, ?> owner;

    private R randomness;
    private T value;
    private boolean generated;

    private boolean observed;
    private T observation;

    // Registration only records identity; args() is never consulted here
    // because subclass fields are not yet assigned.
    protected Element(String name, Universe universe) {
        if (universe == null) {
            throw new IllegalArgumentException("universe cannot be null");
        }
        this.universe = universe;
        this.id = universe.nextId();
        this.name = (name != null && !name.isEmpty()) ? name : getClass().getSimpleName() + "#" + id;
        this.owner = universe.currentOwner();
        universe.register(this);
    }

    public String getName() {
        return name;
    }

    public long getId() {
        return id;
    }

    public Universe getUniverse() {
        return universe;
    }

    /**
     * The chain whose subordinate construction created this element, if any.
     */
    public Optional<Element<?, ?>> getOwner() {
        return Optional.ofNullable(owner);
    }

    public boolean isTemporary() {
        return owner != null;
    }

    // Structure.

    /**
     * The elements this element's value depends on. Must be side-effect free.
     * Atomic elements return an empty list.
     */
    public abstract List<Element<?, ?>> args();

    /**
     * Dependencies chosen at sampling time from the current values of
     * {@link #args()}. Only chains have any.
     */
    public List<Element<?, ?>> dynamicArgs() {
        return Collections.emptyList();
    }

    /**
     * Every element a factor-based run must cover to build this element's
     * factors: the static arguments plus, for chains, every subordinate
     * reachable over the enumerated parent values.
     */
    public List<Element<?, ?>> expandedArgs(VariableContext context) {
        return args();
    }

    // Generation protocol.

    public abstract R generateRandomness();

    /**
     * Deterministic in the randomness and the current values of the arguments.
     */
    public abstract T generateValue(R randomness);

    /**
     * Probability (mass or density) of {@code value}. Values outside the
     * support have density 0.
     */
    public abstract double density(T value);

    /**
     * True when generateRandomness consumes entropy.
     */
    public abstract boolean isStochastic();

    /**
     * Default proposal kernel: an independent draw from the prior, with unit
     * transition and model ratios. Elements with a custom kernel override this.
     */
    public Proposal<R> nextRandomness(R current) {
        return Proposal.symmetric(generateRandomness());
    }

    public boolean hasCustomProposal() {
        return false;
    }

    // Capability lookups.

    public Optional<Enumerable<T>> enumerable() {
        return Optional.empty();
    }

    public Optional<FactorMaker> factorMaker() {
        return Optional.empty();
    }

    public Optional<Parameter<?>> asParameter() {
        return Optional.empty();
    }

    public Optional<Parameterized<T>> asParameterized() {
        return Optional.empty();
    }

    /**
     * Marker for element types with a small finite support. Chains over such a
     * parent default to caching their subordinates.
     */
    public boolean hasSmallSupport() {
        return false;
    }

    public Set<Capability> capabilities() {
        Set<Capability> caps = EnumSet.noneOf(Capability.class);
        if (enumerable().isPresent()) {
            caps.add(Capability.ENUMERATION);
        }
        if (factorMaker().isPresent()) {
            caps.add(Capability.FACTORS);
        }
        if (asParameter().isPresent()) {
            caps.add(Capability.PARAMETER);
        }
        if (asParameterized().isPresent()) {
            caps.add(Capability.PARAMETERIZED);
        }
        if (hasCustomProposal()) {
            caps.add(Capability.CUSTOM_PROPOSAL);
        }
        if (hasSmallSupport()) {
            caps.add(Capability.SMALL_SUPPORT);
        }
        return caps;
    }

    // Current state.

    /**
     * Draws a fresh randomness and derives the value from it.
     */
    public void generate() {
        setRandomness(generateRandomness());
    }

    /**
     * Replaces the randomness wholesale and recomputes the value.
     */
    public void setRandomness(R randomness) {
        this.randomness = randomness;
        this.value = generateValue(randomness);
        this.generated = true;
    }

    /**
     * Recomputes the value from the current randomness, picking up changed
     * argument values.
     */
    public void regenerateValue() {
        this.value = generateValue(randomness);
        this.generated = true;
    }

    public T value() {
        return value;
    }

    public R randomness() {
        return randomness;
    }

    public boolean isGenerated() {
        return generated;
    }

    public ElementState snapshot() {
        return new ElementState(randomness, value, generated, policyState());
    }

    @SuppressWarnings("unchecked")
    public void restore(ElementState state) {
        this.randomness = (R) state.randomness;
        this.value = (T) state.value;
        this.generated = state.generated;
        restorePolicyState(state.policyState);
    }

    /**
     * Extra per-instance state a sampler must roll back with the value.
     */
    protected Object policyState() {
        return null;
    }

    protected void restorePolicyState(Object state) {
    }

    // Evidence.

    public void observe(T observation) {
        this.observed = true;
        this.observation = observation;
    }

    public void unobserve() {
        this.observed = false;
        this.observation = null;
    }

    public boolean isObserved() {
        return observed;
    }

    public T getObservation() {
        if (!observed) {
            throw new IllegalStateException("Element " + name + " is not observed");
        }
        return observation;
    }

    /**
     * Fixes the current value to the observation. Used by samplers for observed
     * stochastic elements, whose density then weights the sample.
     */
    public void assignObservation() {
        this.value = getObservation();
        this.generated = true;
    }

    /**
     * Weight of the current state under this element's evidence: the density
     * of the observation for stochastic elements, an indicator otherwise.
     */
    public double evidenceWeight() {
        if (!observed) {
            return 1.0;
        }
        if (isStochastic()) {
            return density(observation);
        }
        return Objects.equals(value, observation) ? 1.0 : 0.0;
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Opaque copy of an element's sampling state.
     */
    public static final class ElementState {
        private final Object randomness;
        private final Object value;
        private final boolean generated;
        private final Object policyState;

        private ElementState(Object randomness, Object value, boolean generated, Object policyState) {
            this.randomness = randomness;
            this.value = value;
            this.generated = generated;
            this.policyState = policyState;
        }
    }
}
