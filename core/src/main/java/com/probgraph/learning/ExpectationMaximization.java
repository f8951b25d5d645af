package com.probgraph.learning;

import com.probgraph.config.EngineConfig;
import com.probgraph.factor.VariableContext;
import com.probgraph.inference.Distribution;
import com.probgraph.inference.InferenceEngine;
import com.probgraph.inference.InferenceEngineFactory;
import com.probgraph.inference.InferenceResult;
import com.probgraph.model.Apply2;
import com.probgraph.model.Chain;
import com.probgraph.model.DimensionMismatchException;
import com.probgraph.model.Element;
import com.probgraph.model.Universe;
import com.probgraph.model.capability.Parameter;
import com.probgraph.model.capability.Parameterized;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Learns the hyperparameters of a set of parameters by expectation
 * maximization.
 *
 * <p>
 * Each iteration runs one inference over every permanent element that reads a
 * target parameter, sums the posterior of each such element into its
 * parameter's statistics, and computes the next hyperparameters from the
 * prior. New values are installed together once all have been computed, so
 * every parameter in an iteration sees the same frozen state.
 *
 * <p>
 * A chain subordinate that reads a target parameter counts only where it is
 * selected: its statistics are taken from the chain's posterior given the
 * parent value that selects it, scaled by that parent value's posterior
 * probability. Both come from the joint of (parent, chain), queried through a
 * temporary element that is dropped after the run.
 */
public class ExpectationMaximization {

    private static final Logger logger = LoggerFactory.getLogger(ExpectationMaximization.class);

    public static final int DEFAULT_ITERATIONS = 10;

    private final Universe universe;
    private final InferenceEngine engine;
    private final int iterations;
    private final List<Parameter<?>> targets;

    private final List<Map<Parameter<?>, Hyperparameters>> history = new ArrayList<>();
    private volatile boolean stopRequested = false;

    public ExpectationMaximization(Universe universe, InferenceEngine engine, int iterations,
            List<? extends Parameter<?>> targets) {
        if (universe == null || engine == null) {
            throw new IllegalArgumentException("EM needs a universe and an inference engine");
        }
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive, got " + iterations);
        }
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("EM needs at least one target parameter");
        }
        this.universe = universe;
        this.engine = engine;
        this.iterations = iterations;
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    public ExpectationMaximization(Universe universe, InferenceEngine engine, Parameter<?>... targets) {
        this(universe, engine, DEFAULT_ITERATIONS, Arrays.asList(targets));
    }

    /**
     * Engine and iteration count taken from the configuration.
     */
    public static ExpectationMaximization fromConfig(Universe universe, EngineConfig.ConfigRoot config,
            List<? extends Parameter<?>> targets) {
        int iterations = DEFAULT_ITERATIONS;
        if (config != null && config.learning != null && config.learning.iterations != null) {
            iterations = config.learning.iterations;
        }
        return new ExpectationMaximization(universe, InferenceEngineFactory.create(config), iterations, targets);
    }

    public void run() {
        logger.info("Starting EM over {} parameters with {} for {} iterations", targets.size(), engine.name(),
                iterations);
        for (int i = 1; i <= iterations; i++) {
            if (stopRequested) {
                logger.info("EM stopped before iteration {}", i);
                break;
            }
            Map<Parameter<?>, double[]> statistics = expectation();
            maximize(statistics);
            logger.debug("EM iteration {}: {}", i, history.get(history.size() - 1).values());
        }
        logger.info("EM finished after {} iterations", history.size());
    }

    /**
     * Asks the driver to stop at the next iteration boundary.
     */
    public void requestStop() {
        stopRequested = true;
    }

    /**
     * Learned hyperparameters after each completed iteration.
     */
    public List<Map<Parameter<?>, Hyperparameters>> history() {
        return Collections.unmodifiableList(history);
    }

    public int completedIterations() {
        return history.size();
    }

    public List<Parameter<?>> getTargets() {
        return targets;
    }

    private Map<Parameter<?>, double[]> expectation() {
        Map<Parameter<?>, double[]> statistics = new IdentityHashMap<>();
        for (Parameter<?> p : targets) {
            statistics.put(p, p.zeroSufficientStatistics());
        }

        List<Element<?, ?>> dependents = new ArrayList<>();
        List<Selection<?, ?>> selections = new ArrayList<>();
        for (Element<?, ?> e : universe.activeElements()) {
            if (e.asParameterized().isPresent() && statistics.containsKey(e.asParameterized().get().parameter())) {
                dependents.add(e);
            } else if (e instanceof Chain) {
                Selection<?, ?> selection = Selection.of((Chain<?, ?>) e, statistics.keySet());
                if (selection != null) {
                    selections.add(selection);
                }
            }
        }
        if (dependents.isEmpty() && selections.isEmpty()) {
            logger.warn("No element depends on the EM targets; hyperparameters will stay at the prior");
            return statistics;
        }

        List<Element<?, ?>> queries = new ArrayList<>(dependents);
        for (Selection<?, ?> selection : selections) {
            queries.add(selection.pair);
        }
        try {
            InferenceResult result = engine.infer(universe, queries);
            for (Element<?, ?> e : dependents) {
                accumulate(e, result, statistics);
            }
            for (Selection<?, ?> selection : selections) {
                selection.accumulate(result, statistics);
            }
        } finally {
            for (Selection<?, ?> selection : selections) {
                selection.release();
            }
        }
        return statistics;
    }

    private static <T> void accumulate(Element<T, ?> element, InferenceResult result,
            Map<Parameter<?>, double[]> statistics) {
        Parameterized<T> parameterized = element.asParameterized().get();
        double[] contribution = parameterized.distributionToStatistics(result.distribution(element));
        add(statistics.get(parameterized.parameter()), contribution, 1.0, element.getName());
    }

    private static void add(double[] total, double[] contribution, double weight, String source) {
        if (contribution.length != total.length) {
            throw new DimensionMismatchException("statistics from " + source, total.length, contribution.length);
        }
        for (int i = 0; i < total.length; i++) {
            total[i] += weight * contribution[i];
        }
    }

    /**
     * The parent values of one chain whose subordinates read a target
     * parameter, with the (parent, chain) element queried for them.
     */
    private static final class Selection<P, T> {
        private final Chain<P, T> chain;
        private final Map<P, Parameterized<T>> readers;
        private final Apply2<P, T, Map.Entry<P, T>> pair;

        private Selection(Chain<P, T> chain, Map<P, Parameterized<T>> readers, Apply2<P, T, Map.Entry<P, T>> pair) {
            this.chain = chain;
            this.readers = readers;
            this.pair = pair;
        }

        static <P, T> Selection<P, T> of(Chain<P, T> chain, Set<Parameter<?>> parameters) {
            if (!chain.getParent().enumerable().isPresent()) {
                logger.debug("Chain {} has a parent without enumeration; its subordinates are not learned from",
                        chain.getName());
                return null;
            }
            Map<P, Parameterized<T>> readers = new LinkedHashMap<>();
            for (Map.Entry<P, Element<T, ?>> e : chain.expansion(new VariableContext()).entrySet()) {
                Optional<Parameterized<T>> parameterized = e.getValue().asParameterized();
                if (parameterized.isPresent() && parameters.contains(parameterized.get().parameter())) {
                    readers.put(e.getKey(), parameterized.get());
                }
            }
            if (readers.isEmpty()) {
                return null;
            }
            Universe owner = chain.getUniverse();
            Apply2<P, T, Map.Entry<P, T>> pair = owner.withinContext(chain,
                    () -> new Apply2<P, T, Map.Entry<P, T>>(null, owner, chain.getParent(), chain,
                            (p, t) -> new AbstractMap.SimpleImmutableEntry<>(p, t)));
            return new Selection<>(chain, readers, pair);
        }

        void accumulate(InferenceResult result, Map<Parameter<?>, double[]> statistics) {
            Distribution<Map.Entry<P, T>> joint = result.distribution(pair);
            for (Map.Entry<P, Parameterized<T>> reader : readers.entrySet()) {
                Map<T, Double> weights = new LinkedHashMap<>();
                double mass = 0.0;
                for (Distribution.Outcome<Map.Entry<P, T>> o : joint.getOutcomes()) {
                    if (Objects.equals(o.getValue().getKey(), reader.getKey())) {
                        weights.merge(o.getValue().getValue(), o.getProbability(), Double::sum);
                        mass += o.getProbability();
                    }
                }
                if (mass <= 0.0) {
                    continue;
                }
                Parameterized<T> parameterized = reader.getValue();
                double[] contribution = parameterized.distributionToStatistics(Distribution.fromWeights(weights));
                add(statistics.get(parameterized.parameter()), contribution, mass,
                        chain.getName() + "[" + reader.getKey() + "]");
            }
        }

        void release() {
            chain.getUniverse().deactivate(pair);
        }
    }

    private void maximize(Map<Parameter<?>, double[]> statistics) {
        Map<Parameter<?>, Hyperparameters> next = new LinkedHashMap<>();
        for (Parameter<?> p : targets) {
            next.put(p, p.withUpdatedStatistics(statistics.get(p)));
        }
        for (Map.Entry<Parameter<?>, Hyperparameters> e : next.entrySet()) {
            e.getKey().install(e.getValue());
        }
        history.add(Collections.unmodifiableMap(next));
    }
}
