package com.probgraph.inference;

import com.probgraph.model.Element;
import com.probgraph.model.Proposal;
import com.probgraph.model.Universe;
import com.probgraph.util.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-site Metropolis-Hastings over element randomness.
 *
 * <p>
 * Each step picks one unobserved stochastic element uniformly, asks it for a
 * proposal through {@link Element#nextRandomness}, propagates the change
 * forward and accepts with probability
 * {@code min(1, transitionRatio * modelRatio * newEvidence / oldEvidence)}. A
 * rejected step restores every visited element, chains included.
 */
public class MetropolisHastings implements InferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(MetropolisHastings.class);

    public static final int DEFAULT_SAMPLES = 10000;
    public static final int DEFAULT_BURN_IN = 1000;
    public static final int DEFAULT_INTERVAL = 1;

    static final int MAX_INITIALIZATION_ATTEMPTS = 1000;

    private final int samples;
    private final int burnIn;
    private final int interval;

    public MetropolisHastings() {
        this(DEFAULT_SAMPLES, DEFAULT_BURN_IN, DEFAULT_INTERVAL);
    }

    public MetropolisHastings(int samples, int burnIn, int interval) {
        if (samples < 1) {
            throw new IllegalArgumentException("samples must be positive, got " + samples);
        }
        if (burnIn < 0) {
            throw new IllegalArgumentException("burnIn must not be negative, got " + burnIn);
        }
        if (interval < 1) {
            throw new IllegalArgumentException("interval must be positive, got " + interval);
        }
        this.samples = samples;
        this.burnIn = burnIn;
        this.interval = interval;
    }

    @Override
    public String name() {
        return "metropolis_hastings";
    }

    @Override
    public InferenceResult infer(Universe universe, List<? extends Element<?, ?>> targets) {
        List<Element<?, ?>> visited = initialize(universe, targets);
        double score = ForwardSampler.evidence(visited);

        List<Map<Object, Double>> counts = new ArrayList<>(targets.size());
        for (int i = 0; i < targets.size(); i++) {
            counts.add(new LinkedHashMap<>());
        }

        int accepted = 0;
        int proposed = 0;
        int recorded = 0;
        for (int step = 0; recorded < samples; step++) {
            List<Element<?, ?>> candidates = candidates(visited);
            if (!candidates.isEmpty()) {
                Element<?, ?> chosen = candidates.get(RandomSource.nextInt(candidates.size()));
                Map<Element<?, ?>, Element.ElementState> saved = new IdentityHashMap<>();
                for (Element<?, ?> e : visited) {
                    saved.put(e, e.snapshot());
                }
                double ratio = propose(chosen);
                List<Element<?, ?>> next = ForwardSampler.sample(universe, targets, false);
                double nextScore = ForwardSampler.evidence(next);
                proposed++;

                // score stays positive: initialization guarantees it and zero-weight
                // states are never accepted.
                double acceptance = Math.min(1.0, ratio * nextScore / score);
                if (RandomSource.nextDouble() < acceptance) {
                    visited = next;
                    score = nextScore;
                    accepted++;
                } else {
                    for (Map.Entry<Element<?, ?>, Element.ElementState> e : saved.entrySet()) {
                        e.getKey().restore(e.getValue());
                    }
                }
            }
            if (step >= burnIn && (step - burnIn) % interval == 0) {
                for (int i = 0; i < targets.size(); i++) {
                    counts.get(i).merge(targets.get(i).value(), 1.0, Double::sum);
                }
                recorded++;
            }
        }
        if (proposed > 0) {
            logger.info("Metropolis-Hastings recorded {} samples, acceptance rate {}", recorded,
                    String.format("%.3f", (double) accepted / proposed));
        } else {
            logger.warn("Metropolis-Hastings found no unobserved stochastic element to propose; "
                    + "all {} samples repeat the initial state", recorded);
        }

        Map<Element<?, ?>, Distribution<?>> results = new IdentityHashMap<>();
        for (int i = 0; i < targets.size(); i++) {
            results.put(targets.get(i), Distribution.fromWeights(counts.get(i)));
        }
        return new InferenceResult(name(), recorded, results);
    }

    /**
     * Forward samples until the evidence has positive weight.
     */
    private List<Element<?, ?>> initialize(Universe universe, List<? extends Element<?, ?>> targets) {
        for (int attempt = 1; attempt <= MAX_INITIALIZATION_ATTEMPTS; attempt++) {
            List<Element<?, ?>> visited = ForwardSampler.sample(universe, targets, true);
            if (ForwardSampler.evidence(visited) > 0) {
                logger.debug("Initial state found after {} forward samples", attempt);
                return visited;
            }
        }
        throw new IllegalStateException("No state consistent with the evidence after "
                + MAX_INITIALIZATION_ATTEMPTS + " forward samples");
    }

    private static List<Element<?, ?>> candidates(List<Element<?, ?>> visited) {
        List<Element<?, ?>> candidates = new ArrayList<>();
        for (Element<?, ?> e : visited) {
            if (e.isStochastic() && !e.isObserved()) {
                candidates.add(e);
            }
        }
        return candidates;
    }

    /**
     * Installs a proposed randomness on {@code element}.
     *
     * @return the product of the proposal's transition and model ratios
     */
    private static <T, R> double propose(Element<T, R> element) {
        Proposal<R> proposal = element.nextRandomness(element.randomness());
        element.setRandomness(proposal.getRandomness());
        if (logger.isTraceEnabled()) {
            logger.trace("Proposed {} for {}", proposal, element.getName());
        }
        return proposal.getTransitionRatio() * proposal.getModelRatio();
    }
}
