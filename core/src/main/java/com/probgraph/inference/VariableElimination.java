package com.probgraph.inference;

import com.probgraph.factor.Factor;
import com.probgraph.factor.Variable;
import com.probgraph.factor.VariableContext;
import com.probgraph.model.Element;
import com.probgraph.model.Universe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exact marginals by summing out every non-target variable, choosing at each
 * step the variable whose elimination creates the smallest factor scope.
 */
public class VariableElimination implements InferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(VariableElimination.class);

    @Override
    public String name() {
        return "variable_elimination";
    }

    @Override
    public InferenceResult infer(Universe universe, List<? extends Element<?, ?>> targets) {
        FactorModel model = FactorModel.build(universe, targets, new VariableContext());
        logger.info("Variable elimination over {} factors for {} targets", model.getFactors().size(),
                targets.size());

        Map<Element<?, ?>, Distribution<?>> results = new IdentityHashMap<>();
        for (Element<?, ?> target : targets) {
            results.put(target, marginal(model, target));
        }
        return new InferenceResult(name(), 1, results);
    }

    private <T> Distribution<T> marginal(FactorModel model, Element<T, ?> target) {
        Variable<T> query = model.getContext().variable(target);
        List<Factor> working = new ArrayList<>(model.getFactors());

        Set<Variable<?>> toEliminate = new LinkedHashSet<>(model.getVariables());
        toEliminate.remove(query);

        while (!toEliminate.isEmpty()) {
            Variable<?> next = cheapest(toEliminate, working);
            toEliminate.remove(next);

            List<Factor> touching = new ArrayList<>();
            List<Factor> rest = new ArrayList<>();
            for (Factor f : working) {
                (f.contains(next) ? touching : rest).add(f);
            }
            if (touching.isEmpty()) {
                continue;
            }
            Factor combined = touching.get(0);
            for (int i = 1; i < touching.size(); i++) {
                combined = combined.product(touching.get(i));
            }
            rest.add(combined.sumOut(next));
            working = rest;
            if (logger.isTraceEnabled()) {
                logger.trace("Eliminated {}: {} factors remain", next, working.size());
            }
        }

        Factor joint = working.get(0);
        for (int i = 1; i < working.size(); i++) {
            joint = joint.product(working.get(i));
        }

        Map<T, Double> weights = new LinkedHashMap<>();
        int pos = joint.positionOf(query);
        for (int i = 0; i < query.size(); i++) {
            weights.put(query.valueAt(i), pos >= 0 ? joint.get(i) : joint.get() / query.size());
        }
        Distribution<T> distribution = Distribution.fromWeights(weights);
        logger.debug("Marginal of {}: {}", target.getName(), distribution);
        return distribution;
    }

    /**
     * Variable whose elimination produces the fewest distinct neighbours.
     */
    private static Variable<?> cheapest(Set<Variable<?>> candidates, List<Factor> factors) {
        Variable<?> best = null;
        int bestScope = Integer.MAX_VALUE;
        for (Variable<?> v : candidates) {
            Set<Variable<?>> scope = new LinkedHashSet<>();
            for (Factor f : factors) {
                if (f.contains(v)) {
                    scope.addAll(f.getVariables());
                }
            }
            if (scope.size() < bestScope) {
                best = v;
                bestScope = scope.size();
            }
        }
        return best;
    }
}
