package com.probgraph.inference;

import com.probgraph.model.CyclicDependencyException;
import com.probgraph.model.Element;
import com.probgraph.model.Universe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brings every element reachable from the model roots to a consistent state,
 * visiting arguments before dependents. Chains are visited after their parent
 * so that the selected subordinate is current.
 *
 * <p>
 * Observed stochastic elements take their observation as value. Other
 * stochastic elements are redrawn when {@code resample} is set, and otherwise
 * only drawn if they have never been generated. Deterministic elements are
 * always recomputed.
 */
public class ForwardSampler {

    private ForwardSampler() {
    }

    /**
     * @return the elements visited, in dependency order
     */
    public static List<Element<?, ?>> sample(Universe universe, List<? extends Element<?, ?>> targets,
            boolean resample) {
        Map<Element<?, ?>, Boolean> state = new IdentityHashMap<>();
        List<Element<?, ?>> visited = new ArrayList<>();
        for (Element<?, ?> root : ModelTraversal.roots(universe, targets)) {
            visit(root, resample, state, visited);
        }
        return Collections.unmodifiableList(visited);
    }

    /**
     * Product of the evidence weights of {@code elements}.
     */
    public static double evidence(List<Element<?, ?>> elements) {
        double score = 1.0;
        for (Element<?, ?> e : elements) {
            if (e.isObserved()) {
                score *= e.evidenceWeight();
            }
        }
        return score;
    }

    private static void visit(Element<?, ?> element, boolean resample, Map<Element<?, ?>, Boolean> state,
            List<Element<?, ?>> visited) {
        Boolean s = state.get(element);
        if (Boolean.TRUE.equals(s)) {
            return;
        }
        if (Boolean.FALSE.equals(s)) {
            throw new CyclicDependencyException(element);
        }
        state.put(element, Boolean.FALSE);
        for (Element<?, ?> arg : element.args()) {
            ModelTraversal.checkScope(element, arg);
            visit(arg, resample, state, visited);
        }
        Set<Element<?, ?>> dynamic = new LinkedHashSet<>(element.dynamicArgs());
        for (Element<?, ?> arg : dynamic) {
            ModelTraversal.checkScope(element, arg);
            visit(arg, resample, state, visited);
        }
        update(element, resample);
        state.put(element, Boolean.TRUE);
        visited.add(element);
    }

    private static void update(Element<?, ?> element, boolean resample) {
        if (!element.isStochastic()) {
            element.regenerateValue();
        } else if (element.isObserved()) {
            element.assignObservation();
        } else if (resample || !element.isGenerated()) {
            element.generate();
        }
    }
}
