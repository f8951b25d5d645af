package com.probgraph.inference;

import com.probgraph.factor.VariableContext;
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
import java.util.function.Function;

/**
 * Orders the elements of a model so that every element follows its
 * dependencies, detecting cycles and references outside an element's scope.
 *
 * <p>
 * Roots are the universe's permanent elements plus any extra targets.
 * Parameters are learning targets rather than model variables, so they are
 * never roots; they are still visited if some element depends on them.
 */
public class ModelTraversal {

    private ModelTraversal() {
    }

    /**
     * Topological order over static arguments and chain expansions, as needed
     * to build every factor of the model.
     */
    public static List<Element<?, ?>> forFactors(Universe universe, List<? extends Element<?, ?>> targets,
            VariableContext context) {
        return order(roots(universe, targets), e -> e.expandedArgs(context));
    }

    static List<Element<?, ?>> roots(Universe universe, List<? extends Element<?, ?>> targets) {
        Set<Element<?, ?>> roots = new LinkedHashSet<>();
        for (Element<?, ?> e : universe.activeElements()) {
            if (!e.asParameter().isPresent()) {
                roots.add(e);
            }
        }
        roots.addAll(targets);
        return new ArrayList<>(roots);
    }

    static List<Element<?, ?>> order(List<Element<?, ?>> roots,
            Function<Element<?, ?>, List<Element<?, ?>>> dependencies) {
        Map<Element<?, ?>, Boolean> state = new IdentityHashMap<>(); // false = in progress, true = done
        List<Element<?, ?>> ordered = new ArrayList<>();
        for (Element<?, ?> root : roots) {
            visit(root, dependencies, state, ordered);
        }
        return Collections.unmodifiableList(ordered);
    }

    private static void visit(Element<?, ?> element, Function<Element<?, ?>, List<Element<?, ?>>> dependencies,
            Map<Element<?, ?>, Boolean> state, List<Element<?, ?>> ordered) {
        Boolean s = state.get(element);
        if (Boolean.TRUE.equals(s)) {
            return;
        }
        if (Boolean.FALSE.equals(s)) {
            throw new CyclicDependencyException(element);
        }
        state.put(element, Boolean.FALSE);
        for (Element<?, ?> dep : dependencies.apply(element)) {
            checkScope(element, dep);
            visit(dep, dependencies, state, ordered);
        }
        state.put(element, Boolean.TRUE);
        ordered.add(element);
    }

    static void checkScope(Element<?, ?> element, Element<?, ?> dependency) {
        if (!element.getUniverse().canReference(dependency.getUniverse())) {
            throw new IllegalStateException("Element " + element.getName() + " in universe "
                    + element.getUniverse().getName() + " depends on " + dependency.getName()
                    + " from universe " + dependency.getUniverse().getName() + ", which is not in scope");
        }
    }
}
