package com.probgraph.model;

/**
 * The dependency structure built through composition contains a cycle. This
 * is a model construction error and cannot be recovered at the element level.
 */
public class CyclicDependencyException extends IllegalStateException {

    public CyclicDependencyException(Element<?, ?> element) {
        super("Cyclic dependency detected at element " + element.getName());
    }
}
