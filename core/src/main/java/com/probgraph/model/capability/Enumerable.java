package com.probgraph.model.capability;

import com.probgraph.factor.VariableContext;

import java.util.List;

/**
 * Capability of elements with a finite support.
 */
public interface Enumerable<T> {

    /**
     * All values the element can take, distinct and in a fixed order. Argument
     * values are looked up through {@code context} so that they are enumerated
     * once per run.
     */
    List<T> makeValues(VariableContext context);
}
