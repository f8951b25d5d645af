package com.probgraph.factor;

import com.probgraph.model.Element;

import java.util.Objects;

public class Factors {

    private Factors() {
    }

    /**
     * Single-variable factor holding the element's density at each domain
     * value, in domain order.
     */
    public static <T> Factor densityFactor(VariableContext context, Element<T, ?> element) {
        Variable<T> variable = context.variable(element);
        Factor.Builder builder = Factor.builder(variable);
        for (int i = 0; i < variable.size(); i++) {
            builder.set(element.density(variable.valueAt(i)), i);
        }
        return builder.build();
    }

    /**
     * Indicator factor restricting an observed element to its observation.
     */
    public static <T> Factor evidenceFactor(VariableContext context, Element<T, ?> element) {
        T observation = element.getObservation();
        Variable<T> variable = context.variable(element);
        Factor.Builder builder = Factor.builder(variable);
        for (int i = 0; i < variable.size(); i++) {
            builder.set(Objects.equals(variable.valueAt(i), observation) ? 1.0 : 0.0, i);
        }
        return builder.build();
    }
}
