package com.probgraph.inference;

import com.probgraph.factor.Factor;
import com.probgraph.factor.Factors;
import com.probgraph.factor.Variable;
import com.probgraph.factor.VariableContext;
import com.probgraph.model.Element;
import com.probgraph.model.Universe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Every factor of a model, built in one {@link VariableContext}: each
 * element's own factors plus an indicator factor per observed element.
 */
class FactorModel {

    private static final Logger logger = LoggerFactory.getLogger(FactorModel.class);

    private final VariableContext context;
    private final List<Factor> factors;
    private final List<Variable<?>> variables;

    private FactorModel(VariableContext context, List<Factor> factors, List<Variable<?>> variables) {
        this.context = context;
        this.factors = Collections.unmodifiableList(factors);
        this.variables = Collections.unmodifiableList(variables);
    }

    static FactorModel build(Universe universe, List<? extends Element<?, ?>> targets, VariableContext context) {
        List<Element<?, ?>> elements = ModelTraversal.forFactors(universe, targets, context);
        List<Factor> factors = new ArrayList<>();
        for (Element<?, ?> e : elements) {
            factors.addAll(context.factors(e));
            if (e.isObserved()) {
                factors.add(Factors.evidenceFactor(context, e));
            }
        }
        Set<Variable<?>> variables = new LinkedHashSet<>();
        for (Factor f : factors) {
            variables.addAll(f.getVariables());
        }
        logger.debug("Built {} factors over {} variables from {} elements", factors.size(), variables.size(),
                elements.size());
        return new FactorModel(context, factors, new ArrayList<>(variables));
    }

    VariableContext getContext() {
        return context;
    }

    List<Factor> getFactors() {
        return factors;
    }

    List<Variable<?>> getVariables() {
        return variables;
    }
}
