package com.probgraph.model.capability;

import com.probgraph.factor.Factor;
import com.probgraph.factor.VariableContext;

import java.util.List;

/**
 * Capability of elements that can express their local distribution as
 * tables. Every returned factor includes the element's own variable; dependent
 * elements include their arguments' variables too. Factors need not be
 * normalized.
 */
public interface FactorMaker {

    List<Factor> makeFactors(VariableContext context);
}
