package com.probgraph.inference;

import com.probgraph.model.Element;
import com.probgraph.model.Universe;

import java.util.List;

public interface InferenceEngine {
    /**
     * Posterior distribution of each target given the evidence currently set
     * on the universe's elements.
     */
    InferenceResult infer(Universe universe, List<? extends Element<?, ?>> targets);

    String name();
}
