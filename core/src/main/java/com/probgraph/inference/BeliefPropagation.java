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
import java.util.List;
import java.util.Map;

/**
 * Loopy sum-product message passing on the factor graph of a model. Exact on
 * trees; on loopy graphs the beliefs are approximations. Stops after
 * {@code maxIterations} rounds or once no message moves by more than
 * {@code tolerance}.
 */
public class BeliefPropagation implements InferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(BeliefPropagation.class);

    public static final int DEFAULT_MAX_ITERATIONS = 20;
    public static final double DEFAULT_TOLERANCE = 1e-6;

    private final int maxIterations;
    private final double tolerance;

    public BeliefPropagation() {
        this(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    public BeliefPropagation(int maxIterations, double tolerance) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    @Override
    public String name() {
        return "belief_propagation";
    }

    @Override
    public InferenceResult infer(Universe universe, List<? extends Element<?, ?>> targets) {
        FactorModel model = FactorModel.build(universe, targets, new VariableContext());
        List<Factor> factors = model.getFactors();

        // For each variable, the (factor, position) pairs it appears in.
        Map<Variable<?>, List<int[]>> edges = new IdentityHashMap<>();
        for (Variable<?> v : model.getVariables()) {
            edges.put(v, new ArrayList<>());
        }
        double[][][] toVariable = new double[factors.size()][][];
        double[][][] toFactor = new double[factors.size()][][];
        for (int f = 0; f < factors.size(); f++) {
            List<Variable<?>> vars = factors.get(f).getVariables();
            toVariable[f] = new double[vars.size()][];
            toFactor[f] = new double[vars.size()][];
            for (int k = 0; k < vars.size(); k++) {
                edges.get(vars.get(k)).add(new int[] { f, k });
                toVariable[f][k] = uniform(vars.get(k).size());
                toFactor[f][k] = uniform(vars.get(k).size());
            }
        }

        int rounds = 0;
        double delta = Double.MAX_VALUE;
        while (rounds < maxIterations && delta > tolerance) {
            rounds++;
            for (Map.Entry<Variable<?>, List<int[]>> e : edges.entrySet()) {
                for (int[] edge : e.getValue()) {
                    double[] msg = MathUtil.ones(e.getKey().size());
                    for (int[] other : e.getValue()) {
                        if (other[0] == edge[0] && other[1] == edge[1]) {
                            continue;
                        }
                        multiplyInto(msg, toVariable[other[0]][other[1]]);
                    }
                    MathUtil.normalize(msg);
                    toFactor[edge[0]][edge[1]] = msg;
                }
            }
            delta = 0.0;
            for (int f = 0; f < factors.size(); f++) {
                for (int k = 0; k < toVariable[f].length; k++) {
                    double[] msg = factorMessage(factors.get(f), k, toFactor[f]);
                    MathUtil.normalize(msg);
                    delta = Math.max(delta, MathUtil.maxAbsDelta(msg, toVariable[f][k]));
                    toVariable[f][k] = msg;
                }
            }
            logger.debug("Belief propagation round {}: max message change {}", rounds, delta);
        }
        logger.info("Belief propagation finished after {} rounds over {} factors (last change {})", rounds,
                factors.size(), delta);

        Map<Element<?, ?>, Distribution<?>> results = new IdentityHashMap<>();
        for (Element<?, ?> target : targets) {
            results.put(target, belief(model.getContext().variable(target), edges, toVariable));
        }
        return new InferenceResult(name(), rounds, results);
    }

    private static <T> Distribution<T> belief(Variable<T> variable, Map<Variable<?>, List<int[]>> edges,
            double[][][] toVariable) {
        double[] b = MathUtil.ones(variable.size());
        for (int[] edge : edges.get(variable)) {
            multiplyInto(b, toVariable[edge[0]][edge[1]]);
        }
        Map<T, Double> weights = new LinkedHashMap<>();
        for (int i = 0; i < b.length; i++) {
            weights.put(variable.valueAt(i), b[i]);
        }
        return Distribution.fromWeights(weights);
    }

    /**
     * Sum over the factor's cells of the cell weight times the incoming
     * messages of every other variable, grouped by the value at position
     * {@code k}.
     */
    private static double[] factorMessage(Factor factor, int k, double[][] incoming) {
        List<Variable<?>> vars = factor.getVariables();
        int[] dims = new int[vars.size()];
        for (int i = 0; i < dims.length; i++) {
            dims[i] = vars.get(i).size();
        }
        double[] msg = new double[dims[k]];
        int[] assignment = new int[dims.length];
        do {
            double w = factor.get(assignment);
            if (w == 0.0) {
                continue;
            }
            for (int i = 0; i < assignment.length; i++) {
                if (i != k) {
                    w *= incoming[i][assignment[i]];
                }
            }
            msg[assignment[k]] += w;
        } while (Factor.nextAssignment(assignment, dims));
        return msg;
    }

    private static void multiplyInto(double[] target, double[] other) {
        for (int i = 0; i < target.length; i++) {
            target[i] *= other[i];
        }
    }

    private static double[] uniform(int n) {
        double[] x = MathUtil.ones(n);
        MathUtil.normalize(x);
        return x;
    }
}
