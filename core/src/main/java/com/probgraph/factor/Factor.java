package com.probgraph.factor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Dense table of non-negative weights over an ordered tuple of variables.
 *
 * <p>
 * Dimension {@code i} has exactly {@code variables.get(i).size()} entries.
 * Factors produced by elements go through {@link Builder}, which refuses to
 * build while any cell is unset. Products and marginals computed by the
 * inference layer are always complete.
 */
public final class Factor {

    private final List<Variable<?>> variables;
    private final int[] dims;
    private final int[] strides;
    private final double[] cells;

    private Factor(List<Variable<?>> variables, double[] cells) {
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.dims = new int[variables.size()];
        for (int i = 0; i < dims.length; i++) {
            dims[i] = variables.get(i).size();
        }
        this.strides = computeStrides(dims);
        if (cells.length != tableSize(dims)) {
            throw new IllegalArgumentException(
                    "Expected " + tableSize(dims) + " cells for " + variables + ", got " + cells.length);
        }
        this.cells = cells;
    }

    public static Builder builder(List<Variable<?>> variables) {
        return new Builder(variables);
    }

    public static Builder builder(Variable<?>... variables) {
        return new Builder(Arrays.asList(variables));
    }

    public List<Variable<?>> getVariables() {
        return variables;
    }

    public int arity() {
        return variables.size();
    }

    public int size() {
        return cells.length;
    }

    public boolean contains(Variable<?> variable) {
        return variables.contains(variable);
    }

    public int positionOf(Variable<?> variable) {
        return variables.indexOf(variable);
    }

    public double get(int... indices) {
        return cells[flatIndex(indices)];
    }

    /**
     * Weights of a single-variable factor in domain order.
     */
    public double[] weights() {
        if (arity() != 1) {
            throw new IllegalStateException("weights() requires a single-variable factor, arity is " + arity());
        }
        return cells.clone();
    }

    public double sum() {
        double total = 0.0;
        for (double c : cells) {
            total += c;
        }
        return total;
    }

    public Factor product(Factor other) {
        List<Variable<?>> union = new ArrayList<>(variables);
        for (Variable<?> v : other.variables) {
            if (!union.contains(v)) {
                union.add(v);
            }
        }
        int[] mapThis = positions(variables, union);
        int[] mapOther = positions(other.variables, union);

        int[] unionDims = new int[union.size()];
        for (int i = 0; i < unionDims.length; i++) {
            unionDims[i] = union.get(i).size();
        }
        double[] result = new double[tableSize(unionDims)];
        if (result.length == 0) {
            return new Factor(union, result);
        }

        int[] assignment = new int[union.size()];
        int[] a = new int[variables.size()];
        int[] b = new int[other.variables.size()];
        int flat = 0;
        do {
            for (int i = 0; i < a.length; i++) {
                a[i] = assignment[mapThis[i]];
            }
            for (int i = 0; i < b.length; i++) {
                b[i] = assignment[mapOther[i]];
            }
            result[flat++] = get(a) * other.get(b);
        } while (nextAssignment(assignment, unionDims));
        return new Factor(union, result);
    }

    public Factor sumOut(Variable<?> variable) {
        int pos = positionOf(variable);
        if (pos < 0) {
            throw new IllegalArgumentException(variable + " is not in this factor");
        }
        List<Variable<?>> remaining = new ArrayList<>(variables);
        remaining.remove(pos);
        int[] remainingDims = new int[remaining.size()];
        for (int i = 0; i < remainingDims.length; i++) {
            remainingDims[i] = remaining.get(i).size();
        }
        int[] remainingStrides = computeStrides(remainingDims);
        double[] result = new double[tableSize(remainingDims)];
        if (cells.length == 0) {
            return new Factor(remaining, result);
        }

        int[] assignment = new int[dims.length];
        int flat = 0;
        do {
            int target = 0;
            for (int i = 0, j = 0; i < assignment.length; i++) {
                if (i == pos) {
                    continue;
                }
                target += assignment[i] * remainingStrides[j++];
            }
            result[target] += cells[flat++];
        } while (nextAssignment(assignment, dims));
        return new Factor(remaining, result);
    }

    /**
     * Advances {@code assignment} to the next cell in row-major order.
     *
     * @return false once every assignment has been visited
     */
    public static boolean nextAssignment(int[] assignment, int[] dims) {
        for (int i = assignment.length - 1; i >= 0; i--) {
            assignment[i]++;
            if (assignment[i] < dims[i]) {
                return true;
            }
            assignment[i] = 0;
        }
        return false;
    }

    private int flatIndex(int[] indices) {
        if (indices.length != dims.length) {
            throw new IllegalArgumentException("Expected " + dims.length + " indices, got " + indices.length);
        }
        int flat = 0;
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= dims[i]) {
                throw new IndexOutOfBoundsException(
                        "Index " + indices[i] + " out of range for " + variables.get(i));
            }
            flat += indices[i] * strides[i];
        }
        return flat;
    }

    private static int[] positions(List<Variable<?>> vars, List<Variable<?>> union) {
        int[] map = new int[vars.size()];
        for (int i = 0; i < map.length; i++) {
            map[i] = union.indexOf(vars.get(i));
        }
        return map;
    }

    private static int[] computeStrides(int[] dims) {
        int[] strides = new int[dims.length];
        int stride = 1;
        for (int i = dims.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= dims[i];
        }
        return strides;
    }

    private static int tableSize(int[] dims) {
        int size = 1;
        for (int d : dims) {
            size *= d;
        }
        return size;
    }

    @Override
    public String toString() {
        return "Factor{" + variables + ", cells=" + Arrays.toString(cells) + "}";
    }

    public static final class Builder {
        private final List<Variable<?>> variables;
        private final int[] dims;
        private final int[] strides;
        private final double[] cells;
        private final boolean[] set;

        private Builder(List<Variable<?>> variables) {
            for (int i = 0; i < variables.size(); i++) {
                if (variables.indexOf(variables.get(i)) != i) {
                    throw new IllegalArgumentException("Variable " + variables.get(i) + " appears twice");
                }
            }
            this.variables = new ArrayList<>(variables);
            this.dims = new int[variables.size()];
            for (int i = 0; i < dims.length; i++) {
                dims[i] = variables.get(i).size();
            }
            this.strides = computeStrides(dims);
            this.cells = new double[tableSize(dims)];
            this.set = new boolean[cells.length];
        }

        public Builder set(double weight, int... indices) {
            if (weight < 0 || Double.isNaN(weight)) {
                throw new IllegalArgumentException("Factor weights must be non-negative, got " + weight);
            }
            if (indices.length != dims.length) {
                throw new IllegalArgumentException("Expected " + dims.length + " indices, got " + indices.length);
            }
            int flat = 0;
            for (int i = 0; i < indices.length; i++) {
                if (indices[i] < 0 || indices[i] >= dims[i]) {
                    throw new IndexOutOfBoundsException(
                            "Index " + indices[i] + " out of range for " + variables.get(i));
                }
                flat += indices[i] * strides[i];
            }
            cells[flat] = weight;
            set[flat] = true;
            return this;
        }

        public Factor build() {
            for (int i = 0; i < set.length; i++) {
                if (!set[i]) {
                    throw new IllegalStateException("Factor over " + variables + " has unset cell " + i);
                }
            }
            return new Factor(variables, cells.clone());
        }
    }
}
