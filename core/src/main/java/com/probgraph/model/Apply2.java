package com.probgraph.model;

import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;

public class Apply2<A, B, T> extends Apply<T> {

    private final BiFunction<? super A, ? super B, ? extends T> fn;

    public Apply2(String name, Universe universe, Element<A, ?> arg1, Element<B, ?> arg2,
            BiFunction<? super A, ? super B, ? extends T> fn) {
        super(name, universe, Arrays.asList(arg1, arg2));
        this.fn = fn;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected T compute(List<Object> parentValues) {
        return fn.apply((A) parentValues.get(0), (B) parentValues.get(1));
    }
}
