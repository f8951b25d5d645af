package com.probgraph.model;

import java.util.Arrays;
import java.util.List;

public class Apply3<A, B, C, T> extends Apply<T> {

    @FunctionalInterface
    public interface Function3<A, B, C, T> {
        T apply(A a, B b, C c);
    }

    private final Function3<? super A, ? super B, ? super C, ? extends T> fn;

    public Apply3(String name, Universe universe, Element<A, ?> arg1, Element<B, ?> arg2, Element<C, ?> arg3,
            Function3<? super A, ? super B, ? super C, ? extends T> fn) {
        super(name, universe, Arrays.asList(arg1, arg2, arg3));
        this.fn = fn;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected T compute(List<Object> parentValues) {
        return fn.apply((A) parentValues.get(0), (B) parentValues.get(1), (C) parentValues.get(2));
    }
}
