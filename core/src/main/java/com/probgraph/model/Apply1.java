package com.probgraph.model;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

public class Apply1<A, T> extends Apply<T> {

    private final Function<? super A, ? extends T> fn;

    public Apply1(String name, Universe universe, Element<A, ?> arg, Function<? super A, ? extends T> fn) {
        super(name, universe, Collections.singletonList(arg));
        this.fn = fn;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected T compute(List<Object> parentValues) {
        return fn.apply((A) parentValues.get(0));
    }
}
