package com.probgraph.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Chain that builds a new subordinate whenever the parent value differs from
 * the one it last saw. The replaced subordinate is deactivated.
 */
public class NonCachingChain<P, T> extends Chain<P, T> {

    private boolean hasLast;
    private P lastParentValue;
    private Element<T, ?> lastSubordinate;

    public NonCachingChain(String name, Universe universe, Element<P, ?> parent,
            Function<? super P, ? extends Element<T, ?>> fn) {
        super(name, universe, parent, fn);
    }

    @Override
    public synchronized Element<T, ?> get(P parentValue) {
        if (hasLast && Objects.equals(lastParentValue, parentValue)) {
            return lastSubordinate;
        }
        if (hasLast) {
            getUniverse().deactivate(lastSubordinate);
        }
        lastSubordinate = construct(parentValue);
        lastParentValue = parentValue;
        hasLast = true;
        return lastSubordinate;
    }

    @Override
    protected synchronized Object policyState() {
        return new Object[] { hasLast, lastParentValue, lastSubordinate };
    }

    @Override
    @SuppressWarnings("unchecked")
    protected synchronized void restorePolicyState(Object state) {
        Object[] saved = (Object[]) state;
        Element<T, ?> replaced = lastSubordinate;
        hasLast = (Boolean) saved[0];
        lastParentValue = (P) saved[1];
        lastSubordinate = (Element<T, ?>) saved[2];
        if (replaced != null && replaced != lastSubordinate) {
            getUniverse().deactivate(replaced);
        }
        if (lastSubordinate != null) {
            getUniverse().reactivate(lastSubordinate);
        }
    }
}
