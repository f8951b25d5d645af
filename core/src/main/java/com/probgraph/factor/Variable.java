package com.probgraph.factor;

import com.probgraph.model.Element;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Finite-domain handle for an element inside factors. Obtain it from a
 * {@link VariableContext}, which hands out exactly one per element per run.
 */
public final class Variable<T> {

    private final int id;
    private final Element<T, ?> element;
    private final List<T> domain;
    private final Map<T, Integer> indices = new HashMap<>();

    Variable(int id, Element<T, ?> element, List<T> domain) {
        this.id = id;
        this.element = element;
        this.domain = Collections.unmodifiableList(domain);
        for (int i = 0; i < domain.size(); i++) {
            if (indices.put(domain.get(i), i) != null) {
                throw new IllegalArgumentException(
                        "Domain of " + element.getName() + " contains duplicate value " + domain.get(i));
            }
        }
    }

    public int getId() {
        return id;
    }

    public Element<T, ?> getElement() {
        return element;
    }

    public List<T> getDomain() {
        return domain;
    }

    public int size() {
        return domain.size();
    }

    public T valueAt(int index) {
        return domain.get(index);
    }

    /**
     * Index of {@code value} in the domain, or -1.
     */
    public int indexOf(Object value) {
        Integer idx = indices.get(value);
        return idx != null ? idx : -1;
    }

    @Override
    public String toString() {
        return "Variable{" + id + ":" + element.getName() + ", size=" + domain.size() + "}";
    }
}
