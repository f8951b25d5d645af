package com.probgraph.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Scope that owns a set of elements.
 *
 * <p>
 * Elements created at top level are permanent and reachable by name. Elements
 * created while a chain builds a subordinate are temporary: they belong to
 * that chain, are not roots of the model and are dropped when the chain
 * evicts them. A universe may have a parent; elements may reference elements
 * of the same universe or of an ancestor.
 */
public class Universe {

    private static final Logger logger = LoggerFactory.getLogger(Universe.class);

    private final String name;
    private final Universe parent;

    private final List<Element<?, ?>> elements = new ArrayList<>();
    private final Map<String, Element<?, ?>> byName = new HashMap<>();
    private final Map<Element<?, ?>, Boolean> temporaries = new IdentityHashMap<>();
    private final Deque<Element<?, ?>> owners = new ArrayDeque<>();
    private long nextId = 0;

    public Universe(String name) {
        this(name, null);
    }

    public Universe(String name, Universe parent) {
        this.name = name;
        this.parent = parent;
        logger.debug("Created universe {} (parent: {})", name, parent != null ? parent.name : "none");
    }

    public String getName() {
        return name;
    }

    public Optional<Universe> getParent() {
        return Optional.ofNullable(parent);
    }

    synchronized long nextId() {
        return nextId++;
    }

    synchronized void register(Element<?, ?> element) {
        if (element.isTemporary()) {
            temporaries.put(element, Boolean.TRUE);
            return;
        }
        Element<?, ?> existing = byName.get(element.getName());
        if (existing != null) {
            throw new IllegalArgumentException(
                    "Universe " + name + " already has an element named '" + element.getName() + "'");
        }
        elements.add(element);
        byName.put(element.getName(), element);
        if (logger.isTraceEnabled()) {
            logger.trace("Registered {} in universe {}", element.getName(), name);
        }
    }

    synchronized Element<?, ?> currentOwner() {
        return owners.peek();
    }

    /**
     * Runs {@code body} with {@code owner} as the owner of every element it
     * creates.
     */
    public <X> X withinContext(Element<?, ?> owner, Supplier<X> body) {
        synchronized (this) {
            owners.push(owner);
        }
        try {
            return body.get();
        } finally {
            synchronized (this) {
                owners.pop();
            }
        }
    }

    /**
     * Drops a temporary element and everything it created. Permanent elements
     * are left alone.
     */
    public synchronized void deactivate(Element<?, ?> element) {
        if (temporaries.remove(element) == null) {
            return;
        }
        List<Element<?, ?>> owned = new ArrayList<>();
        for (Element<?, ?> e : temporaries.keySet()) {
            if (e.getOwner().orElse(null) == element) {
                owned.add(e);
            }
        }
        for (Element<?, ?> e : owned) {
            deactivate(e);
        }
    }

    public synchronized void reactivate(Element<?, ?> element) {
        if (element.isTemporary()) {
            temporaries.put(element, Boolean.TRUE);
        }
    }

    /**
     * Permanent elements in creation order.
     */
    public synchronized List<Element<?, ?>> activeElements() {
        return Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public synchronized int temporaryCount() {
        return temporaries.size();
    }

    /**
     * Looks the name up here, then in each ancestor.
     */
    public Optional<Element<?, ?>> get(String elementName) {
        Element<?, ?> found;
        synchronized (this) {
            found = byName.get(elementName);
        }
        if (found != null) {
            return Optional.of(found);
        }
        return parent != null ? parent.get(elementName) : Optional.empty();
    }

    @SuppressWarnings("unchecked")
    public <T> Element<T, ?> getElement(String elementName) {
        return (Element<T, ?>) get(elementName)
                .orElseThrow(() -> new IllegalArgumentException("No element named '" + elementName + "' in " + name));
    }

    /**
     * True if elements of this universe may depend on elements of
     * {@code other}.
     */
    public boolean canReference(Universe other) {
        for (Universe u = this; u != null; u = u.parent) {
            if (u == other) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Universe{" + name + ", elements=" + elements.size() + "}";
    }
}
