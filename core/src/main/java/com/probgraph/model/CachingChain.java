package com.probgraph.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Chain that keeps a bounded, least-recently-used table of subordinates keyed
 * by parent value. Eviction is silent and deactivates the evicted element;
 * only performance depends on cache hits.
 */
public class CachingChain<P, T> extends Chain<P, T> {

    private static final Logger logger = LoggerFactory.getLogger(CachingChain.class);

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Map<P, Element<T, ?>> cache;

    public CachingChain(String name, Universe universe, Element<P, ?> parent,
            Function<? super P, ? extends Element<T, ?>> fn) {
        this(name, universe, parent, fn, DEFAULT_CAPACITY);
    }

    public CachingChain(String name, Universe universe, Element<P, ?> parent,
            Function<? super P, ? extends Element<T, ?>> fn, int capacity) {
        super(name, universe, parent, fn);
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.cache = new LinkedHashMap<P, Element<T, ?>>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<P, Element<T, ?>> eldest) {
                if (size() > CachingChain.this.capacity) {
                    logger.trace("Chain {} evicting subordinate for {}", getName(), eldest.getKey());
                    getUniverse().deactivate(eldest.getValue());
                    return true;
                }
                return false;
            }
        };
    }

    @Override
    public synchronized Element<T, ?> get(P parentValue) {
        Element<T, ?> cached = cache.get(parentValue);
        if (cached != null) {
            return cached;
        }
        Element<T, ?> created = construct(parentValue);
        cache.put(parentValue, created);
        return created;
    }

    public int getCapacity() {
        return capacity;
    }

    public synchronized int cachedCount() {
        return cache.size();
    }
}
