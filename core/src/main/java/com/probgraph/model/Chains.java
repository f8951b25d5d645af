package com.probgraph.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

public class Chains {

    private static final Logger logger = LoggerFactory.getLogger(Chains.class);

    private Chains() {
    }

    /**
     * Builds a caching chain when the parent has a small support, a
     * non-caching one otherwise. Construct either variant directly to override
     * the choice.
     */
    public static <P, T> Chain<P, T> chain(String name, Universe universe, Element<P, ?> parent,
            Function<? super P, ? extends Element<T, ?>> fn) {
        if (parent.hasSmallSupport()) {
            logger.debug("Chain {}: parent {} has small support, caching subordinates", name, parent.getName());
            return new CachingChain<>(name, universe, parent, fn);
        }
        logger.debug("Chain {}: parent {} is not cacheable, not caching subordinates", name, parent.getName());
        return new NonCachingChain<>(name, universe, parent, fn);
    }
}
