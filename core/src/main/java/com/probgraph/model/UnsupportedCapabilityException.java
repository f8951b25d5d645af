package com.probgraph.model;

/**
 * Thrown when an inference step asks an element for a capability it does not
 * provide, such as enumerating an infinite support.
 */
public class UnsupportedCapabilityException extends UnsupportedOperationException {

    private final transient Element<?, ?> element;
    private final Capability capability;

    public UnsupportedCapabilityException(Element<?, ?> element, Capability capability) {
        super("Element " + element.getName() + " (" + element.getClass().getSimpleName()
                + ") does not support " + capability);
        this.element = element;
        this.capability = capability;
    }

    public Element<?, ?> getElement() {
        return element;
    }

    public Capability getCapability() {
        return capability;
    }
}
