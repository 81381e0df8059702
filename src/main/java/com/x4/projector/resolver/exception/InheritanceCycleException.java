package com.x4.projector.resolver.exception;

import java.util.List;

/**
 * Thrown when an {@code extends} chain loops back on itself. Fatal for the macro
 * being resolved, not for its siblings.
 */
public class InheritanceCycleException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> cycle;

    /**
     * @param cycle macro ids along the loop, first and last being the same id
     */
    public InheritanceCycleException(List<String> cycle) {
        super("Inheritance cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
