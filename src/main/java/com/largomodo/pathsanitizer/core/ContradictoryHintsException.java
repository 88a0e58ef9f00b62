package com.largomodo.pathsanitizer.core;

/**
 * Thrown when caller-supplied role hints contradict each other or the node text,
 * e.g. a node asserted to be a drive that is not one. Indicates a caller bug.
 */
public class ContradictoryHintsException extends PathSanitizationException {

    public ContradictoryHintsException(String message, String node) {
        super(message, node);
    }
}
