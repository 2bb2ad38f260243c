package com.risk.fta.api;

import java.util.List;

/**
 * Thrown when a gate is reachable from itself.
 *
 * The path lists display names from the first occurrence of the repeated gate
 * through the repetition, e.g. {@code [A, B, A]}.
 */
public class CycleDetectedException extends ValidationException {
    private final List<String> path;

    public CycleDetectedException(String treeName, List<String> path) {
        super("Detected a cycle in '" + treeName + "' fault tree: " + String.join("->", path));
        this.path = List.copyOf(path);
    }

    public List<String> path() {
        return path;
    }
}
