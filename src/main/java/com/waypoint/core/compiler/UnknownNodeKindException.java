package com.waypoint.core.compiler;

/**
 * Thrown when a plan document contains an element that is neither a control node,
 * a condition, nor a configured action type.
 */
public class UnknownNodeKindException extends CompilationException {

    private final String kind;

    public UnknownNodeKindException(String kind) {
        super("Unknown node kind in plan: " + kind);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
