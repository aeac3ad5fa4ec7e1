package com.waypoint.core.model;

import java.io.Serializable;

/**
 * One {@code #define name (body)} line of a logic specification.
 *
 * @param name atomic-proposition name used by the temporal formula
 * @param body boolean expression, without the surrounding parentheses
 */
public record MacroDefinition(String name, String body) implements Serializable {

    public String render() {
        return "#define " + name + " (" + body + ")";
    }

    public MacroDefinition withBody(String newBody) {
        return new MacroDefinition(name, newBody);
    }
}
