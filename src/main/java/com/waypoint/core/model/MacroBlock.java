package com.waypoint.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered macro definitions of a logic specification.
 */
public record MacroBlock(List<MacroDefinition> macros) implements Serializable {

    public MacroBlock {
        macros = List.copyOf(macros);
    }

    public Optional<MacroDefinition> find(String name) {
        return macros.stream().filter(m -> m.name().equals(name)).findFirst();
    }

    public String render() {
        return macros.stream().map(MacroDefinition::render).collect(Collectors.joining("\n"));
    }
}
