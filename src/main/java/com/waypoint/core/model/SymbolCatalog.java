package com.waypoint.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Names the compiled model declares, handed to the macro aligner.
 *
 * @param taskNames task symbols in declaration order
 * @param globals   global variables in allocation order
 */
public record SymbolCatalog(List<String> taskNames, List<String> globals) implements Serializable {

    public SymbolCatalog {
        taskNames = List.copyOf(taskNames);
        globals = List.copyOf(globals);
    }

    public static SymbolCatalog empty() {
        return new SymbolCatalog(List.of(), List.of());
    }

    /**
     * Human-readable listing used when prompting the logic generator.
     */
    public String describe() {
        return "Tasks: " + String.join(", ", taskNames)
                + "\nGlobals: " + (globals.isEmpty() ? "(none)" : String.join(", ", globals));
    }
}
