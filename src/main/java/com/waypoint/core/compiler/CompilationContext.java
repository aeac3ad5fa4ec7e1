package com.waypoint.core.compiler;

import com.waypoint.core.model.SymbolCatalog;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable accumulator for one compilation: declared tasks, allocated globals and body lines.
 * A fresh context is created per {@link PlanCompiler#compile} call.
 */
class CompilationContext {

    private static final String INDENT = "    ";

    private final Set<String> taskNames = new LinkedHashSet<>();
    private final List<String> globals = new ArrayList<>();
    private final Map<String, Integer> allocationsPerVariable = new HashMap<>();
    private final List<String> body = new ArrayList<>();

    /**
     * Declares a task. Returns false if it was already declared.
     */
    boolean declareTask(String name) {
        return taskNames.add(name);
    }

    /**
     * Allocates a new global for a plan variable. The first allocation keeps the variable's
     * name; later ones get a numeric suffix ({@code temp_2}, {@code temp_3}).
     */
    String allocateGlobal(String variable) {
        int count = allocationsPerVariable.merge(variable, 1, Integer::sum);
        String name = count == 1 ? variable : variable + "_" + count;
        while (globals.contains(name)) {
            count = allocationsPerVariable.merge(variable, 1, Integer::sum);
            name = variable + "_" + count;
        }
        globals.add(name);
        return name;
    }

    void emit(int depth, String line) {
        body.add(INDENT.repeat(depth) + line);
    }

    String taskDeclarations() {
        var sb = new StringBuilder();
        taskNames.forEach(name -> sb.append("Task ").append(name).append(";\n"));
        return sb.toString();
    }

    String globalDeclarations() {
        var sb = new StringBuilder();
        globals.forEach(name -> sb.append("int ").append(name).append(";\n"));
        return sb.toString();
    }

    String body() {
        return String.join("\n", body);
    }

    SymbolCatalog catalog() {
        return new SymbolCatalog(List.copyOf(taskNames), globals);
    }
}
