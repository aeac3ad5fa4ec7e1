package com.waypoint.core.logic;

import com.waypoint.core.model.MacroBlock;
import com.waypoint.core.model.MacroDefinition;
import com.waypoint.core.model.SymbolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the identifiers used in logic macros so they match the symbols the compiled
 * model actually declares.
 * <p>
 * Matching is positional: the n-th distinct task identifier (in order of first appearance
 * across the block) is renamed to the n-th catalog task, and likewise for condition
 * variables and catalog globals. This is a heuristic. It only holds when the logic generator
 * mentions tasks in plan order; a reordered logic maps silently to the wrong tasks.
 * <p>
 * Aligning an aligned block against the same catalog changes nothing.
 */
@Component
public class MacroAligner {

    private static final Logger log = LoggerFactory.getLogger(MacroAligner.class);

    static final Pattern TASK_REF = Pattern.compile("\\b([A-Za-z_]\\w*)(?=\\.action\\.actionType\\b)");
    static final Pattern COMPARED_VAR = Pattern.compile("(?<![.\\w])([A-Za-z_]\\w*)(?=\\s*(?:<=|>=|==|!=|<|>))");

    public MacroBlock align(SymbolCatalog catalog, MacroBlock block) {
        Map<String, String> taskRenames = positionalRenames(
                identifiers(block, TASK_REF, true), catalog.taskNames(), "task");
        Map<String, String> globalRenames = positionalRenames(
                identifiers(block, COMPARED_VAR, false), catalog.globals(), "global");

        var aligned = new ArrayList<MacroDefinition>();
        for (MacroDefinition macro : block.macros()) {
            if (isTaskReferencing(macro)) {
                aligned.add(macro.withBody(rename(macro.body(), TASK_REF, taskRenames)));
            } else if (isGlobalReferencing(macro)) {
                aligned.add(macro.withBody(rename(macro.body(), COMPARED_VAR, globalRenames)));
            } else {
                aligned.add(macro);
            }
        }
        return new MacroBlock(aligned);
    }

    public static boolean isTaskReferencing(MacroDefinition macro) {
        return TASK_REF.matcher(macro.body()).find();
    }

    /**
     * The first task a macro's guard compares, e.g. {@code goToTreeA} for
     * {@code goToTreeA.action.actionType == MoveToGPSLocation}.
     */
    public static Optional<String> referencedTask(MacroDefinition macro) {
        Matcher m = TASK_REF.matcher(macro.body());
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    public static boolean isGlobalReferencing(MacroDefinition macro) {
        return !isTaskReferencing(macro) && COMPARED_VAR.matcher(macro.body()).find();
    }

    private static List<String> identifiers(MacroBlock block, Pattern pattern, boolean taskMacros) {
        Set<String> seen = new LinkedHashSet<>();
        for (MacroDefinition macro : block.macros()) {
            boolean relevant = taskMacros ? isTaskReferencing(macro) : isGlobalReferencing(macro);
            if (!relevant) {
                continue;
            }
            Matcher m = pattern.matcher(macro.body());
            while (m.find()) {
                seen.add(m.group(1));
            }
        }
        return new ArrayList<>(seen);
    }

    private static Map<String, String> positionalRenames(List<String> raw, List<String> symbols, String kind) {
        Map<String, String> renames = new HashMap<>();
        for (int i = 0; i < raw.size(); i++) {
            if (i < symbols.size()) {
                renames.put(raw.get(i), symbols.get(i));
            } else {
                log.warn("No catalog {} for macro identifier '{}' (catalog has {}), left unchanged",
                        kind, raw.get(i), symbols.size());
            }
        }
        return renames;
    }

    private static String rename(String body, Pattern pattern, Map<String, String> renames) {
        Matcher m = pattern.matcher(body);
        var sb = new StringBuilder();
        while (m.find()) {
            String replacement = renames.getOrDefault(m.group(1), m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
