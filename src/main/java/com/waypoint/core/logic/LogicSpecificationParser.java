package com.waypoint.core.logic;

import com.waypoint.core.model.LogicSpecification;
import com.waypoint.core.model.MacroBlock;
import com.waypoint.core.model.MacroDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits generated logic text into {@code #define} macros and the temporal formula.
 * <p>
 * Accepts the formula either bare or wrapped as {@code ltl name { ... }}; the wrapper is dropped.
 */
@Component
public class LogicSpecificationParser {

    private static final Pattern DEFINE = Pattern.compile("^\\s*#define\\s+([A-Za-z_]\\w*)\\s+(.+?)\\s*$");
    private static final Pattern LTL_WRAPPER = Pattern.compile("\\bltl\\b\\s*\\w*\\s*\\{(.*)}", Pattern.DOTALL);

    public LogicSpecification parse(String text) {
        if (text == null || text.isBlank()) {
            throw new LogicParseException("Logic specification is empty");
        }
        var macros = new ArrayList<MacroDefinition>();
        var formulaLines = new StringBuilder();

        for (String line : text.split("\\R")) {
            if (line.trim().startsWith("#define")) {
                Matcher m = DEFINE.matcher(line);
                if (!m.matches()) {
                    throw new LogicParseException("Malformed macro line: " + line.trim());
                }
                macros.add(new MacroDefinition(m.group(1), unwrap(m.group(2))));
            } else if (!line.isBlank()) {
                formulaLines.append(line.trim()).append(' ');
            }
        }

        String formula = formulaLines.toString().trim();
        Matcher wrapper = LTL_WRAPPER.matcher(formula);
        if (wrapper.find()) {
            formula = wrapper.group(1).trim();
        }
        if (formula.isEmpty()) {
            throw new LogicParseException("Logic specification has no temporal formula");
        }
        return new LogicSpecification(new MacroBlock(macros), formula);
    }

    /**
     * Drops one pair of parentheses if it encloses the whole expression.
     */
    static String unwrap(String body) {
        String trimmed = body.trim();
        if (!trimmed.startsWith("(") || !trimmed.endsWith(")")) {
            return trimmed;
        }
        int depth = 0;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0 && i < trimmed.length() - 1) {
                    return trimmed;
                }
            }
        }
        return trimmed.substring(1, trimmed.length() - 1).trim();
    }
}
