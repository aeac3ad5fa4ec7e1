package com.waypoint.core.logic;

import com.waypoint.core.model.Automaton;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the subset of the Hanoi Omega-Automata format that {@code ltl2tgba -B -H} emits:
 * {@code Start}, {@code AP}, {@code State: n {acc}} headers and {@code [label] dst} edges.
 * Edge labels are rendered with proposition names, e.g. {@code a & !b}; {@code t} stays {@code t}.
 */
public class HoaParser {

    private static final Pattern AP_NAME = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern STATE = Pattern.compile("^State:\\s*(\\d+)(?:\\s+\"[^\"]*\")?\\s*(\\{[^}]*})?\\s*$");
    private static final Pattern EDGE = Pattern.compile("^\\[([^\\]]*)]\\s*(\\d+)(?:\\s*\\{[^}]*})?\\s*$");
    private static final Pattern AP_INDEX = Pattern.compile("\\d+");

    public Automaton parse(String hoa) {
        if (hoa == null || !hoa.contains("--BODY--")) {
            throw new AutomatonTranslationException("Translator output is not an HOA automaton: " + hoa);
        }
        Integer start = null;
        List<String> aps = new ArrayList<>();
        Set<Integer> accepting = new HashSet<>();
        Map<Integer, List<Automaton.Edge>> edges = new LinkedHashMap<>();

        boolean inBody = false;
        Integer current = null;
        for (String raw : hoa.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (!inBody) {
                if (line.startsWith("Start:")) {
                    start = parseInt(line.substring("Start:".length()).trim(), line);
                } else if (line.startsWith("AP:")) {
                    Matcher m = AP_NAME.matcher(line);
                    while (m.find()) {
                        aps.add(m.group(1));
                    }
                } else if (line.equals("--BODY--")) {
                    inBody = true;
                }
                continue;
            }
            if (line.equals("--END--")) {
                break;
            }
            Matcher state = STATE.matcher(line);
            if (state.matches()) {
                current = parseInt(state.group(1), line);
                edges.putIfAbsent(current, new ArrayList<>());
                if (state.group(2) != null) {
                    accepting.add(current);
                }
                continue;
            }
            Matcher edge = EDGE.matcher(line);
            if (edge.matches() && current != null) {
                int destination = parseInt(edge.group(2), line);
                edges.get(current).add(new Automaton.Edge(current, destination, renderLabel(edge.group(1), aps)));
                edges.putIfAbsent(destination, new ArrayList<>());
                continue;
            }
            throw new AutomatonTranslationException("Unexpected line in HOA body: " + line);
        }

        if (start == null) {
            throw new AutomatonTranslationException("HOA automaton has no Start state");
        }
        edges.putIfAbsent(start, new ArrayList<>());
        Map<Integer, List<Automaton.Edge>> frozen = new LinkedHashMap<>();
        edges.forEach((state, out) -> frozen.put(state, List.copyOf(out)));
        return new Automaton(start, accepting, frozen);
    }

    static String renderLabel(String label, List<String> aps) {
        String trimmed = label.trim();
        if (trimmed.equals("t")) {
            return "t";
        }
        Matcher m = AP_INDEX.matcher(trimmed);
        var sb = new StringBuilder();
        while (m.find()) {
            int index = Integer.parseInt(m.group());
            if (index >= aps.size()) {
                throw new AutomatonTranslationException("Edge label refers to undeclared AP " + index);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(aps.get(index)));
        }
        m.appendTail(sb);
        return sb.toString()
                .replace("&", " & ")
                .replace("|", " | ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static int parseInt(String text, String line) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new AutomatonTranslationException("Bad state number in HOA line: " + line, e);
        }
    }
}
