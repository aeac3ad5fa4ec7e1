package com.waypoint.core.logic;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.model.Automaton;
import com.waypoint.core.model.LogicSpecification;
import com.waypoint.core.model.MacroDefinition;
import com.waypoint.core.verification.CheckerProcessException;
import com.waypoint.core.verification.CheckerProcessRunner;
import com.waypoint.core.verification.ProcessOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link AutomatonTranslator} backed by Spot's {@code ltl2tgba}.
 * <p>
 * Macro names are quoted so Spot treats them as atomic propositions even when they clash
 * with operator letters. Output is requested as a state-based Büchi automaton in HOA format.
 */
@Component
public class SpotAutomatonTranslator implements AutomatonTranslator {

    private static final Logger log = LoggerFactory.getLogger(SpotAutomatonTranslator.class);

    private final CheckerProcessRunner runner;
    private final HoaParser hoaParser = new HoaParser();
    private final String binary;
    private final Duration timeout;
    private final Path workDirectory;

    public SpotAutomatonTranslator(CheckerProcessRunner runner, WaypointProperties properties) {
        this.runner = runner;
        this.binary = properties.getLogic().getLtl2tgbaBinary();
        this.timeout = Duration.ofSeconds(properties.getLogic().getTranslationTimeoutSeconds());
        this.workDirectory = Path.of(properties.getVerification().getWorkDirectory());
    }

    @Override
    public Automaton translate(LogicSpecification specification) {
        String formula = quotePropositions(specification.formula(),
                specification.macros().macros().stream().map(MacroDefinition::name).toList());
        log.debug("Translating formula: {}", formula);

        ProcessOutcome outcome;
        try {
            outcome = runner.run(List.of(binary, "-B", "-H", "-f", formula), workDirectory, timeout);
        } catch (CheckerProcessException e) {
            throw new AutomatonTranslationException(e.getMessage(), e);
        }
        if (!outcome.succeeded()) {
            throw new AutomatonTranslationException(outcome.timedOut()
                    ? "ltl2tgba timed out translating the formula"
                    : "ltl2tgba rejected the formula: " + outcome.output());
        }
        Automaton automaton = hoaParser.parse(outcome.output());
        log.info("Translated formula into automaton with {} state(s)", automaton.stateCount());
        return automaton;
    }

    static String quotePropositions(String formula, List<String> names) {
        if (names.isEmpty()) {
            return formula;
        }
        String alternation = names.stream()
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        Pattern pattern = Pattern.compile("(?<![\\w\"])(" + alternation + ")(?![\\w\"])");
        Matcher m = pattern.matcher(formula);
        var sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement("\"" + m.group(1) + "\""));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
