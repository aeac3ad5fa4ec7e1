package com.waypoint.core.nodes;

import com.waypoint.core.compiler.TaskPlanParser;
import com.waypoint.core.consistency.ConsistencyChecker;
import com.waypoint.core.logic.AutomatonTranslationException;
import com.waypoint.core.logic.AutomatonTranslator;
import com.waypoint.core.logic.LogicSpecificationParser;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.Automaton;
import com.waypoint.core.model.ConsistencyReport;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.state.MissionState;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * NeedConsistency: translates the formula and compares task counts with the plan.
 * A mismatch keeps the plan and sends only the logic back for regeneration.
 */
@Component
public class CheckConsistencyNode {

    private final TaskPlanParser planParser;
    private final LogicSpecificationParser logicParser;
    private final AutomatonTranslator translator;
    private final ConsistencyChecker checker;
    private final WaypointMetrics metrics;
    private final PhaseTransitions transitions;

    public CheckConsistencyNode(TaskPlanParser planParser, LogicSpecificationParser logicParser,
                                AutomatonTranslator translator, ConsistencyChecker checker,
                                WaypointMetrics metrics, PhaseTransitions transitions) {
        this.planParser = planParser;
        this.logicParser = logicParser;
        this.translator = translator;
        this.checker = checker;
        this.metrics = metrics;
        this.transitions = transitions;
    }

    public Map<String, Object> apply(MissionState state) {
        transitions.enter(state, MissionPhase.NEED_CONSISTENCY);
        var plan = planParser.parse(state.planText());
        var specification = logicParser.parse(state.logicText());

        Automaton automaton;
        try {
            automaton = translator.translate(specification);
        } catch (AutomatonTranslationException e) {
            return transitions.retry(state, MissionPhase.NEED_CONSISTENCY, MissionPhase.NEED_LOGIC,
                    ErrorCategory.GENERATION_ERROR, "Your formula could not be translated: " + e.getMessage());
        }

        ConsistencyReport report = checker.check(plan, automaton);
        metrics.recordConsistencyDelta(report.delta());
        Map<String, Object> counts = Map.of(
                "planTaskCount", report.planTaskCount(),
                "logicTaskCount", report.logicTaskCount());
        if (!report.consistent()) {
            return transitions.retry(state, MissionPhase.NEED_CONSISTENCY, MissionPhase.NEED_LOGIC,
                    ErrorCategory.CONSISTENCY_MISMATCH, report.correctiveMessage(), counts);
        }

        var updates = new HashMap<String, Object>(counts);
        updates.put("automaton", automaton);
        return transitions.advance(state, MissionPhase.NEED_VERIFICATION, updates);
    }
}
