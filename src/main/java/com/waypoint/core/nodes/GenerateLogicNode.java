package com.waypoint.core.nodes;

import com.waypoint.core.compiler.ModelTemplate;
import com.waypoint.core.compiler.PlanCompiler;
import com.waypoint.core.compiler.TaskPlanParser;
import com.waypoint.core.llm.FencedBlockExtractor;
import com.waypoint.core.llm.GeneratorOutputException;
import com.waypoint.core.llm.GeneratorSessions;
import com.waypoint.core.llm.LlmEmptyResponseException;
import com.waypoint.core.logic.LogicParseException;
import com.waypoint.core.logic.LogicSpecificationParser;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.model.SymbolCatalog;
import com.waypoint.core.state.MissionState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * NeedLogic: asks the logic generator for macros and a temporal formula describing the mission.
 * The prompt lists the symbols the compiled plan declares so the macros can use them.
 */
@Component
public class GenerateLogicNode {

    private final GeneratorSessions sessions;
    private final TaskPlanParser planParser;
    private final PlanCompiler compiler;
    private final ModelTemplate template;
    private final LogicSpecificationParser logicParser;
    private final PhaseTransitions transitions;

    public GenerateLogicNode(GeneratorSessions sessions, TaskPlanParser planParser, PlanCompiler compiler,
                             ModelTemplate template, LogicSpecificationParser logicParser,
                             PhaseTransitions transitions) {
        this.sessions = sessions;
        this.planParser = planParser;
        this.compiler = compiler;
        this.template = template;
        this.logicParser = logicParser;
        this.transitions = transitions;
    }

    public Map<String, Object> apply(MissionState state) {
        transitions.enter(state, MissionPhase.NEED_LOGIC);
        SymbolCatalog catalog = compiler.compile(planParser.parse(state.planText()), template.text()).catalog();

        var prompt = new StringBuilder()
                .append("Mission: ").append(state.request()).append("\n\n")
                .append("The model declares these symbols, in plan order:\n")
                .append(catalog.describe());
        if (!state.feedback().isBlank()) {
            prompt.append("\n\nYour previous specification was not accepted:\n").append(state.feedback());
        }

        String logicText;
        try {
            String answer = sessions.logicGenerator(state.missionId()).request(prompt.toString());
            logicText = FencedBlockExtractor.extract(answer, "ltl", "promela");
            logicParser.parse(logicText);
        } catch (GeneratorOutputException | LogicParseException | LlmEmptyResponseException e) {
            return transitions.retry(state, MissionPhase.NEED_LOGIC, MissionPhase.NEED_LOGIC,
                    ErrorCategory.GENERATION_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            return transitions.retry(state, MissionPhase.NEED_LOGIC, MissionPhase.NEED_LOGIC,
                    ErrorCategory.GENERATION_ERROR,
                    "The specification could not be generated: " + PhaseTransitions.describe(e));
        }
        return transitions.advance(state, MissionPhase.NEED_CONSISTENCY, Map.of("logicText", logicText));
    }
}
