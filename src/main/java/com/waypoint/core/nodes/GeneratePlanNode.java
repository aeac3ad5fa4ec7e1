package com.waypoint.core.nodes;

import com.waypoint.core.compiler.PlanParseException;
import com.waypoint.core.compiler.PlanSchemaValidator;
import com.waypoint.core.compiler.TaskPlanParser;
import com.waypoint.core.compiler.UnknownNodeKindException;
import com.waypoint.core.llm.FencedBlockExtractor;
import com.waypoint.core.llm.GeneratorOutputException;
import com.waypoint.core.llm.GeneratorSessions;
import com.waypoint.core.llm.LlmEmptyResponseException;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.state.MissionState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * NeedPlan: asks the plan generator for a behaviour-tree plan and checks that it parses.
 * <p>
 * The first prompt is the mission request; later prompts carry the feedback of the failed
 * attempt (a parse error or a counterexample). When accepted logic already exists, e.g. after
 * a counterexample, the new plan goes straight to the consistency check.
 */
@Component
public class GeneratePlanNode {

    private final GeneratorSessions sessions;
    private final PlanSchemaValidator schemaValidator;
    private final TaskPlanParser parser;
    private final PhaseTransitions transitions;

    public GeneratePlanNode(GeneratorSessions sessions, PlanSchemaValidator schemaValidator,
                            TaskPlanParser parser, PhaseTransitions transitions) {
        this.sessions = sessions;
        this.schemaValidator = schemaValidator;
        this.parser = parser;
        this.transitions = transitions;
    }

    public Map<String, Object> apply(MissionState state) {
        transitions.enter(state, MissionPhase.NEED_PLAN);
        String prompt = state.feedback().isBlank() ? state.request() : state.feedback();

        String planText;
        try {
            String answer = sessions.planGenerator(state.missionId(), state.schemaName()).request(prompt);
            planText = FencedBlockExtractor.extract(answer, "xml");
            schemaValidator.validate(planText, state.schemaName());
            parser.parse(planText);
        } catch (UnknownNodeKindException e) {
            return transitions.fail(state, MissionPhase.NEED_PLAN, ErrorCategory.COMPILATION_ERROR, e.getMessage());
        } catch (GeneratorOutputException | PlanParseException | LlmEmptyResponseException e) {
            return transitions.retry(state, MissionPhase.NEED_PLAN, MissionPhase.NEED_PLAN,
                    ErrorCategory.GENERATION_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            return transitions.retry(state, MissionPhase.NEED_PLAN, MissionPhase.NEED_PLAN,
                    ErrorCategory.GENERATION_ERROR, "The plan could not be generated: " + PhaseTransitions.describe(e));
        }

        MissionPhase next = state.logicText().isBlank() ? MissionPhase.NEED_LOGIC : MissionPhase.NEED_CONSISTENCY;
        return transitions.advance(state, next, Map.of("planText", planText));
    }
}
