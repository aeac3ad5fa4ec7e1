package com.waypoint.core.nodes;

import com.waypoint.core.compiler.ModelTemplate;
import com.waypoint.core.compiler.PlanCompiler;
import com.waypoint.core.compiler.TaskPlanParser;
import com.waypoint.core.logic.LogicSpecificationParser;
import com.waypoint.core.logic.MacroAligner;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.model.VerificationResult;
import com.waypoint.core.state.MissionState;
import com.waypoint.core.verification.VerificationDriver;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * NeedVerification: compiles the plan, aligns the macros to the model's symbols and runs Spin.
 * <p>
 * A checker setup failure is blamed on the logic. A pass or a violation both go on to
 * arbitration; the violation is acted upon after the logic has been approved.
 */
@Component
public class VerifyMissionNode {

    private final TaskPlanParser planParser;
    private final PlanCompiler compiler;
    private final ModelTemplate template;
    private final LogicSpecificationParser logicParser;
    private final MacroAligner aligner;
    private final VerificationDriver driver;
    private final WaypointMetrics metrics;
    private final PhaseTransitions transitions;

    public VerifyMissionNode(TaskPlanParser planParser, PlanCompiler compiler, ModelTemplate template,
                             LogicSpecificationParser logicParser, MacroAligner aligner,
                             VerificationDriver driver, WaypointMetrics metrics, PhaseTransitions transitions) {
        this.planParser = planParser;
        this.compiler = compiler;
        this.template = template;
        this.logicParser = logicParser;
        this.aligner = aligner;
        this.driver = driver;
        this.metrics = metrics;
        this.transitions = transitions;
    }

    public Map<String, Object> apply(MissionState state) {
        transitions.enter(state, MissionPhase.NEED_VERIFICATION);
        var model = compiler.compile(planParser.parse(state.planText()), template.text());
        var specification = logicParser.parse(state.logicText());
        var aligned = aligner.align(model.catalog(), specification.macros());

        long start = System.currentTimeMillis();
        VerificationResult result = driver.verify(model, aligned, specification.formula());
        metrics.recordVerification(result.outcome().name(), System.currentTimeMillis() - start);

        if (result.outcome() == VerificationResult.Outcome.SETUP_FAILURE) {
            return transitions.retry(state, MissionPhase.NEED_VERIFICATION, MissionPhase.NEED_LOGIC,
                    ErrorCategory.VERIFICATION_SETUP_ERROR,
                    "Spin could not check the model with your specification:\n" + result.counterexampleText(),
                    Map.of("verificationResult", result));
        }
        return transitions.advance(state, MissionPhase.NEED_ARBITRATION, Map.of("verificationResult", result));
    }
}
