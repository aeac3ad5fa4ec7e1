package com.waypoint.core.consistency;

import com.waypoint.core.model.Automaton;
import com.waypoint.core.model.ConsistencyReport;
import com.waypoint.core.model.PlanNode;
import com.waypoint.core.model.TaskPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Cheap structural pre-check comparing a plan against its logic specification's automaton
 * before the model checker is invoked.
 * <p>
 * Plan side: one per action leaf, plus {@code 2 * ceil(n / 2)} per Fallback with {@code n}
 * alternatives. Each pair of alternatives contributes the two branch edges of the automaton;
 * an unpaired alternative still contributes two because the automaton carries an implicit
 * terminal branch for it. Logic side: automaton edges that are not self-loops.
 * <p>
 * When the counts differ the plan is kept and only the logic is regenerated.
 */
@Component
public class ConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyChecker.class);

    public int countPlanTasks(TaskPlan plan) {
        return count(plan.root());
    }

    public int countLogicTransitions(Automaton automaton) {
        return (int) automaton.edges().values().stream()
                .flatMap(List::stream)
                .filter(edge -> !edge.isSelfLoop())
                .count();
    }

    public ConsistencyReport check(TaskPlan plan, Automaton automaton) {
        var report = new ConsistencyReport(countPlanTasks(plan), countLogicTransitions(automaton));
        if (report.consistent()) {
            log.info("Plan and logic agree on {} task(s)", report.planTaskCount());
        } else {
            log.warn("Plan/logic mismatch: plan={} logic={}", report.planTaskCount(), report.logicTaskCount());
        }
        return report;
    }

    private int count(PlanNode node) {
        if (node instanceof PlanNode.ActionLeaf) {
            return 1;
        }
        if (node instanceof PlanNode.ConditionLeaf) {
            // bare condition: a Fallback with one alternative
            return branchPairs(1);
        }
        if (node instanceof PlanNode.Fallback fallback) {
            int total = branchPairs(fallback.alternatives().size());
            for (PlanNode alternative : fallback.alternatives()) {
                total += countAlternative(alternative);
            }
            return total;
        }
        if (node instanceof PlanNode.Sequence seq) {
            return sum(seq.children());
        }
        // Parallel is not compiled, so it contributes nothing
        return 0;
    }

    /**
     * An alternative's leading condition is its guard and is already covered by the Fallback.
     */
    private int countAlternative(PlanNode alternative) {
        if (alternative instanceof PlanNode.ConditionLeaf) {
            return 0;
        }
        if (alternative instanceof PlanNode.Sequence seq && !seq.children().isEmpty()
                && seq.children().get(0) instanceof PlanNode.ConditionLeaf) {
            return sum(seq.children().subList(1, seq.children().size()));
        }
        return count(alternative);
    }

    private int sum(List<PlanNode> nodes) {
        return nodes.stream().mapToInt(this::count).sum();
    }

    private static int branchPairs(int alternatives) {
        return 2 * ((alternatives + 1) / 2);
    }
}
