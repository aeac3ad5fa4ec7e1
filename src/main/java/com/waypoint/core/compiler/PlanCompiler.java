package com.waypoint.core.compiler;

import com.waypoint.core.model.ComparisonOperator;
import com.waypoint.core.model.PlanNode;
import com.waypoint.core.model.TaskPlan;
import com.waypoint.core.model.VerificationModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a {@link TaskPlan} into a Promela model.
 * <p>
 * Action leaves become assignments to {@code <task>.action.actionType}; every task is declared
 * once as a {@code Task}. A Fallback becomes an {@code if ... fi} whose branches are guarded by
 * the alternatives' leading conditions. Each condition variable is a global assigned
 * nondeterministically with {@code select} just before the {@code if}: {@code 0..1} for
 * {@code AssertTrue} and {@code threshold-1..threshold+1} for {@code CheckValue}, so both
 * sides of every guard are reachable.
 * <p>
 * The output layout is
 * <pre>
 * template
 * Task ...;
 *
 * int ...;
 *
 * init {
 *     atomic {
 *         ...
 *     }
 * }
 * </pre>
 * Compilation is deterministic: the same plan always yields the same source.
 */
@Component
public class PlanCompiler {

    private static final Logger log = LoggerFactory.getLogger(PlanCompiler.class);

    /** Statements inside {@code init { atomic { } }} start at this depth. */
    private static final int BODY_DEPTH = 2;

    public VerificationModel compile(TaskPlan plan, String template) {
        var ctx = new CompilationContext();
        compileNode(plan.root(), ctx, BODY_DEPTH);

        String source = template
                + "\n" + ctx.taskDeclarations()
                + "\n" + ctx.globalDeclarations()
                + "\ninit {\n    atomic {\n"
                + ctx.body()
                + "\n    }\n}";

        var catalog = ctx.catalog();
        log.info("Compiled plan: {} task(s), {} global(s)", catalog.taskNames().size(), catalog.globals().size());
        return new VerificationModel(source, catalog);
    }

    private void compileNode(PlanNode node, CompilationContext ctx, int depth) {
        if (node instanceof PlanNode.Sequence seq) {
            for (PlanNode child : seq.children()) {
                compileNode(child, ctx, depth);
            }
        } else if (node instanceof PlanNode.Fallback fallback) {
            compileFallback(fallback.alternatives(), ctx, depth);
        } else if (node instanceof PlanNode.ConditionLeaf condition) {
            // a bare condition behaves like a Fallback with a single alternative
            compileFallback(List.of(condition), ctx, depth);
        } else if (node instanceof PlanNode.ActionLeaf action) {
            ctx.declareTask(action.name());
            ctx.emit(depth, action.name() + ".action.actionType = " + action.actionType() + ";");
        } else if (node instanceof PlanNode.Parallel) {
            log.warn("Parallel nodes are not supported by the model compiler, skipping");
        }
    }

    private void compileFallback(List<PlanNode> alternatives, CompilationContext ctx, int depth) {
        // globals owned by this Fallback, keyed by plan variable
        Map<String, String> groupGlobals = new LinkedHashMap<>();
        List<String> selects = new ArrayList<>();
        List<Branch> branches = new ArrayList<>();

        for (PlanNode alternative : alternatives) {
            PlanNode.ConditionLeaf condition = leadingCondition(alternative);
            List<PlanNode> rest = remainder(alternative, condition != null);
            if (condition == null) {
                branches.add(new Branch(null, null, rest));
                continue;
            }
            String global = groupGlobals.get(condition.variable());
            if (global == null) {
                global = ctx.allocateGlobal(condition.variable());
                groupGlobals.put(condition.variable(), global);
                selects.add(selectFor(condition, global));
            }
            branches.add(new Branch(guard(condition, global), negatedGuard(condition, global), rest));
        }

        selects.forEach(select -> ctx.emit(depth, select));
        ctx.emit(depth, "if");

        List<String> negations = new ArrayList<>();
        boolean coversDefault = false;
        for (Branch branch : branches) {
            String guard;
            if (branch.guard() != null) {
                guard = branch.guard();
                negations.add(branch.negation());
            } else {
                guard = negations.isEmpty() ? "else" : String.join(" && ", negations);
                coversDefault = true;
            }
            ctx.emit(depth, ":: " + guard + " ->");
            if (branch.body().isEmpty()) {
                ctx.emit(depth + 1, "skip");
            }
            for (PlanNode child : branch.body()) {
                compileNode(child, ctx, depth + 1);
            }
        }
        if (!coversDefault) {
            ctx.emit(depth, ":: else -> skip");
        }
        ctx.emit(depth, "fi");
    }

    private static PlanNode.ConditionLeaf leadingCondition(PlanNode alternative) {
        if (alternative instanceof PlanNode.ConditionLeaf condition) {
            return condition;
        }
        if (alternative instanceof PlanNode.Sequence seq && !seq.children().isEmpty()
                && seq.children().get(0) instanceof PlanNode.ConditionLeaf condition) {
            return condition;
        }
        return null;
    }

    private static List<PlanNode> remainder(PlanNode alternative, boolean dropLeadingCondition) {
        if (alternative instanceof PlanNode.Sequence seq) {
            return dropLeadingCondition ? seq.children().subList(1, seq.children().size()) : seq.children();
        }
        return dropLeadingCondition ? List.of() : List.of(alternative);
    }

    static String selectFor(PlanNode.ConditionLeaf condition, String global) {
        if (condition instanceof PlanNode.CheckValue check) {
            return "select (" + global + " : " + (check.threshold() - 1) + ".." + (check.threshold() + 1) + ");";
        }
        return "select (" + global + " : 0..1);";
    }

    static String guard(PlanNode.ConditionLeaf condition, String global) {
        if (condition instanceof PlanNode.CheckValue check) {
            return global + " " + check.comparator().symbol() + " " + check.threshold();
        }
        return global + " == 1";
    }

    static String negatedGuard(PlanNode.ConditionLeaf condition, String global) {
        if (condition instanceof PlanNode.CheckValue check) {
            ComparisonOperator negated = check.comparator().negate();
            return global + " " + negated.symbol() + " " + check.threshold();
        }
        return global + " != 1";
    }

    private record Branch(String guard, String negation, List<PlanNode> body) {}
}
