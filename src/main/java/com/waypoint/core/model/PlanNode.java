package com.waypoint.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A node of a behaviour-tree task plan.
 * <p>
 * The hierarchy is closed: control nodes ({@link Sequence}, {@link Fallback}, {@link Parallel})
 * and leaves ({@link ActionLeaf}, {@link ConditionLeaf}). Anything else is rejected while the
 * plan text is parsed, so the compiler never meets an unknown kind.
 */
public sealed interface PlanNode extends Serializable
        permits PlanNode.Sequence, PlanNode.Fallback, PlanNode.Parallel,
                PlanNode.ActionLeaf, PlanNode.ConditionLeaf {

    /**
     * Children executed in order.
     */
    record Sequence(List<PlanNode> children) implements PlanNode {
        public Sequence {
            children = List.copyOf(children);
        }
    }

    /**
     * Ordered alternatives; the first alternative whose guard holds is taken.
     */
    record Fallback(List<PlanNode> alternatives) implements PlanNode {
        public Fallback {
            alternatives = List.copyOf(alternatives);
        }
    }

    /**
     * Reserved. Parsed so plans carrying it stay readable, but not compiled.
     */
    record Parallel(List<PlanNode> children) implements PlanNode {
        public Parallel {
            children = List.copyOf(children);
        }
    }

    /**
     * A robot action, e.g. {@code MoveToGPSLocation} named {@code MoveToNorthTree}.
     *
     * @param name       task name, becomes a {@code Task} symbol in the model
     * @param actionType the action-type constant assigned to the task
     */
    record ActionLeaf(String name, String actionType) implements PlanNode {}

    /**
     * A branch condition over a sensor reading or an action result.
     */
    sealed interface ConditionLeaf extends PlanNode permits AssertTrue, CheckValue {

        /** The plan variable the condition reads. */
        String variable();
    }

    /**
     * Holds when the boolean result variable is true.
     */
    record AssertTrue(String resultVar) implements ConditionLeaf {
        @Override
        public String variable() {
            return resultVar;
        }
    }

    /**
     * Compares a numeric reading against a threshold.
     */
    record CheckValue(String valueVar, int threshold, ComparisonOperator comparator) implements ConditionLeaf {
        @Override
        public String variable() {
            return valueVar;
        }
    }
}
