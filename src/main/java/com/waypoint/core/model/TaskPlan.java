package com.waypoint.core.model;

import java.io.Serializable;

/**
 * A parsed mission plan: the behaviour-tree root plus the text it was parsed from.
 *
 * @param root       root node of the tree, normally a {@link PlanNode.Sequence}
 * @param sourceText the plan document as produced by the plan generator
 */
public record TaskPlan(PlanNode root, String sourceText) implements Serializable {}
