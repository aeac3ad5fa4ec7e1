package com.waypoint.core.model;

import java.io.Serializable;

/**
 * A temporal formula over macro names plus the macro block defining them.
 *
 * @param macros  the {@code #define} block
 * @param formula formula body, without any {@code ltl name { }} wrapper
 */
public record LogicSpecification(MacroBlock macros, String formula) implements Serializable {}
