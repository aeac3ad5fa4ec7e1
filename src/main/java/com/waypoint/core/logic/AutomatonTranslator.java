package com.waypoint.core.logic;

import com.waypoint.core.model.Automaton;
import com.waypoint.core.model.LogicSpecification;

/**
 * Turns a temporal formula into a Büchi automaton whose propositions are the macro names.
 */
public interface AutomatonTranslator {

    /**
     * @throws AutomatonTranslationException if the formula is rejected
     */
    Automaton translate(LogicSpecification specification);
}
