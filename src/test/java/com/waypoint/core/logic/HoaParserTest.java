package com.waypoint.core.logic;

import com.waypoint.core.model.Automaton;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HoaParserTest {

    /** ltl2tgba -B -H -f '"go" && X("cool" || "hot")' */
    static final String HOA = """
            HOA: v1
            name: "go & X(cool | hot)"
            States: 3
            Start: 1
            AP: 3 "go" "cool" "hot"
            acc-name: Buchi
            Acceptance: 1 Inf(0)
            properties: trans-labels explicit-labels state-acc deterministic
            --BODY--
            State: 0 {0}
            [t] 0
            State: 1
            [0] 2
            State: 2
            [1 | 2] 0
            --END--
            """;

    private final HoaParser parser = new HoaParser();

    @Test
    @DisplayName("reads start state, accepting states and labelled edges")
    void parsesAutomaton() {
        Automaton automaton = parser.parse(HOA);

        assertEquals(1, automaton.initialState());
        assertTrue(automaton.isAccepting(0));
        assertFalse(automaton.isAccepting(1));
        assertEquals(3, automaton.stateCount());
        assertEquals(List.of(new Automaton.Edge(1, 2, "go")), automaton.outgoing(1));
        assertEquals(List.of(new Automaton.Edge(2, 0, "cool | hot")), automaton.outgoing(2));
        assertTrue(automaton.outgoing(0).get(0).isSelfLoop());
    }

    @Test
    @DisplayName("renders labels with proposition names")
    void renderLabel() {
        var aps = List.of("a", "b", "c");

        assertEquals("a & !b", HoaParser.renderLabel("0&!1", aps));
        assertEquals("!a | c", HoaParser.renderLabel("!0 | 2", aps));
        assertEquals("t", HoaParser.renderLabel(" t ", aps));
        assertThrows(AutomatonTranslationException.class, () -> HoaParser.renderLabel("5", aps));
    }

    @Test
    @DisplayName("rejects output that is not HOA")
    void rejectsGarbage() {
        assertThrows(AutomatonTranslationException.class, () -> parser.parse("ltl2tgba: syntax error"));
        assertThrows(AutomatonTranslationException.class, () -> parser.parse(
                "HOA: v1\n--BODY--\nState: 0\nnonsense\n--END--"));
    }

    @Test
    @DisplayName("requires a Start header")
    void requiresStart() {
        var e = assertThrows(AutomatonTranslationException.class,
                () -> parser.parse("HOA: v1\nAP: 0\n--BODY--\nState: 0 {0}\n[t] 0\n--END--"));
        assertEquals("HOA automaton has no Start state", e.getMessage());
    }
}
