package com.waypoint.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Büchi automaton translated from a logic specification. Read-only.
 *
 * @param initialState    the start state
 * @param acceptingStates states satisfying the acceptance condition
 * @param edges           outgoing edges per state, in translator order
 */
public record Automaton(int initialState, Set<Integer> acceptingStates,
                        Map<Integer, List<Edge>> edges) implements Serializable {

    public Automaton {
        acceptingStates = Set.copyOf(acceptingStates);
        edges = Map.copyOf(edges);
    }

    public boolean isAccepting(int state) {
        return acceptingStates.contains(state);
    }

    public List<Edge> outgoing(int state) {
        return edges.getOrDefault(state, List.of());
    }

    public int stateCount() {
        return edges.size();
    }

    /**
     * A labelled transition.
     */
    public record Edge(int source, int destination, String label) implements Serializable {

        public boolean isSelfLoop() {
            return source == destination;
        }
    }
}
