package com.waypoint.core.logic;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.model.Automaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Produces example executions of an automaton for the arbiter to judge.
 * <p>
 * Each run is a random walk from the initial state to the first accepting state, choosing
 * uniformly among outgoing edges that are not self-loops. The run is the walked edge labels
 * joined by spaces.
 */
@Component
public class AutomatonSampler {

    private static final Logger log = LoggerFactory.getLogger(AutomatonSampler.class);

    private final Random random;
    private final int maxWalkSteps;

    @Autowired
    public AutomatonSampler(WaypointProperties properties) {
        this(new Random(), properties.getLogic().getMaxWalkSteps());
    }

    public AutomatonSampler(Random random, int maxWalkSteps) {
        this.random = random;
        this.maxWalkSteps = maxWalkSteps;
    }

    public List<String> sampleRuns(Automaton automaton, int count) {
        var runs = new ArrayList<String>(count);
        for (int i = 0; i < count; i++) {
            runs.add(sampleRun(automaton));
        }
        log.debug("Sampled {} run(s)", runs.size());
        return runs;
    }

    /**
     * @throws SamplerDeadlockException if a state offers only self-loops or the walk
     *                                  exceeds the configured step bound
     */
    public String sampleRun(Automaton automaton) {
        int state = automaton.initialState();
        var labels = new ArrayList<String>();
        int steps = 0;
        while (!automaton.isAccepting(state)) {
            if (steps++ >= maxWalkSteps) {
                throw new SamplerDeadlockException(
                        "No accepting state reached within " + maxWalkSteps + " steps", state);
            }
            List<Automaton.Edge> forward = automaton.outgoing(state).stream()
                    .filter(edge -> !edge.isSelfLoop())
                    .toList();
            if (forward.isEmpty()) {
                throw new SamplerDeadlockException(
                        "State " + state + " has no outgoing edge besides self-loops", state);
            }
            Automaton.Edge edge = forward.get(random.nextInt(forward.size()));
            labels.add(edge.label());
            state = edge.destination();
        }
        return String.join(" ", labels);
    }
}
