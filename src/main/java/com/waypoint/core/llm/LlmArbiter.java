package com.waypoint.core.llm;

import com.waypoint.core.model.ArbiterVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link MissionArbiter} asking a language model for a structured verdict.
 */
public class LlmArbiter implements MissionArbiter {

    private static final Logger log = LoggerFactory.getLogger(LlmArbiter.class);

    private static final String SYSTEM_PROMPT = """
            You review example executions of a robot mission specification.
            Each run lists the atomic propositions that hold at each step, separated by spaces; \
            '!' marks a proposition that does not hold and 't' a step with no constraint.
            Decide whether every run is a sensible execution of the mission the user requested. \
            Set approved to false if any run skips, reorders or invents steps, and explain what is wrong.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;

    public LlmArbiter(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public ArbiterVerdict judge(String request, List<String> runs) {
        var prompt = new StringBuilder("Requested mission: ").append(request).append("\n\nExample runs:\n");
        for (int i = 0; i < runs.size(); i++) {
            prompt.append(i + 1).append(". ").append(runs.get(i)).append('\n');
        }
        ArbiterVerdict verdict = llmService.structuredCall(SYSTEM_PROMPT, prompt.toString(), ArbiterVerdict.class);
        log.info("LLM arbiter {} the sampled runs", verdict.approved() ? "approved" : "rejected");
        return verdict;
    }
}
