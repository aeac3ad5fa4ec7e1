package com.waypoint.core.llm;

/**
 * A conversational producer of mission artifacts (plan documents, logic specifications).
 * Earlier prompts and answers of the same mission stay in context, so a corrective prompt
 * can refer to the previous attempt.
 */
public interface ArtifactGenerator {

    /**
     * @return the generator's raw answer, usually containing one fenced code block
     */
    String request(String prompt);

    /** Forgets the conversation so far. */
    void reset();
}
