package com.waypoint.core.llm;

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ArtifactGenerator} keeping its message history in memory. One instance per mission.
 */
public class ConversationalGenerator implements ArtifactGenerator {

    private final LlmService llmService;
    private final String systemPrompt;
    private final List<Message> history = new ArrayList<>();

    public ConversationalGenerator(LlmService llmService, String systemPrompt) {
        this.llmService = llmService;
        this.systemPrompt = systemPrompt;
    }

    @Override
    public synchronized String request(String prompt) {
        String answer = llmService.chat(systemPrompt, List.copyOf(history), prompt);
        history.add(new UserMessage(prompt));
        history.add(new AssistantMessage(answer));
        return answer;
    }

    @Override
    public synchronized void reset() {
        history.clear();
    }

    synchronized int turns() {
        return history.size() / 2;
    }
}
