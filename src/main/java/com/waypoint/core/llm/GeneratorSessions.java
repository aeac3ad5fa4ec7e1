package com.waypoint.core.llm;

import com.waypoint.core.compiler.ModelTemplate;
import com.waypoint.core.config.WaypointProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out the plan and logic generator conversations of each running mission.
 * Conversations are created on first use and dropped by {@link #close(String)}.
 */
@Component
public class GeneratorSessions {

    private static final Logger log = LoggerFactory.getLogger(GeneratorSessions.class);

    static final String PLAN_INSTRUCTIONS = """
            You are a mission planner that generates behaviour-tree XML mission plans for a ground robot \
            in a precision-agriculture orchard.
            The plan must contain a BehaviorTree element whose root is a Sequence. Available control nodes: \
            Sequence, Fallback. Conditions: AssertTrue result="{var}" and \
            CheckValue value="{var}" threshold="<integer>" comp="lt|lte|gt|gte|eq|neq". \
            Every action element needs a descriptive, unique name attribute.
            Tasks should almost always drive to a tree before acting on it. The first task goes to start \
            and the last goes to end.
            Format your answer as a fenced block: ```xml <plan> ```. Do not include an XML declaration.
            """;

    static final String LOGIC_INSTRUCTIONS = """
            You are a linear temporal logic generator producing Spin-compatible LTL for a mobile robot mission.
            Define one macro per atomic proposition with #define name (expression), using the task and \
            variable names of the model. Task propositions compare <task>.action.actionType to an action \
            type; condition propositions compare a variable to a threshold.
            The first macro must state that the first task has not started: <firstTask>.action.actionType == 0. \
            Do not use that macro in the formula; the formula starts at the first task and is anchored \
            to the initial state for you.
            Steps are sequential: use X, never <>, since the robot does one thing at a time.
            Format your answer as a fenced block: ```ltl <macros> ltl mission { <formula> } ```. \
            The formula refers to macro names only. Make sure parentheses balance.
            """;

    private final LlmService llmService;
    private final String planSystemPrompt;
    private final Map<String, String> platformPlanPrompts = new LinkedHashMap<>();
    private final String logicSystemPrompt;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public GeneratorSessions(LlmService llmService, ModelTemplate modelTemplate, WaypointProperties properties) {
        this.llmService = llmService;
        WaypointProperties.Plan plan = properties.getPlan();
        this.planSystemPrompt = planPrompt(plan, plan.getSchemaPath());
        plan.getSchemas().forEach((name, path) -> platformPlanPrompts.put(name, planPrompt(plan, path)));
        this.logicSystemPrompt = LOGIC_INSTRUCTIONS
                + "\nHere are the Promela types used by the model. Use them in your macros:\n"
                + modelTemplate.text();
    }

    public ArtifactGenerator planGenerator(String missionId) {
        return planGenerator(missionId, "");
    }

    /**
     * @param schemaName robot platform whose schema goes into the plan prompt; blank for the default.
     *                   Only the first call of a mission picks the schema.
     */
    public ArtifactGenerator planGenerator(String missionId, String schemaName) {
        return session(missionId, schemaName).plan();
    }

    public ArtifactGenerator logicGenerator(String missionId) {
        return session(missionId, "").logic();
    }

    public void close(String missionId) {
        if (sessions.remove(missionId) != null) {
            log.debug("Closed generator conversations for mission {}", missionId);
        }
    }

    private Session session(String missionId, String schemaName) {
        return sessions.computeIfAbsent(missionId, id -> new Session(
                new ConversationalGenerator(llmService, planSystemPrompt(schemaName)),
                new ConversationalGenerator(llmService, logicSystemPrompt)));
    }

    private String planSystemPrompt(String schemaName) {
        if (schemaName == null || schemaName.isBlank()) {
            return planSystemPrompt;
        }
        String prompt = platformPlanPrompts.get(schemaName);
        if (prompt == null) {
            throw new IllegalArgumentException("Unrecognized schema: " + schemaName);
        }
        return prompt;
    }

    private static String planPrompt(WaypointProperties.Plan plan, String schemaPath) {
        return PLAN_INSTRUCTIONS
                + optionalFile("This is the schema plans must validate against:", schemaPath)
                + contextFiles(plan.getContextFiles())
                + "\nAllowed action elements: " + String.join(", ", plan.getActionTypes());
    }

    private static String contextFiles(List<String> paths) {
        var sb = new StringBuilder();
        for (String path : paths) {
            sb.append(optionalFile("Context file " + Path.of(path).getFileName() + ":", path));
        }
        return sb.toString();
    }

    private static String optionalFile(String heading, String path) {
        if (path == null || path.isBlank()) {
            return "";
        }
        try {
            return "\n" + heading + "\n" + Files.readString(Path.of(path)) + "\n";
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read generator context file " + path, e);
        }
    }

    private record Session(ArtifactGenerator plan, ArtifactGenerator logic) {}
}
