package com.waypoint.core.nodes;

import com.waypoint.core.compiler.ModelTemplate;
import com.waypoint.core.compiler.PlanCompiler;
import com.waypoint.core.compiler.TaskPlanParser;
import com.waypoint.core.events.EventBus;
import com.waypoint.core.llm.ArtifactGenerator;
import com.waypoint.core.llm.GeneratorSessions;
import com.waypoint.core.logic.LogicSpecificationParser;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionPhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.client.ResourceAccessException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GenerateLogicNodeTest {

    private ArtifactGenerator logicGenerator;
    private GenerateLogicNode node;

    @BeforeEach
    void setUp() {
        logicGenerator = mock(ArtifactGenerator.class);
        GeneratorSessions sessions = mock(GeneratorSessions.class);
        when(sessions.logicGenerator(anyString())).thenReturn(logicGenerator);
        node = new GenerateLogicNode(sessions, new TaskPlanParser(NodeFixtures.ACTION_TYPES), new PlanCompiler(),
                new ModelTemplate(""), new LogicSpecificationParser(), NodeFixtures.transitions(new EventBus()));
    }

    @Test
    @DisplayName("prompts with the request and the compiled symbols, then moves to NeedConsistency")
    void generatesLogic() {
        when(logicGenerator.request(anyString())).thenReturn("```ltl\n" + NodeFixtures.LOGIC + "```");

        var result = node.apply(NodeFixtures.state(Map.of("planText", NodeFixtures.PLAN)));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(logicGenerator).request(prompt.capture());
        assertTrue(prompt.getValue().startsWith("Mission: Drive to tree A and read the temperature\n\n"));
        assertTrue(prompt.getValue().contains("Tasks: goToTreeA, readTempA\nGlobals: (none)"));
        assertFalse(prompt.getValue().contains("not accepted"));
        assertEquals(MissionPhase.NEED_CONSISTENCY.name(), result.get("phase"));
        assertEquals(NodeFixtures.LOGIC.strip(), result.get("logicText"));
    }

    @Test
    @DisplayName("corrective feedback is appended to the prompt")
    void appendsFeedback() {
        when(logicGenerator.request(anyString())).thenReturn("```promela\n" + NodeFixtures.LOGIC + "```");

        node.apply(NodeFixtures.state(Map.of("planText", NodeFixtures.PLAN,
                "feedback", "The mission plan contains 2 tasks but your LTL produces 3 transitions")));

        verify(logicGenerator).request(contains(
                "Your previous specification was not accepted:\nThe mission plan contains 2 tasks"));
    }

    @Test
    @DisplayName("logic without a formula retries NeedLogic")
    void unparseableLogic() {
        when(logicGenerator.request(anyString())).thenReturn("```ltl\n#define a (x == 1)\n```");

        var result = node.apply(NodeFixtures.state(Map.of("planText", NodeFixtures.PLAN)));

        assertEquals(MissionPhase.NEED_LOGIC.name(), result.get("phase"));
        assertEquals(1, result.get("retryCount"));
        assertEquals(ErrorCategory.GENERATION_ERROR, NodeFixtures.singleError(result).category());
    }

    @Test
    @DisplayName("an unreachable provider consumes a retry and keeps the mission in NeedLogic")
    void providerUnreachable() {
        when(logicGenerator.request(anyString())).thenThrow(new ResourceAccessException("Connection refused"));

        var result = node.apply(NodeFixtures.state(Map.of("planText", NodeFixtures.PLAN)));

        assertEquals(MissionPhase.NEED_LOGIC.name(), result.get("phase"));
        assertEquals(1, result.get("retryCount"));
        assertEquals("The specification could not be generated: ResourceAccessException: Connection refused",
                result.get("feedback"));
        assertEquals(ErrorCategory.GENERATION_ERROR, NodeFixtures.singleError(result).category());
    }
}
