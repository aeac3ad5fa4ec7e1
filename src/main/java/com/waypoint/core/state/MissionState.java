package com.waypoint.core.state;

import com.waypoint.core.model.Automaton;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionError;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.model.VerificationResult;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state of one mission run through the verification and repair loop.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. The plan and logic are kept
 * as the generator's text; nodes re-parse them when they need structure. {@code errors} is an
 * appender channel so every failed attempt stays on record.
 */
public class MissionState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Loop control ─────────────────────────────────────────────
        Map.entry("missionId",          Channels.base(() -> "")),
        Map.entry("request",            Channels.base(() -> "")),
        Map.entry("phase",              Channels.base(() -> MissionPhase.NEED_PLAN.name())),
        Map.entry("retryCount",         Channels.base(() -> 0)),
        Map.entry("maxRetries",         Channels.base(() -> 5)),
        Map.entry("feedback",           Channels.base(() -> "")),
        Map.entry("failureCategory",    Channels.base(() -> "")),

        // ── Request options ──────────────────────────────────────────
        Map.entry("schemaName",         Channels.base(() -> "")),
        Map.entry("sendToRobot",        Channels.base(() -> true)),

        // ── Artifacts ────────────────────────────────────────────────
        Map.entry("planText",           Channels.base(() -> "")),
        Map.entry("logicText",          Channels.base(() -> "")),
        Map.entry("planTaskCount",      Channels.base(() -> 0)),
        Map.entry("logicTaskCount",     Channels.base(() -> 0)),
        Map.entry("automaton",          Channels.base((Reducer<Automaton>) null)),
        Map.entry("sampleRuns",         Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("verificationResult", Channels.base((Reducer<VerificationResult>) null)),
        Map.entry("artifactPath",       Channels.base(() -> "")),
        Map.entry("transmitted",        Channels.base(() -> false)),

        // ── Appender channels ────────────────────────────────────────
        Map.entry("errors",             Channels.appender(ArrayList::new))
    );

    public MissionState(Map<String, Object> initData) {
        super(initData);
    }

    public String missionId() {
        return this.<String>value("missionId").orElse("");
    }

    public String request() {
        return this.<String>value("request").orElse("");
    }

    public MissionPhase phase() {
        String raw = this.<String>value("phase").orElse(MissionPhase.NEED_PLAN.name());
        return MissionPhase.valueOf(raw);
    }

    /** Robot platform whose plan schema applies. Empty means the default schema. */
    public String schemaName() {
        return this.<String>value("schemaName").orElse("");
    }

    public boolean sendToRobot() {
        return this.<Boolean>value("sendToRobot").orElse(true);
    }

    public int retryCount() {
        return this.<Integer>value("retryCount").orElse(0);
    }

    public int maxRetries() {
        return this.<Integer>value("maxRetries").orElse(5);
    }

    /** Corrective context for the next generator prompt. Empty on the first attempt. */
    public String feedback() {
        return this.<String>value("feedback").orElse("");
    }

    public Optional<ErrorCategory> failureCategory() {
        String raw = this.<String>value("failureCategory").orElse("");
        return raw.isEmpty() ? Optional.empty() : Optional.of(ErrorCategory.valueOf(raw));
    }

    public String planText() {
        return this.<String>value("planText").orElse("");
    }

    public String logicText() {
        return this.<String>value("logicText").orElse("");
    }

    public int planTaskCount() {
        return this.<Integer>value("planTaskCount").orElse(0);
    }

    public int logicTaskCount() {
        return this.<Integer>value("logicTaskCount").orElse(0);
    }

    public Optional<Automaton> automaton() {
        return value("automaton");
    }

    public List<String> sampleRuns() {
        return this.<List<String>>value("sampleRuns").orElse(List.of());
    }

    public Optional<VerificationResult> verificationResult() {
        return value("verificationResult");
    }

    public String artifactPath() {
        return this.<String>value("artifactPath").orElse("");
    }

    public boolean transmitted() {
        return this.<Boolean>value("transmitted").orElse(false);
    }

    public List<MissionError> errors() {
        return this.<List<MissionError>>value("errors").orElse(List.of());
    }
}
