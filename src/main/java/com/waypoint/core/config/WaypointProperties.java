package com.waypoint.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "waypoint")
public class WaypointProperties {

    private Verification verification = new Verification();
    private Logic logic = new Logic();
    private Plan plan = new Plan();
    private Pipeline pipeline = new Pipeline();
    private Arbiter arbiter = new Arbiter();
    private Transport transport = new Transport();

    public Verification getVerification() { return verification; }
    public void setVerification(Verification verification) { this.verification = verification; }
    public Logic getLogic() { return logic; }
    public void setLogic(Logic logic) { this.logic = logic; }
    public Plan getPlan() { return plan; }
    public void setPlan(Plan plan) { this.plan = plan; }
    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }
    public Arbiter getArbiter() { return arbiter; }
    public void setArbiter(Arbiter arbiter) { this.arbiter = arbiter; }
    public Transport getTransport() { return transport; }
    public void setTransport(Transport transport) { this.transport = transport; }

    /**
     * Spin model checker invocation.
     */
    public static class Verification {
        private String spinBinary = "spin";
        private String workDirectory = ".";
        private String logDirectory = "logs";
        private int timeoutSeconds = 120;
        private String templateLocation = "classpath:promela/template.pml";

        public String getSpinBinary() { return spinBinary; }
        public void setSpinBinary(String spinBinary) { this.spinBinary = spinBinary; }
        public String getWorkDirectory() { return workDirectory; }
        public void setWorkDirectory(String workDirectory) { this.workDirectory = workDirectory; }
        public String getLogDirectory() { return logDirectory; }
        public void setLogDirectory(String logDirectory) { this.logDirectory = logDirectory; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public String getTemplateLocation() { return templateLocation; }
        public void setTemplateLocation(String templateLocation) { this.templateLocation = templateLocation; }
    }

    /**
     * Temporal-logic translation and automaton sampling.
     */
    public static class Logic {
        private String ltl2tgbaBinary = "ltl2tgba";
        private int translationTimeoutSeconds = 30;
        private int sampleRuns = 5;
        private int maxWalkSteps = 1000;

        public String getLtl2tgbaBinary() { return ltl2tgbaBinary; }
        public void setLtl2tgbaBinary(String ltl2tgbaBinary) { this.ltl2tgbaBinary = ltl2tgbaBinary; }
        public int getTranslationTimeoutSeconds() { return translationTimeoutSeconds; }
        public void setTranslationTimeoutSeconds(int translationTimeoutSeconds) { this.translationTimeoutSeconds = translationTimeoutSeconds; }
        public int getSampleRuns() { return sampleRuns; }
        public void setSampleRuns(int sampleRuns) { this.sampleRuns = sampleRuns; }
        public int getMaxWalkSteps() { return maxWalkSteps; }
        public void setMaxWalkSteps(int maxWalkSteps) { this.maxWalkSteps = maxWalkSteps; }
    }

    /**
     * Plan documents: accepted action tags, optional XSD, extra generator context.
     */
    public static class Plan {
        private List<String> actionTypes = new ArrayList<>(List.of(
                "DetectObject", "MoveToGPSLocation", "TakeAmbientTemperature",
                "TakeCO2Reading", "TakeThermalPicture"));
        private String schemaPath = "";
        private Map<String, String> schemas = new LinkedHashMap<>();
        private List<String> contextFiles = new ArrayList<>();

        public List<String> getActionTypes() { return actionTypes; }
        public void setActionTypes(List<String> actionTypes) { this.actionTypes = actionTypes; }
        public String getSchemaPath() { return schemaPath; }
        public void setSchemaPath(String schemaPath) { this.schemaPath = schemaPath; }
        public Map<String, String> getSchemas() { return schemas; }
        public void setSchemas(Map<String, String> schemas) { this.schemas = schemas; }
        public List<String> getContextFiles() { return contextFiles; }
        public void setContextFiles(List<String> contextFiles) { this.contextFiles = contextFiles; }
    }

    public static class Pipeline {
        private int maxRetries = 5;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    public static class Arbiter {
        /** {@code llm} or {@code human}. */
        private String mode = "llm";

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
    }

    public static class Transport {
        private boolean enabled = false;
        private String host = "localhost";
        private int port = 12345;
        private int connectTimeoutMs = 5000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public int getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(int connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }
}
