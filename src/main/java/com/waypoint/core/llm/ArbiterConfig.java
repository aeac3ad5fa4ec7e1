package com.waypoint.core.llm;

import com.waypoint.core.config.WaypointProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ArbiterConfig {

    private static final Logger log = LoggerFactory.getLogger(ArbiterConfig.class);

    @Bean
    public MissionArbiter missionArbiter(WaypointProperties properties, LlmService llmService) {
        String mode = properties.getArbiter().getMode();
        if ("human".equalsIgnoreCase(mode)) {
            log.info("Using console arbiter");
            return new ConsoleArbiter(System.in, System.out);
        }
        if (!"llm".equalsIgnoreCase(mode)) {
            throw new IllegalStateException("Unknown waypoint.arbiter.mode '" + mode + "' (expected llm or human)");
        }
        log.info("Using LLM arbiter");
        return new LlmArbiter(llmService);
    }
}
