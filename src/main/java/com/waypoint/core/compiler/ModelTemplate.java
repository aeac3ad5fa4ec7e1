package com.waypoint.core.compiler;

import com.waypoint.core.config.WaypointProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * The Promela preamble (type declarations) every compiled model starts with.
 * Also shown to the logic generator so its macros use the same names.
 */
@Component
public class ModelTemplate {

    private final String text;

    @Autowired
    public ModelTemplate(WaypointProperties properties, ResourceLoader resourceLoader) {
        String location = properties.getVerification().getTemplateLocation();
        try (var in = resourceLoader.getResource(location).getInputStream()) {
            this.text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read Promela template " + location, e);
        }
    }

    public ModelTemplate(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
