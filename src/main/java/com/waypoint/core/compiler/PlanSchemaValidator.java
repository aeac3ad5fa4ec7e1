package com.waypoint.core.compiler;

import com.waypoint.core.config.WaypointProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Validates plan XML against an XSD.
 * <p>
 * The default schema comes from {@code waypoint.plan.schema-path}; validation against it is
 * skipped when no path is set. Robot platforms listed under {@code waypoint.plan.schemas} can
 * be chosen per mission by name.
 */
@Component
public class PlanSchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(PlanSchemaValidator.class);

    private final Schema defaultSchema;
    private final Map<String, Schema> platformSchemas = new LinkedHashMap<>();

    @Autowired
    public PlanSchemaValidator(WaypointProperties properties) {
        this(properties.getPlan().getSchemaPath(), properties.getPlan().getSchemas());
    }

    PlanSchemaValidator(String schemaPath) {
        this(schemaPath, Map.of());
    }

    PlanSchemaValidator(String schemaPath, Map<String, String> schemas) {
        if (schemaPath == null || schemaPath.isBlank()) {
            log.info("No default plan schema configured, validation disabled unless a platform is chosen");
            this.defaultSchema = null;
        } else {
            this.defaultSchema = load(schemaPath);
            log.info("Plan schema loaded from {}", schemaPath);
        }
        schemas.forEach((name, path) -> platformSchemas.put(name, load(path)));
        if (!platformSchemas.isEmpty()) {
            log.info("Platform schemas available: {}", platformSchemas.keySet());
        }
    }

    public boolean isEnabled() {
        return defaultSchema != null;
    }

    public Set<String> platforms() {
        return platformSchemas.keySet();
    }

    public void validate(String xml) {
        validate(xml, "");
    }

    /**
     * @param schemaName platform name, or blank for the default schema
     * @throws PlanParseException with the validator's message if the document is invalid
     * @throws IllegalArgumentException if no schema is registered under {@code schemaName}
     */
    public void validate(String xml, String schemaName) {
        Schema schema = defaultSchema;
        if (schemaName != null && !schemaName.isBlank()) {
            schema = platformSchemas.get(schemaName);
            if (schema == null) {
                throw new IllegalArgumentException("Unrecognized schema: " + schemaName);
            }
        }
        if (schema == null) {
            return;
        }
        try {
            schema.newValidator().validate(new StreamSource(new StringReader(xml.strip())));
            log.debug("Plan XML validated against schema {}", schemaName == null || schemaName.isBlank() ? "default" : schemaName);
        } catch (SAXException e) {
            throw new PlanParseException("XML is invalid: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new PlanParseException("An error occurred: " + e.getMessage(), e);
        }
    }

    private static Schema load(String path) {
        try {
            var factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
            return factory.newSchema(Path.of(path).toFile());
        } catch (SAXException e) {
            throw new IllegalStateException("Cannot load plan schema " + path + ": " + e.getMessage(), e);
        }
    }
}
