package com.waypoint.core.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlanSchemaValidatorTest {

    private static final String SCHEMA = """
            <xs:schema xmlns:xs="http://www.w3.org/2001/XMLSchema">
              <xs:element name="root">
                <xs:complexType>
                  <xs:sequence>
                    <xs:element name="BehaviorTree" type="xs:anyType"/>
                  </xs:sequence>
                </xs:complexType>
              </xs:element>
            </xs:schema>
            """;

    @Test
    @DisplayName("validation is a no-op when no schema is configured")
    void disabledWithoutSchema() {
        var validator = new PlanSchemaValidator("");

        assertFalse(validator.isEnabled());
        assertDoesNotThrow(() -> validator.validate("<anything/>"));
    }

    @Test
    @DisplayName("accepts plans matching the schema and rejects others")
    void validatesAgainstSchema(@TempDir Path dir) throws Exception {
        Path xsd = dir.resolve("plan.xsd");
        Files.writeString(xsd, SCHEMA);
        var validator = new PlanSchemaValidator(xsd.toString());

        assertTrue(validator.isEnabled());
        assertDoesNotThrow(() -> validator.validate("<root><BehaviorTree/></root>"));
        var e = assertThrows(PlanParseException.class, () -> validator.validate("<root><Mission/></root>"));
        assertTrue(e.getMessage().startsWith("XML is invalid: "));
    }

    @Test
    @DisplayName("an unreadable schema fails at startup")
    void badSchema(@TempDir Path dir) throws Exception {
        Path xsd = dir.resolve("broken.xsd");
        Files.writeString(xsd, "<not-a-schema");

        assertThrows(IllegalStateException.class, () -> new PlanSchemaValidator(xsd.toString()));
    }

    @Test
    @DisplayName("a named platform schema applies only to missions that choose it")
    void platformSchemas(@TempDir Path dir) throws Exception {
        Path xsd = dir.resolve("clearpath_husky.xsd");
        Files.writeString(xsd, SCHEMA);
        var validator = new PlanSchemaValidator("", Map.of("clearpath_husky", xsd.toString()));

        assertFalse(validator.isEnabled());
        assertEquals(Set.of("clearpath_husky"), validator.platforms());
        assertDoesNotThrow(() -> validator.validate("<root><Mission/></root>"));
        assertThrows(PlanParseException.class, () -> validator.validate("<root><Mission/></root>", "clearpath_husky"));
        assertDoesNotThrow(() -> validator.validate("<root><BehaviorTree/></root>", "clearpath_husky"));

        var e = assertThrows(IllegalArgumentException.class, () -> validator.validate("<root/>", "bd_spot"));
        assertEquals("Unrecognized schema: bd_spot", e.getMessage());
    }
}
