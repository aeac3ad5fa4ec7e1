package com.waypoint.core.logic;

import com.waypoint.core.model.MacroBlock;
import com.waypoint.core.model.MacroDefinition;
import com.waypoint.core.model.SymbolCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link MacroAligner}.
 */
class MacroAlignerTest {

    private static final SymbolCatalog CATALOG = new SymbolCatalog(
            List.of("goToTreeA", "readTempA", "photoTreeA"), List.of("temperature"));

    private MacroAligner aligner;

    @BeforeEach
    void setUp() {
        aligner = new MacroAligner();
    }

    private static MacroBlock block(String... nameBodyPairs) {
        var macros = new ArrayList<MacroDefinition>();
        for (int i = 0; i < nameBodyPairs.length; i += 2) {
            macros.add(new MacroDefinition(nameBodyPairs[i], nameBodyPairs[i + 1]));
        }
        return new MacroBlock(macros);
    }

    @Test
    @DisplayName("renames task identifiers positionally in order of first appearance")
    void positionalTasks() {
        MacroBlock raw = block(
                "init", "move.action.actionType == 0",
                "move", "move.action.actionType == MoveToGPSLocation",
                "temp", "reading.action.actionType == TakeAmbientTemperature",
                "pic", "picture.action.actionType == TakeThermalPicture");

        MacroBlock aligned = aligner.align(CATALOG, raw);

        assertEquals("goToTreeA.action.actionType == 0", aligned.find("init").orElseThrow().body());
        assertEquals("goToTreeA.action.actionType == MoveToGPSLocation", aligned.find("move").orElseThrow().body());
        assertEquals("readTempA.action.actionType == TakeAmbientTemperature", aligned.find("temp").orElseThrow().body());
        assertEquals("photoTreeA.action.actionType == TakeThermalPicture", aligned.find("pic").orElseThrow().body());
    }

    @Test
    @DisplayName("renames condition variables against the catalog globals")
    void globals() {
        MacroBlock aligned = aligner.align(CATALOG, block("cool", "temp_reading < 30", "hot", "temp_reading >= 30"));

        assertEquals("temperature < 30", aligned.find("cool").orElseThrow().body());
        assertEquals("temperature >= 30", aligned.find("hot").orElseThrow().body());
    }

    @Test
    @DisplayName("classifies macros as task- or global-referencing")
    void classification() {
        var task = new MacroDefinition("a", "x.action.actionType == DetectObject");
        var global = new MacroDefinition("b", "found == 1");
        var neither = new MacroDefinition("c", "true");

        assertTrue(MacroAligner.isTaskReferencing(task));
        assertFalse(MacroAligner.isGlobalReferencing(task));
        assertTrue(MacroAligner.isGlobalReferencing(global));
        assertFalse(MacroAligner.isTaskReferencing(neither));
        assertFalse(MacroAligner.isGlobalReferencing(neither));
    }

    @Test
    @DisplayName("aligning an aligned block again changes nothing")
    void idempotent() {
        MacroBlock raw = block(
                "move", "a.action.actionType == MoveToGPSLocation",
                "temp", "b.action.actionType == TakeAmbientTemperature",
                "cool", "t < 30");

        MacroBlock once = aligner.align(CATALOG, raw);
        MacroBlock twice = aligner.align(CATALOG, once);

        assertEquals(once, twice);
    }

    @Test
    @DisplayName("identifiers beyond the catalog are left unchanged")
    void beyondCatalog() {
        var small = new SymbolCatalog(List.of("only"), List.of());

        MacroBlock aligned = aligner.align(small, block(
                "a", "first.action.actionType == DetectObject",
                "b", "second.action.actionType == DetectObject",
                "c", "level > 3"));

        assertEquals("only.action.actionType == DetectObject", aligned.find("a").orElseThrow().body());
        assertEquals("second.action.actionType == DetectObject", aligned.find("b").orElseThrow().body());
        assertEquals("level > 3", aligned.find("c").orElseThrow().body());
    }

    @Test
    @DisplayName("swapping names in one pass does not chain renames")
    void swap() {
        var catalog = new SymbolCatalog(List.of("b", "a"), List.of());

        MacroBlock aligned = aligner.align(catalog, block(
                "x", "a.action.actionType == DetectObject && b.action.actionType == 0"));

        assertEquals("b.action.actionType == DetectObject && a.action.actionType == 0",
                aligned.find("x").orElseThrow().body());
    }
}
