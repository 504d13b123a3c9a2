/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.report;

import ai.evacortex.chorale.core.HarmonyAnalyzer;
import ai.evacortex.chorale.core.ProgressionAnalysis;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static ai.evacortex.chorale.core.ChordTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    @TempDir Path tempDir;

    private final ReportWriter writer = new ReportWriter(new ViolationFormatter(4));

    private ProgressionAnalysis analysis() {
        return new HarmonyAnalyzer().analyze(C_MAJOR, List.of(
                satb("F4", "D4", "B3", "G2"),
                satb("G4", "C4", "C4", "C3")));
    }

    @Test
    void testToJson_containsChordsAndViolations() throws Exception {
        JsonNode root = new ObjectMapper().readTree(writer.toJson(analysis()));

        assertEquals("C major", root.get("key").asText());
        assertEquals(0, root.get("keySignature").asInt());
        assertEquals(2, root.get("chords").size());
        assertEquals("V7,+", root.get("chords").get(0).get("fullLabel").asText());
        assertEquals("DOMINANT", root.get("chords").get(0).get("function").asText());

        JsonNode violation = root.get("violations").get(0);
        assertEquals("err-0", violation.get("id").asText());
        assertEquals("seventh_resolution", violation.get("rule").asText());
        assertEquals("Measure 1, beat 1: Unresolved seventh (Soprano)", violation.get("message").asText());
        assertEquals(0, root.get("issues").size());
    }

    @Test
    void testWrite_streamIsPrettyPrinted() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.write(analysis(), out);
        String json = out.toString(StandardCharsets.UTF_8);
        assertTrue(json.contains("\n"), "pretty printer emits line breaks");
        assertTrue(json.contains("\"beatCount\" : 2"));
    }

    @Test
    void testWriteAndRead_fileRoundTrip() {
        Path file = tempDir.resolve("reports").resolve("chorale.json");
        ProgressionAnalysis analysis = analysis();
        writer.write(analysis, file);

        assertTrue(Files.exists(file));
        assertEquals(writer.toReport(analysis), writer.read(file));
    }
}
