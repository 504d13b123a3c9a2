/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.report;

import ai.evacortex.chorale.core.BeatIssue;
import ai.evacortex.chorale.core.ProgressionAnalysis;
import ai.evacortex.chorale.core.analysis.ChordAnalysis;
import ai.evacortex.chorale.core.exceptions.ChoraleException;
import ai.evacortex.chorale.core.key.KeySignature;
import ai.evacortex.chorale.core.rules.RuleOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes {@link ProgressionAnalysis} results as pretty-printed JSON.
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;
    private final ViolationFormatter formatter;

    public ReportWriter(ViolationFormatter formatter) {
        this.mapper = new ObjectMapper();
        this.formatter = formatter;
    }

    public ProgressionReport toReport(ProgressionAnalysis analysis) {
        List<ProgressionReport.ChordEntry> chords = new ArrayList<>();
        for (Map.Entry<Integer, ChordAnalysis> e : analysis.chords().entrySet()) {
            ChordAnalysis c = e.getValue();
            chords.add(new ProgressionReport.ChordEntry(
                    e.getKey(),
                    c.snapshot().toString(),
                    c.structure().rootPitch().name(),
                    c.quality().name(),
                    c.inversion(),
                    c.degree(),
                    c.label(),
                    c.cipher(),
                    c.fullLabel(),
                    c.function().name(),
                    c.diatonic(),
                    c.chromaticType() != null ? c.chromaticType().tag() : null));
        }

        List<ProgressionReport.IssueEntry> issues = new ArrayList<>();
        for (BeatIssue i : analysis.issues()) {
            issues.add(new ProgressionReport.IssueEntry(i.beat(),
                    i.voice() != null ? i.voice().displayName() : null, i.input(), i.reason()));
        }

        List<ProgressionReport.FailureEntry> failures = new ArrayList<>();
        for (RuleOutcome f : analysis.failures()) {
            failures.add(new ProgressionReport.FailureEntry(f.rule().id(), String.valueOf(f.failure())));
        }

        return new ProgressionReport(
                analysis.tonality().toString(),
                KeySignature.of(analysis.tonality()),
                analysis.beatCount(),
                chords,
                formatter.formatAll(analysis.violations()),
                issues,
                failures);
    }

    public String toJson(ProgressionAnalysis analysis) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toReport(analysis));
        } catch (JsonProcessingException e) {
            throw new ChoraleException("Failed to serialise report", e);
        }
    }

    public void write(ProgressionAnalysis analysis, OutputStream out) {
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(out, toReport(analysis));
        } catch (IOException e) {
            throw new ChoraleException("Failed to write report", e);
        }
    }

    public void write(ProgressionAnalysis analysis, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, toReport(analysis));
            }
            log.info("Report for {} written to {}", analysis.tonality(), file);
        } catch (IOException e) {
            throw new ChoraleException("Failed to write report to " + file, e);
        }
    }

    public ProgressionReport read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return mapper.readValue(in, ProgressionReport.class);
        } catch (IOException e) {
            throw new ChoraleException("Failed to read report from " + file, e);
        }
    }
}
