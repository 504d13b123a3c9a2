/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core;

import ai.evacortex.chorale.core.analysis.ChordAnalysis;
import ai.evacortex.chorale.core.analysis.ChordAnalysisCache;
import ai.evacortex.chorale.core.analysis.FunctionalClassifier;
import ai.evacortex.chorale.core.chord.ChordSnapshot;
import ai.evacortex.chorale.core.chord.Voice;
import ai.evacortex.chorale.core.exceptions.InvalidPitchException;
import ai.evacortex.chorale.core.key.KeyContext;
import ai.evacortex.chorale.core.key.Tonality;
import ai.evacortex.chorale.core.pitch.Pitch;
import ai.evacortex.chorale.core.pitch.PitchNotation;
import ai.evacortex.chorale.core.rules.ProgressionPair;
import ai.evacortex.chorale.core.rules.RuleOutcome;
import ai.evacortex.chorale.core.rules.RuleSet;
import ai.evacortex.chorale.core.rules.RuleViolation;
import ai.evacortex.chorale.core.rules.VoiceLeadingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Entry point: classifies every chord of a progression and validates the
 * voice leading between neighbours.
 *
 * <p>Beats with unreadable pitches, and empty beats, are reported as
 * {@link BeatIssue}s and left out; pairs touching them are skipped. Nothing
 * here aborts a whole progression.</p>
 *
 * <p>Thread-safe: the key and rule set are fixed per call, so concurrent
 * analyses in different keys share one analyzer safely.</p>
 */
public class HarmonyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(HarmonyAnalyzer.class);

    private final AnalyzerOptions options;
    private final ChordAnalysisCache cache;
    private final RuleSet rules;

    public HarmonyAnalyzer() {
        this(AnalyzerOptions.defaultOptions());
    }

    public HarmonyAnalyzer(AnalyzerOptions options) {
        this(options, RuleSet.defaultsWithout(options.disabledRules()));
    }

    public HarmonyAnalyzer(AnalyzerOptions options, RuleSet rules) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        this.cache = new ChordAnalysisCache(new FunctionalClassifier(), options.cacheSize());
    }

    public AnalyzerOptions options() {
        return options;
    }

    public RuleSet rules() {
        return rules;
    }

    /** Same analyzer with a different rule selection, sharing the analysis cache. */
    public HarmonyAnalyzer withRules(RuleSet newRules) {
        return new HarmonyAnalyzer(options, newRules, cache);
    }

    private HarmonyAnalyzer(AnalyzerOptions options, RuleSet rules, ChordAnalysisCache cache) {
        this.options = options;
        this.rules = rules;
        this.cache = cache;
    }

    public ChordAnalysis classify(ChordSnapshot snapshot, Tonality tonality) {
        return cache.get(tonality, snapshot);
    }

    public ProgressionAnalysis analyze(KeyContext key, List<ChordSnapshot> beats) {
        return analyze(key.snapshot(), beats);
    }

    public ProgressionAnalysis analyze(Tonality tonality, List<ChordSnapshot> beats) {
        Objects.requireNonNull(tonality, "tonality must not be null");
        Objects.requireNonNull(beats, "beats must not be null");
        List<BeatIssue> issues = new ArrayList<>();
        List<ChordSnapshot> snapshots = new ArrayList<>(beats);
        return run(tonality, snapshots, issues);
    }

    /**
     * Analyses beats given as voice-to-note-name maps. A beat with any
     * unreadable note is excluded.
     */
    public ProgressionAnalysis analyzeNotation(Tonality tonality, List<Map<Voice, String>> beats) {
        Objects.requireNonNull(tonality, "tonality must not be null");
        Objects.requireNonNull(beats, "beats must not be null");
        List<BeatIssue> issues = new ArrayList<>();
        List<ChordSnapshot> snapshots = new ArrayList<>(beats.size());
        for (int i = 0; i < beats.size(); i++) {
            snapshots.add(parseBeat(i, beats.get(i), issues));
        }
        return run(tonality, snapshots, issues);
    }

    private ChordSnapshot parseBeat(int beat, Map<Voice, String> raw, List<BeatIssue> issues) {
        if (raw == null) {
            return null;
        }
        Map<Voice, Pitch> pitches = new EnumMap<>(Voice.class);
        boolean valid = true;
        for (Map.Entry<Voice, String> e : raw.entrySet()) {
            String text = e.getValue();
            if (text == null || text.isBlank()) {
                continue;
            }
            try {
                pitches.put(e.getKey(), PitchNotation.parse(text));
            } catch (InvalidPitchException ex) {
                log.warn("Beat {} voice {} excluded: {}", beat, e.getKey(), ex.getMessage());
                issues.add(new BeatIssue(beat, e.getKey(), text, ex.getMessage()));
                valid = false;
            }
        }
        return valid ? new ChordSnapshot(pitches) : null;
    }

    private ProgressionAnalysis run(Tonality tonality, List<ChordSnapshot> snapshots, List<BeatIssue> issues) {
        SortedMap<Integer, ChordAnalysis> chords = new TreeMap<>();
        boolean[] invalid = new boolean[snapshots.size()];
        for (BeatIssue issue : issues) {
            invalid[issue.beat()] = true;
        }

        for (int i = 0; i < snapshots.size(); i++) {
            ChordSnapshot s = snapshots.get(i);
            if (invalid[i]) {
                continue;
            }
            if (s == null || s.isEmpty()) {
                issues.add(new BeatIssue(i, null, null, "no sounding voice"));
                continue;
            }
            chords.put(i, cache.get(tonality, s));
        }

        VoiceLeadingEngine engine = new VoiceLeadingEngine(tonality, rules);
        List<RuleViolation> violations = new ArrayList<>();
        List<RuleOutcome> failures = new ArrayList<>();
        for (int i = 0; i + 1 < snapshots.size(); i++) {
            ChordAnalysis first = chords.get(i);
            ChordAnalysis second = chords.get(i + 1);
            if (first == null || second == null) {
                continue;
            }
            for (RuleOutcome outcome : engine.evaluate(new ProgressionPair(first, second, i))) {
                if (outcome.isViolation()) {
                    violations.add(outcome.violation());
                } else if (outcome.status() == RuleOutcome.Status.FAILED) {
                    failures.add(outcome);
                }
            }
        }

        issues.sort((a, b) -> Integer.compare(a.beat(), b.beat()));
        log.debug("Analysed {} beats in {}: {} chords, {} violations, {} issues",
                snapshots.size(), tonality, chords.size(), violations.size(), issues.size());
        return new ProgressionAnalysis(tonality, snapshots.size(), chords, violations, issues, failures);
    }
}
