/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.analysis;

import ai.evacortex.chorale.core.chord.ChordSnapshot;
import ai.evacortex.chorale.core.key.Tonality;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Objects;

/**
 * Memoizes classifier results per (tonality, snapshot). Both key parts are
 * immutable values, so a cached analysis is valid for as long as it lives.
 */
public class ChordAnalysisCache {

    private record Key(Tonality tonality, ChordSnapshot snapshot) {}

    private final FunctionalClassifier classifier;
    private final Cache<Key, ChordAnalysis> cache;

    public ChordAnalysisCache(FunctionalClassifier classifier, long maximumSize) {
        if (maximumSize < 0) {
            throw new IllegalArgumentException("maximumSize must be >= 0: " + maximumSize);
        }
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    public ChordAnalysis get(Tonality tonality, ChordSnapshot snapshot) {
        Objects.requireNonNull(tonality, "tonality must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        return cache.get(new Key(tonality, snapshot), k -> classifier.classify(k.snapshot(), k.tonality()));
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
