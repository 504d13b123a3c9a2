/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

/**
 * Named exceptions a rule may register. Each constant is evaluated by
 * {@link ExceptionEvaluator}; rules list them in the order they are tried.
 */
public enum ExceptionPredicate {
    VOICING_CHANGE("Allowed when the same chord is only revoiced"),
    V_VII_PAIR("Allowed between dominant and leading-tone chords"),
    SECOND_FIFTH_DIMINISHED("Allowed when the second fifth is diminished"),
    OUTER_FIFTH_APPROACH("Outer voices: soprano by step, bass by a third to a fifth"),
    OUTER_OCTAVE_APPROACH("Outer voices: soprano up a semitone, bass up a fourth"),
    STEP_AGAINST_LEAP("One voice moves by step while the other leaps"),
    BASS_SOPRANO_TENTHS("Bass and soprano move in parallel tenths"),
    RESOLUTION_NOT_EXPECTED("The next chord is neither tonic nor submediant"),
    DECEPTIVE_BASS_TO_ROOT("Bass leading tone moves to the root of vi"),
    INDIRECT_RESOLUTION("Inner voice falls to the fifth under a held root");

    private final String description;

    ExceptionPredicate(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
