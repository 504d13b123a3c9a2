/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.chord;

import ai.evacortex.chorale.core.pitch.Interval;
import ai.evacortex.chorale.core.pitch.Pitch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Root and quality inference over the {@link ChordQuality} templates.
 *
 * <p>Each sounding pitch class is tried as a root, in bass-to-soprano order,
 * and its root-relative interval set is compared against every template.
 * Three passes are made, each stricter reading winning over the next:</p>
 * <ol>
 *   <li>exact match;</li>
 *   <li>exact match once minor/major ninths are set aside;</li>
 *   <li>match with the perfect fifth omitted.</li>
 * </ol>
 * Within a pass the template with more members wins, then the earlier
 * template, then the earlier candidate. Symmetric templates (diminished
 * seventh, augmented triad) fit several candidates; a caller-supplied
 * preference puts one of them first.
 */
public final class ChordSpeller {

    private static final Logger log = LoggerFactory.getLogger(ChordSpeller.class);

    private static final int NINTH_MASK = (1 << 1) | (1 << 2);
    private static final IntPredicate NO_PREFERENCE = pc -> false;

    private ChordSpeller() {}

    public static ChordStructure spell(ChordSnapshot snapshot) {
        return spell(snapshot, NO_PREFERENCE);
    }

    /**
     * @param preferredRoot pitch classes to try first as root
     * @throws IllegalArgumentException if no voice is sounding
     */
    public static ChordStructure spell(ChordSnapshot snapshot, IntPredicate preferredRoot) {
        if (snapshot == null) {
            throw new NullPointerException("snapshot must not be null");
        }
        if (snapshot.isEmpty()) {
            throw new IllegalArgumentException("Cannot spell an empty chord");
        }

        List<Integer> candidates = orderCandidates(snapshot.pitchClassesBottomUp(), preferredRoot);

        Match match = bestMatch(candidates, false, false);
        if (match == null) {
            match = bestMatch(candidates, true, false);
        }
        if (match == null) {
            match = bestMatch(candidates, false, true);
        }

        if (match == null) {
            Pitch fallback = snapshot.has(Voice.BASS) ? snapshot.pitch(Voice.BASS) : snapshot.lowest();
            log.debug("No template fits {}, falling back to {} as root", snapshot, fallback);
            return build(snapshot, fallback.pitchClass(), ChordQuality.UNKNOWN);
        }
        return build(snapshot, match.root, match.quality);
    }

    private static List<Integer> orderCandidates(List<Integer> pcs, IntPredicate preferred) {
        List<Integer> first = new ArrayList<>();
        List<Integer> rest = new ArrayList<>();
        for (int pc : pcs) {
            (preferred.test(pc) ? first : rest).add(pc);
        }
        first.addAll(rest);
        return first;
    }

    private record Match(int root, ChordQuality quality) {}

    private static Match bestMatch(List<Integer> candidates, boolean dropNinths, boolean omitFifth) {
        Match best = null;
        for (ChordQuality q : ChordQuality.values()) {
            if (q == ChordQuality.UNKNOWN) {
                continue;
            }
            if (best != null && q.size() <= best.quality.size()) {
                continue;
            }
            for (int root : candidates) {
                int rel = relativeMask(candidates, root);
                if (matches(rel, q, dropNinths, omitFifth)) {
                    best = new Match(root, q);
                    break;
                }
            }
        }
        return best;
    }

    private static boolean matches(int rel, ChordQuality q, boolean dropNinths, boolean omitFifth) {
        if (dropNinths) {
            int stripped = rel & ~NINTH_MASK;
            return stripped != rel && Integer.bitCount(stripped) >= 3 && stripped == q.mask();
        }
        if (omitFifth) {
            if (q.fifthInterval() != 7 || (rel & (1 << 7)) != 0) {
                return false;
            }
            return Integer.bitCount(rel) >= 2 && rel == (q.mask() & ~(1 << 7));
        }
        return rel == q.mask();
    }

    private static int relativeMask(List<Integer> pcs, int root) {
        int m = 0;
        for (int pc : pcs) {
            m |= 1 << Math.floorMod(pc - root, 12);
        }
        return m;
    }

    private static ChordStructure build(ChordSnapshot snapshot, int rootPc, ChordQuality quality) {
        Map<Voice, ChordFactor> factors = new EnumMap<>(Voice.class);
        Pitch rootPitch = null;
        for (Voice v : snapshot.soundingBottomUp()) {
            Pitch p = snapshot.pitch(v);
            int rel = Math.floorMod(p.pitchClass() - rootPc, 12);
            factors.put(v, quality.factorOf(rel));
            if (rel == 0 && (rootPitch == null || p.compareTo(rootPitch) < 0)) {
                rootPitch = p;
            }
        }

        int inversion = 0;
        ChordFactor bassFactor = factors.get(Voice.BASS);
        if (bassFactor != null) {
            inversion = bassFactor.inversionInBass();
        }

        boolean ninth = false;
        for (Pitch p : snapshot.voices().values()) {
            int above = Interval.semitones(rootPitch, p);
            if (above == 13 || above == 14) {
                ninth = true;
                break;
            }
        }
        return new ChordStructure(rootPc, rootPitch, quality, factors, inversion, ninth);
    }
}
