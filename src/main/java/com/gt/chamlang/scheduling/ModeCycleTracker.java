package com.gt.chamlang.scheduling;

import com.gt.chamlang.model.PracticeMode;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Tracks which practice modes a word has been answered correctly in since its last cycle reset. A word only
 * advances once every mode in {@link #FULL_CYCLE} has been passed; any miss forfeits the partial cycle.
 */
public final class ModeCycleTracker {

    public static final Set<PracticeMode> FULL_CYCLE = Collections.unmodifiableSet(EnumSet.allOf(PracticeMode.class));

    private ModeCycleTracker() { }

    public static CycleTransition recordAnswer(Set<PracticeMode> completedModes, PracticeMode mode, boolean correct) {
        if (!correct) {
            boolean forfeited = completedModes != null && !completedModes.isEmpty();
            return new CycleTransition(Set.of(), false, forfeited);
        }

        EnumSet<PracticeMode> updatedModes = EnumSet.noneOf(PracticeMode.class);
        if (completedModes != null) {
            updatedModes.addAll(completedModes);
        }
        updatedModes.add(mode);

        if (isComplete(updatedModes)) {
            return new CycleTransition(Set.of(), true, false);
        }

        return new CycleTransition(Collections.unmodifiableSet(updatedModes), false, false);
    }

    public static boolean isComplete(Set<PracticeMode> completedModes) {
        return completedModes != null && completedModes.containsAll(FULL_CYCLE);
    }

    public static Set<PracticeMode> remainingModes(Set<PracticeMode> completedModes) {
        EnumSet<PracticeMode> remaining = EnumSet.allOf(PracticeMode.class);
        if (completedModes != null) {
            remaining.removeAll(completedModes);
        }

        return Collections.unmodifiableSet(remaining);
    }

    /**
     * @param completedModes modes to store on the word after the answer; empty once a cycle closes or is forfeited
     * @param cycleClosed true when this answer completed the last missing mode
     * @param forfeited true when an incorrect answer discarded a partially completed cycle
     */
    public record CycleTransition(Set<PracticeMode> completedModes, boolean cycleClosed, boolean forfeited) { }
}
