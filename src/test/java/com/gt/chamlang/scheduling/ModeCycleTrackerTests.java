package com.gt.chamlang.scheduling;

import com.gt.chamlang.model.PracticeMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class ModeCycleTrackerTests {

    @Test
    public void testRecordAnswer_CorrectAddsMode() {
        ModeCycleTracker.CycleTransition transition = ModeCycleTracker.recordAnswer(Set.of(), PracticeMode.FillWord, true);

        assertEquals(Set.of(PracticeMode.FillWord), transition.completedModes());
        assertFalse(transition.cycleClosed());
        assertFalse(transition.forfeited());
    }

    @Test
    public void testRecordAnswer_LastModeClosesCycle() {
        ModeCycleTracker.CycleTransition transition = ModeCycleTracker.recordAnswer(
                Set.of(PracticeMode.Flashcard, PracticeMode.MultipleChoice), PracticeMode.FillWord, true);

        assertTrue(transition.cycleClosed());
        assertTrue(transition.completedModes().isEmpty());
    }

    @Test
    public void testRecordAnswer_IncorrectForfeitsPartialCycle() {
        ModeCycleTracker.CycleTransition transition = ModeCycleTracker.recordAnswer(
                Set.of(PracticeMode.Flashcard, PracticeMode.MultipleChoice), PracticeMode.FillWord, false);

        assertFalse(transition.cycleClosed());
        assertTrue(transition.forfeited());
        assertTrue(transition.completedModes().isEmpty());

        assertFalse(ModeCycleTracker.recordAnswer(Set.of(), PracticeMode.Flashcard, false).forfeited());
    }

    @Test
    public void testRecordAnswer_NullModesTreatedAsEmpty() {
        ModeCycleTracker.CycleTransition transition = ModeCycleTracker.recordAnswer(null, PracticeMode.Flashcard, true);

        assertEquals(Set.of(PracticeMode.Flashcard), transition.completedModes());
    }

    @Test
    public void testRemainingModes() {
        assertEquals(Set.of(PracticeMode.FillWord, PracticeMode.MultipleChoice),
                ModeCycleTracker.remainingModes(Set.of(PracticeMode.Flashcard)));
        assertEquals(ModeCycleTracker.FULL_CYCLE, ModeCycleTracker.remainingModes(null));
        assertTrue(ModeCycleTracker.isComplete(Set.of(PracticeMode.values())));
        assertFalse(ModeCycleTracker.isComplete(Set.of(PracticeMode.Flashcard)));
    }
}
