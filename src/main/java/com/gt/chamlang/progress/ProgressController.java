package com.gt.chamlang.progress;

import com.gt.chamlang.model.PracticeMode;
import com.gt.chamlang.model.UserPracticeProgress;
import com.gt.chamlang.model.WordProgress;
import com.gt.chamlang.progress.model.LearningStats;
import com.gt.chamlang.progress.model.WordProgressView;
import com.gt.chamlang.scheduling.SchedulingEngine;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/rest/progress")
public class ProgressController {

    private final ProgressService progressService;

    public ProgressController(ProgressService progressService) {
        this.progressService = progressService;
    }

    @GetMapping(value = "/practiceProgress", produces = "application/json")
    public UserPracticeProgress getPracticeProgress(@RequestParam(value = "language") String language) {
        return progressService.getPracticeProgress(language);
    }

    @PostMapping(value = "/wordProgress", consumes = "application/json", produces = "application/json")
    public List<WordProgressView> getWordProgress(@RequestBody WordProgressRequest request) {
        return progressService.getWordProgress(request.language(), request.vocabularyIds());
    }

    @PostMapping(value = "/saveWordProgress", consumes = "application/json", produces = "application/json")
    public WordProgressView saveWordProgress(@RequestBody UpdateProgressRequest request) {
        Set<PracticeMode> completedModes = request.completedModesInCycle() == null
                ? Set.of()
                : request.completedModesInCycle().stream().map(SchedulingEngine::toPracticeMode).collect(Collectors.toSet());

        WordProgress wordProgress = WordProgress.builder()
                .vocabularyId(request.vocabularyId())
                .word(request.word())
                .correctCount(request.correctCount())
                .incorrectCount(request.incorrectCount())
                .lastPracticed(request.lastPracticed())
                .nextReviewDate(request.nextReviewDate())
                .intervalDays(request.intervalDays())
                .lastIntervalDays(request.lastIntervalDays())
                .easinessFactor(request.easinessFactor())
                .consecutiveCorrectCount(request.consecutiveCorrectCount())
                .leitnerBox(request.leitnerBox())
                .totalReviews(request.totalReviews())
                .completedModesInCycle(completedModes)
                .build();

        return progressService.saveWordProgress(request.language(), wordProgress);
    }

    @GetMapping(value = "/learningStats", produces = "application/json")
    public LearningStats getLearningStats(@RequestParam(value = "language") String language) {
        return progressService.getLearningStats(language);
    }

    @GetMapping(value = "/dueSummary", produces = "application/json")
    public DueSummary getDueSummary(@RequestParam(value = "language") String language) {
        return new DueSummary(progressService.getDueCount(language), progressService.getNextDueDate(language).orElse(null));
    }

    private record WordProgressRequest(String language, List<String> vocabularyIds) { }
    private record UpdateProgressRequest(String language,
                                         String vocabularyId,
                                         String word,
                                         List<String> completedModesInCycle,
                                         Instant lastPracticed,
                                         Instant nextReviewDate,
                                         int intervalDays,
                                         int lastIntervalDays,
                                         double easinessFactor,
                                         int consecutiveCorrectCount,
                                         int leitnerBox,
                                         int totalReviews,
                                         int correctCount,
                                         int incorrectCount) { }
    private record DueSummary(int dueCount, Instant nextDueDate) { }
}
