package com.gt.chamlang.settings;

import com.gt.chamlang.model.LearningSettings;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/rest/settings")
public class LearningSettingsController {

    private final LearningSettingsService learningSettingsService;

    public LearningSettingsController(LearningSettingsService learningSettingsService) {
        this.learningSettingsService = learningSettingsService;
    }

    @GetMapping(value = "/learning", produces = "application/json")
    public LearningSettings getLearningSettings() {
        return learningSettingsService.getLearningSettings();
    }

    @PostMapping(value = "/learning", consumes = "application/json", produces = "application/json")
    public LearningSettings saveLearningSettings(@RequestBody SaveLearningSettingsRequest request) {
        return learningSettingsService.saveLearningSettings(
                request.srAlgorithm(),
                request.leitnerBoxCount(),
                request.newWordsPerSession(),
                request.sessionLimit(),
                request.showFailedWordsInSession());
    }

    private record SaveLearningSettingsRequest(String srAlgorithm,
                                               Integer leitnerBoxCount,
                                               Integer newWordsPerSession,
                                               Integer sessionLimit,
                                               Boolean showFailedWordsInSession) { }
}
