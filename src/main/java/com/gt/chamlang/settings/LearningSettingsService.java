package com.gt.chamlang.settings;

import com.gt.chamlang.conf.CachingConfig;
import com.gt.chamlang.exception.ValidationException;
import com.gt.chamlang.model.LearningSettings;
import com.gt.chamlang.model.SrAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
public class LearningSettingsService {

    private static final Logger log = LoggerFactory.getLogger(LearningSettingsService.class);

    static final String SR_ALGORITHM = "srAlgorithm";
    static final String LEITNER_BOX_COUNT = "leitnerBoxCount";
    static final String NEW_WORDS_PER_SESSION = "newWordsPerSession";
    static final String SESSION_LIMIT = "sessionLimit";
    static final String SHOW_FAILED_WORDS_IN_SESSION = "showFailedWordsInSession";

    private final LearningSettingsDao learningSettingsDao;
    private final LearningSettings defaultSettings;

    @Autowired
    public LearningSettingsService(LearningSettingsDao learningSettingsDao,
                                   @Value("${chamlang.learning.defaultAlgorithm:sm2}") String defaultAlgorithm,
                                   @Value("${chamlang.learning.defaultLeitnerBoxCount:5}") int defaultLeitnerBoxCount,
                                   @Value("${chamlang.learning.defaultNewWordsPerSession:20}") int defaultNewWordsPerSession,
                                   @Value("${chamlang.learning.defaultSessionLimit:100}") int defaultSessionLimit,
                                   @Value("${chamlang.learning.defaultShowFailedWordsInSession:true}") boolean defaultShowFailedWordsInSession) {
        this.learningSettingsDao = learningSettingsDao;

        SrAlgorithm srAlgorithm = SrAlgorithm.fromTag(defaultAlgorithm);
        if (srAlgorithm == null) {
            log.warn("Configured default algorithm '{}' is not recognized, using {}", defaultAlgorithm, SrAlgorithm.Sm2.getTag());
            srAlgorithm = SrAlgorithm.Sm2;
        }
        int leitnerBoxCount = defaultLeitnerBoxCount;
        if (!LearningSettings.ALLOWED_BOX_COUNTS.contains(leitnerBoxCount)) {
            log.warn("Configured default box count {} is not supported, using 5", defaultLeitnerBoxCount);
            leitnerBoxCount = 5;
        }

        this.defaultSettings = new LearningSettings(srAlgorithm, leitnerBoxCount, Math.max(0, defaultNewWordsPerSession),
                Math.max(1, defaultSessionLimit), defaultShowFailedWordsInSession);
    }

    @Cacheable(CachingConfig.LEARNING_SETTINGS)
    public LearningSettings getLearningSettings() {
        return parseSettings(learningSettingsDao.getSettings());
    }

    public LearningSettings getDefaultSettings() {
        return defaultSettings;
    }

    @CacheEvict(value = CachingConfig.LEARNING_SETTINGS, allEntries = true)
    public LearningSettings saveLearningSettings(String srAlgorithm,
                                                 Integer leitnerBoxCount,
                                                 Integer newWordsPerSession,
                                                 Integer sessionLimit,
                                                 Boolean showFailedWordsInSession) {
        LearningSettings current = parseSettings(learningSettingsDao.getSettings());

        SrAlgorithm newAlgorithm = current.srAlgorithm();
        if (srAlgorithm != null) {
            newAlgorithm = SrAlgorithm.fromTag(srAlgorithm);
            if (newAlgorithm == null) {
                throw new ValidationException("Unrecognized spaced repetition algorithm: " + srAlgorithm);
            }
        }
        if (leitnerBoxCount != null && !LearningSettings.ALLOWED_BOX_COUNTS.contains(leitnerBoxCount)) {
            throw new ValidationException("Leitner box count must be 3, 5 or 7, was " + leitnerBoxCount);
        }
        if (newWordsPerSession != null && newWordsPerSession < 0) {
            throw new ValidationException("New words per session cannot be negative");
        }
        if (sessionLimit != null && sessionLimit < 1) {
            throw new ValidationException("Session limit must be at least 1");
        }

        LearningSettings updated = new LearningSettings(
                newAlgorithm,
                leitnerBoxCount != null ? leitnerBoxCount : current.leitnerBoxCount(),
                newWordsPerSession != null ? newWordsPerSession : current.newWordsPerSession(),
                sessionLimit != null ? sessionLimit : current.sessionLimit(),
                showFailedWordsInSession != null ? showFailedWordsInSession : current.showFailedWordsInSession());

        learningSettingsDao.saveSettings(toSettingsMap(updated));
        log.info("Saved learning settings {}", updated);

        return updated;
    }

    LearningSettings parseSettings(Map<String, String> storedSettings) {
        SrAlgorithm srAlgorithm = defaultSettings.srAlgorithm();
        if (storedSettings.containsKey(SR_ALGORITHM)) {
            SrAlgorithm parsed = SrAlgorithm.fromTag(storedSettings.get(SR_ALGORITHM));
            if (parsed != null) {
                srAlgorithm = parsed;
            } else {
                log.warn("Ignoring stored algorithm '{}'", storedSettings.get(SR_ALGORITHM));
            }
        }

        int leitnerBoxCount = parseInt(storedSettings, LEITNER_BOX_COUNT, defaultSettings.leitnerBoxCount());
        if (!LearningSettings.ALLOWED_BOX_COUNTS.contains(leitnerBoxCount)) {
            log.warn("Ignoring stored box count {}", leitnerBoxCount);
            leitnerBoxCount = defaultSettings.leitnerBoxCount();
        }

        int newWordsPerSession = parseInt(storedSettings, NEW_WORDS_PER_SESSION, defaultSettings.newWordsPerSession());
        int sessionLimit = parseInt(storedSettings, SESSION_LIMIT, defaultSettings.sessionLimit());

        boolean showFailedWordsInSession = storedSettings.containsKey(SHOW_FAILED_WORDS_IN_SESSION)
                ? Boolean.parseBoolean(storedSettings.get(SHOW_FAILED_WORDS_IN_SESSION).trim())
                : defaultSettings.showFailedWordsInSession();

        return new LearningSettings(srAlgorithm, leitnerBoxCount, Math.max(0, newWordsPerSession), Math.max(1, sessionLimit),
                showFailedWordsInSession);
    }

    private static int parseInt(Map<String, String> storedSettings, String settingName, int defaultValue) {
        String value = storedSettings.get(settingName);
        if (value == null) {
            return defaultValue;
        }

        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            log.warn("Ignoring stored value '{}' for {}", value, settingName);
            return defaultValue;
        }
    }

    private static Map<String, String> toSettingsMap(LearningSettings learningSettings) {
        Map<String, String> settings = new HashMap<>();
        settings.put(SR_ALGORITHM, learningSettings.srAlgorithm().getTag());
        settings.put(LEITNER_BOX_COUNT, Integer.toString(learningSettings.leitnerBoxCount()));
        settings.put(NEW_WORDS_PER_SESSION, Integer.toString(learningSettings.newWordsPerSession()));
        settings.put(SESSION_LIMIT, Integer.toString(learningSettings.sessionLimit()));
        settings.put(SHOW_FAILED_WORDS_IN_SESSION, Boolean.toString(learningSettings.showFailedWordsInSession()));

        return settings;
    }
}
