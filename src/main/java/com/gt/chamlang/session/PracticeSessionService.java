package com.gt.chamlang.session;

import com.gt.chamlang.exception.PracticeSessionNotFoundException;
import com.gt.chamlang.exception.ValidationException;
import com.gt.chamlang.model.*;
import com.gt.chamlang.progress.StatsAggregator;
import com.gt.chamlang.progress.UserPracticeProgressDao;
import com.gt.chamlang.progress.WordProgressDao;
import com.gt.chamlang.scheduling.ModeCycleTracker;
import com.gt.chamlang.scheduling.SchedulingAlgorithm;
import com.gt.chamlang.scheduling.SchedulingAlgorithmFactory;
import com.gt.chamlang.scheduling.SchedulingEngine;
import com.gt.chamlang.session.model.*;
import com.gt.chamlang.settings.LearningSettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class PracticeSessionService {

    private static final Logger log = LoggerFactory.getLogger(PracticeSessionService.class);

    private final SchedulingEngine schedulingEngine;
    private final SessionQueue sessionQueue;
    private final StatsAggregator statsAggregator;
    private final WordProgressDao wordProgressDao;
    private final UserPracticeProgressDao userPracticeProgressDao;
    private final PracticeSessionDao practiceSessionDao;
    private final LearningSettingsService learningSettingsService;
    private final Clock clock;
    private final Duration idleTimeout;

    private final Map<String, ActiveSession> activeSessions = new ConcurrentHashMap<>();

    @Autowired
    public PracticeSessionService(SchedulingEngine schedulingEngine,
                                  SessionQueue sessionQueue,
                                  StatsAggregator statsAggregator,
                                  WordProgressDao wordProgressDao,
                                  UserPracticeProgressDao userPracticeProgressDao,
                                  PracticeSessionDao practiceSessionDao,
                                  LearningSettingsService learningSettingsService,
                                  Clock clock,
                                  @Value("${chamlang.session.idleTimeoutMinutes:120}") int idleTimeoutMinutes) {
        this.schedulingEngine = schedulingEngine;
        this.sessionQueue = sessionQueue;
        this.statsAggregator = statsAggregator;
        this.wordProgressDao = wordProgressDao;
        this.userPracticeProgressDao = userPracticeProgressDao;
        this.practiceSessionDao = practiceSessionDao;
        this.learningSettingsService = learningSettingsService;
        this.clock = clock;
        this.idleTimeout = Duration.ofMinutes(Math.max(1, idleTimeoutMinutes));
    }

    /**
     * Starts a session over the supplied candidates, or over every stored word for the language when no candidates
     * are given. A null or blank mode starts a mixed-mode session.
     */
    public PracticeSessionView startSession(String language,
                                            String collectionId,
                                            String modeTag,
                                            String topic,
                                            String level,
                                            List<VocabularyCandidate> candidates,
                                            Integer limit) {
        validateLanguage(language);
        PracticeMode mode = modeTag == null || modeTag.isBlank() ? null : SchedulingEngine.toPracticeMode(modeTag);
        LearningSettings settings = learningSettingsService.getLearningSettings();
        Instant now = clock.instant();

        Map<String, WordProgress> storedProgress = toProgressMap(wordProgressDao.loadWordProgress(language));

        Map<String, String> words = new LinkedHashMap<>();
        if (candidates == null || candidates.isEmpty()) {
            storedProgress.values().forEach(wordProgress -> words.put(wordProgress.vocabularyId(), wordProgress.word()));
        } else {
            for (VocabularyCandidate candidate : candidates) {
                if (candidate == null || candidate.vocabularyId() == null || candidate.vocabularyId().isBlank()) {
                    log.warn("Skipping practice candidate without a vocabulary id");
                    continue;
                }

                WordProgress stored = storedProgress.get(candidate.vocabularyId());
                words.put(candidate.vocabularyId(), candidate.word() != null || stored == null ? candidate.word() : stored.word());
            }
        }

        Map<String, WordProgress> sessionProgress = new HashMap<>();
        List<String> newVocabularyIds = new ArrayList<>();
        for (String vocabularyId : words.keySet()) {
            WordProgress stored = storedProgress.get(vocabularyId);
            if (stored != null) {
                sessionProgress.put(vocabularyId, stored.withSessionStateCleared());
            } else {
                newVocabularyIds.add(vocabularyId);
            }
        }

        int queueLimit = limit != null && limit > 0 ? limit : settings.sessionLimit();
        List<String> queue = sessionQueue.buildQueue(sessionProgress.values(), newVocabularyIds, now, queueLimit,
                settings.newWordsPerSession(), mode, SessionContext.empty());

        ActiveSession activeSession = new ActiveSession(
                UUID.randomUUID().toString(),
                language,
                collectionId,
                mode,
                topic,
                level,
                now,
                settings,
                SchedulingAlgorithmFactory.create(settings.srAlgorithm(), settings.leitnerBoxCount()),
                storedProgress,
                sessionProgress,
                words,
                QueueState.start(queue));
        activeSessions.put(activeSession.id, activeSession);

        log.info("Started practice session {} for {} with {} queued words", activeSession.id, language, queue.size());

        synchronized (activeSession) {
            return toView(activeSession);
        }
    }

    public PracticeSessionView getSession(String sessionId) {
        ActiveSession activeSession = getActiveSession(sessionId);

        synchronized (activeSession) {
            checkOpen(activeSession);

            return toView(activeSession);
        }
    }

    /**
     * Schedules one answer and persists the updated word progress before the session queue moves on. When the store
     * rejects the write the session is left as it was.
     */
    public AnswerResult recordAnswer(String sessionId, String vocabularyId, String modeTag, boolean correct, int timeSpentSeconds) {
        ActiveSession activeSession = getActiveSession(sessionId);

        synchronized (activeSession) {
            checkOpen(activeSession);
            validateSessionWord(activeSession, vocabularyId);

            PracticeMode mode = modeTag == null || modeTag.isBlank() ? activeSession.mode : SchedulingEngine.toPracticeMode(modeTag);
            if (mode == null) {
                throw new ValidationException("Practice mode is required for a mixed-mode session");
            }

            Instant answeredAt = clock.instant();
            WordProgress current = activeSession.progress.get(vocabularyId);
            if (current == null) {
                current = schedulingEngine.createInitialWordProgress(vocabularyId, activeSession.words.get(vocabularyId), answeredAt);
            }

            AnswerOutcome answerOutcome = new AnswerOutcome(correct, mode, answeredAt);
            WordProgress updated = schedulingEngine.advance(current, answerOutcome, activeSession.schedulingAlgorithm);

            wordProgressDao.saveWordProgress(activeSession.language, updated);

            activeSession.lastTouched = answeredAt;
            activeSession.progress.put(vocabularyId, updated);
            activeSession.results.add(new PracticeResult(vocabularyId, updated.word(), correct, mode, Math.max(0, timeSpentSeconds)));
            activeSession.queueState = sessionQueue.onAnswer(activeSession.queueState, vocabularyId, answerOutcome,
                    activeSession.settings.showFailedWordsInSession());

            QueueState queueState = activeSession.queueState;
            return new AnswerResult(
                    updated,
                    ModeCycleTracker.remainingModes(updated.completedModesInCycle()),
                    queueState.next().orElse(null),
                    queueState.pending().size(),
                    queueState.deferred().contains(vocabularyId),
                    queueState.isExhausted());
        }
    }

    /**
     * Removes a word from the rest of the session without scheduling it. Its stored progress is not changed.
     */
    public PracticeSessionView skipWord(String sessionId, String vocabularyId) {
        ActiveSession activeSession = getActiveSession(sessionId);

        synchronized (activeSession) {
            checkOpen(activeSession);
            validateSessionWord(activeSession, vocabularyId);

            activeSession.queueState = sessionQueue.onSkip(activeSession.queueState, vocabularyId);
            activeSession.lastTouched = clock.instant();

            log.debug("Skipped {} in practice session {}", vocabularyId, sessionId);

            return toView(activeSession);
        }
    }

    /**
     * Records the session's statistics and history, then discards it. When the store rejects a write the session
     * stays active so the caller can complete it again.
     */
    public SessionSummary completeSession(String sessionId) {
        ActiveSession activeSession = getActiveSession(sessionId);

        synchronized (activeSession) {
            checkOpen(activeSession);

            PracticeSession practiceSession = PracticeSession.completed(activeSession.id, activeSession.collectionId,
                    activeSession.mode, activeSession.language, activeSession.topic, activeSession.level,
                    activeSession.results, activeSession.startedAt, clock.instant());

            if (practiceSession.results().isEmpty()) {
                close(activeSession);
                log.info("Practice session {} completed without answers, nothing recorded", sessionId);
                return new SessionSummary(practiceSession, 0, 0, null);
            }

            UserPracticeProgress practiceProgress = recordCompletedSession(activeSession.progressAtStart, practiceSession);
            close(activeSession);

            log.info("Completed practice session {}: {} of {} correct", sessionId, practiceSession.correctAnswers(),
                    practiceSession.totalQuestions());

            return new SessionSummary(practiceSession, practiceSession.totalQuestions(), 0, practiceProgress);
        }
    }

    public void abandonSession(String sessionId) {
        ActiveSession activeSession = getActiveSession(sessionId);

        synchronized (activeSession) {
            checkOpen(activeSession);
            close(activeSession);

            log.info("Abandoned practice session {} after {} answers", sessionId, activeSession.results.size());
        }
    }

    /**
     * Replays a session the client ran on its own. Each result is scheduled independently: an invalid result is
     * logged and counted as rejected without affecting the others, and statistics cover the accepted results only.
     */
    public SessionSummary submitSession(String language,
                                        String collectionId,
                                        String modeTag,
                                        String topic,
                                        String level,
                                        List<ClientPracticeResult> results,
                                        Instant startedAt,
                                        Instant completedAt) {
        validateLanguage(language);
        PracticeMode sessionMode = modeTag == null || modeTag.isBlank() ? null : SchedulingEngine.toPracticeMode(modeTag);
        List<ClientPracticeResult> clientResults = results == null ? List.of() : results;

        LearningSettings settings = learningSettingsService.getLearningSettings();
        SchedulingAlgorithm schedulingAlgorithm = SchedulingAlgorithmFactory.create(settings.srAlgorithm(), settings.leitnerBoxCount());
        Instant answeredAt = completedAt != null ? completedAt : clock.instant();

        Set<String> vocabularyIds = clientResults.stream()
                .filter(Objects::nonNull)
                .map(ClientPracticeResult::vocabularyId)
                .filter(vocabularyId -> vocabularyId != null && !vocabularyId.isBlank())
                .collect(Collectors.toSet());
        Map<String, WordProgress> progressAtStart = toProgressMap(wordProgressDao.loadWordProgressBatch(language, vocabularyIds));

        Map<String, WordProgress> working = new HashMap<>();
        progressAtStart.forEach((vocabularyId, wordProgress) -> working.put(vocabularyId, wordProgress.withSessionStateCleared()));

        Map<String, WordProgress> changed = new LinkedHashMap<>();
        List<PracticeResult> accepted = new ArrayList<>();
        int rejectedCnt = 0;

        for (ClientPracticeResult clientResult : clientResults) {
            if (clientResult == null) {
                rejectedCnt++;
                continue;
            }

            try {
                boolean modeMissing = clientResult.mode() == null || clientResult.mode().isBlank();
                PracticeMode mode = modeMissing && sessionMode != null
                        ? sessionMode
                        : SchedulingEngine.toPracticeMode(clientResult.mode());

                WordProgress current = working.get(clientResult.vocabularyId());
                if (current == null) {
                    current = schedulingEngine.createInitialWordProgress(clientResult.vocabularyId(), clientResult.word(), answeredAt);
                }

                WordProgress updated = schedulingEngine.advance(current, new AnswerOutcome(clientResult.correct(), mode, answeredAt), schedulingAlgorithm);

                working.put(updated.vocabularyId(), updated);
                changed.put(updated.vocabularyId(), updated);
                accepted.add(new PracticeResult(updated.vocabularyId(), updated.word(), clientResult.correct(), mode,
                        Math.max(0, clientResult.timeSpentSeconds())));
            } catch (ValidationException ex) {
                log.warn("Rejected practice result for '{}': {}", clientResult.vocabularyId(), ex.getMessage());
                rejectedCnt++;
            }
        }

        wordProgressDao.saveWordProgressBatch(language, changed.values());

        PracticeSession practiceSession = PracticeSession.completed(UUID.randomUUID().toString(), collectionId, sessionMode,
                language, topic, level, accepted, startedAt != null ? startedAt : answeredAt, answeredAt);

        if (accepted.isEmpty()) {
            log.warn("Submitted session for {} had no valid results, {} rejected", language, rejectedCnt);
            return new SessionSummary(practiceSession, 0, rejectedCnt, null);
        }

        UserPracticeProgress practiceProgress = recordCompletedSession(progressAtStart, practiceSession);

        log.info("Submitted practice session {} for {}: {} results scheduled, {} rejected", practiceSession.id(), language,
                accepted.size(), rejectedCnt);

        return new SessionSummary(practiceSession, accepted.size(), rejectedCnt, practiceProgress);
    }

    /**
     * Discards sessions that have not been touched within the idle timeout. Progress saved by their answers stays.
     */
    public int evictIdleSessions() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int evictedCnt = 0;

        for (ActiveSession activeSession : activeSessions.values()) {
            synchronized (activeSession) {
                if (!activeSession.closed && activeSession.lastTouched.isBefore(cutoff)) {
                    close(activeSession);
                    evictedCnt++;

                    log.info("Evicted idle practice session {} after {} answers", activeSession.id, activeSession.results.size());
                }
            }
        }

        return evictedCnt;
    }

    public List<PracticeSession> getRecentSessions(String language, int maxSessionCnt) {
        validateLanguage(language);

        return practiceSessionDao.loadRecentSessions(language, Math.max(1, maxSessionCnt));
    }

    private UserPracticeProgress recordCompletedSession(Map<String, WordProgress> progressAtStart, PracticeSession practiceSession) {
        String language = practiceSession.language();
        UserPracticeProgress aggregate = userPracticeProgressDao.loadPracticeProgress(language)
                .orElse(UserPracticeProgress.empty(language))
                .withWordsProgress(progressAtStart);

        UserPracticeProgress updated = statsAggregator.applySession(aggregate, practiceSession, today());

        // Session history goes first; saving it again under the same id is a no-op
        practiceSessionDao.saveSession(practiceSession);
        userPracticeProgressDao.savePracticeProgress(updated);

        return updated.withWordsProgress(Map.of());
    }

    ActiveSession getActiveSession(String sessionId) {
        ActiveSession activeSession = sessionId == null ? null : activeSessions.get(sessionId);
        if (activeSession == null) {
            throw new PracticeSessionNotFoundException(sessionId);
        }

        return activeSession;
    }

    // Caller holds the session lock
    private void close(ActiveSession activeSession) {
        activeSession.closed = true;
        activeSessions.remove(activeSession.id, activeSession);
    }

    private static void checkOpen(ActiveSession activeSession) {
        if (activeSession.closed) {
            throw new PracticeSessionNotFoundException(activeSession.id);
        }
    }

    private static void validateSessionWord(ActiveSession activeSession, String vocabularyId) {
        if (vocabularyId == null || vocabularyId.isBlank()) {
            throw new ValidationException("Vocabulary id is required");
        }
        if (!activeSession.words.containsKey(vocabularyId)) {
            throw new ValidationException("Word " + vocabularyId + " is not part of session " + activeSession.id);
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), clock.getZone());
    }

    private static PracticeSessionView toView(ActiveSession activeSession) {
        return new PracticeSessionView(
                activeSession.id,
                activeSession.language,
                activeSession.collectionId,
                activeSession.mode,
                activeSession.queueState.pending(),
                activeSession.queueState.deferred().stream().sorted().toList(),
                activeSession.results.size(),
                activeSession.startedAt);
    }

    private static Map<String, WordProgress> toProgressMap(List<WordProgress> wordProgress) {
        return wordProgress.stream().collect(Collectors.toMap(WordProgress::vocabularyId, Function.identity(), (first, second) -> second));
    }

    private static void validateLanguage(String language) {
        if (language == null || language.isBlank()) {
            throw new ValidationException("Language is required");
        }
    }
}
