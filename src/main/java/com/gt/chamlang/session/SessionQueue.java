package com.gt.chamlang.session;

import com.gt.chamlang.model.AnswerOutcome;
import com.gt.chamlang.model.PracticeMode;
import com.gt.chamlang.model.WordProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Selects and orders the words for a practice session and requeues missed words while the session runs.
 */
@Component
public class SessionQueue {

    private static final Logger log = LoggerFactory.getLogger(SessionQueue.class);

    static final int MAX_QUEUE_SIZE = 999;

    private final int retrySpacingFactor;
    private final int maxRetriesPerSession;
    private final int reviewsPerNewWord;

    @Autowired
    public SessionQueue(@Value("${chamlang.session.retrySpacingFactor:2}") int retrySpacingFactor,
                        @Value("${chamlang.session.maxRetriesPerSession:3}") int maxRetriesPerSession,
                        @Value("${chamlang.session.reviewsPerNewWord:3}") int reviewsPerNewWord) {
        this.retrySpacingFactor = Math.max(1, retrySpacingFactor);
        this.maxRetriesPerSession = Math.max(1, maxRetriesPerSession);
        this.reviewsPerNewWord = reviewsPerNewWord;
    }

    public List<String> buildQueue(Collection<WordProgress> allProgress, Instant now, int limit) {
        return buildQueue(allProgress, List.of(), now, limit, Integer.MAX_VALUE, null, SessionContext.empty());
    }

    public List<String> buildQueue(Collection<WordProgress> allProgress,
                                   Collection<String> newVocabularyIds,
                                   Instant now,
                                   int limit,
                                   int newWordCap,
                                   PracticeMode sessionMode,
                                   SessionContext context) {
        int queueLimit = limit <= 0 ? MAX_QUEUE_SIZE : Math.min(limit, MAX_QUEUE_SIZE);
        SessionContext sessionContext = context == null ? SessionContext.empty() : context;

        Set<String> knownIds = new HashSet<>();
        List<WordProgress> reviews = new ArrayList<>();
        SortedSet<String> newWords = new TreeSet<>();

        for (WordProgress wordProgress : allProgress) {
            if (wordProgress == null || wordProgress.vocabularyId() == null || !knownIds.add(wordProgress.vocabularyId())) {
                continue;
            }

            if (wordProgress.isNew()) {
                newWords.add(wordProgress.vocabularyId());
            } else if (isEligibleReview(wordProgress, now, sessionMode, sessionContext)) {
                reviews.add(wordProgress);
            }
        }

        if (newVocabularyIds != null) {
            for (String vocabularyId : newVocabularyIds) {
                if (vocabularyId != null && !vocabularyId.isBlank() && !knownIds.contains(vocabularyId)) {
                    newWords.add(vocabularyId);
                }
            }
        }

        reviews.sort(Comparator.comparing((WordProgress wordProgress) -> dueInstant(wordProgress))
                .thenComparing(WordProgress::vocabularyId));

        List<String> reviewIds = reviews.stream()
                .map(WordProgress::vocabularyId)
                .limit(queueLimit)
                .toList();

        int newWordCount = Math.max(0, Math.min(newWordCap, queueLimit - reviewIds.size()));
        List<String> newWordIds = newWords.stream()
                .filter(vocabularyId -> !sessionContext.answeredCorrectly(vocabularyId))
                .limit(newWordCount)
                .toList();

        List<String> queue = interleave(reviewIds, newWordIds);

        log.debug("Built practice queue of {} words ({} reviews, {} new)", queue.size(), reviewIds.size(), newWordIds.size());

        return queue;
    }

    public QueueState onAnswer(QueueState queueState, String vocabularyId, AnswerOutcome answerOutcome) {
        return onAnswer(queueState, vocabularyId, answerOutcome, true);
    }

    public QueueState onAnswer(QueueState queueState, String vocabularyId, AnswerOutcome answerOutcome, boolean requeueMissed) {
        List<String> pending = new ArrayList<>(queueState.pending());
        pending.remove(vocabularyId);

        if (answerOutcome.correct()) {
            return new QueueState(pending, queueState.context().recordCorrect(vocabularyId), queueState.deferred());
        }

        SessionContext context = queueState.context().recordMiss(vocabularyId);
        if (!requeueMissed) {
            return new QueueState(pending, context, queueState.deferred());
        }

        int retryCount = context.retryCount(vocabularyId);
        if (retryCount >= maxRetriesPerSession) {
            log.debug("{} reached the retry cap of {} and is deferred to its next review date", vocabularyId, maxRetriesPerSession);

            Set<String> deferred = new HashSet<>(queueState.deferred());
            deferred.add(vocabularyId);
            return new QueueState(pending, context, deferred);
        }

        int position = Math.min(retryCount * retrySpacingFactor, pending.size());
        pending.add(position, vocabularyId);

        return new QueueState(pending, context, queueState.deferred());
    }

    // Drops the word from the pending queue without recording an answer; its session state is left as it was.
    public QueueState onSkip(QueueState queueState, String vocabularyId) {
        List<String> pending = new ArrayList<>(queueState.pending());
        pending.removeIf(pendingId -> pendingId.equals(vocabularyId));

        return new QueueState(pending, queueState.context(), queueState.deferred());
    }

    public boolean isRetryCapReached(SessionContext context, String vocabularyId) {
        return context.retryCount(vocabularyId) >= maxRetriesPerSession;
    }

    private boolean isEligibleReview(WordProgress wordProgress, Instant now, PracticeMode sessionMode, SessionContext context) {
        String vocabularyId = wordProgress.vocabularyId();

        if (context.answeredCorrectly(vocabularyId) || isRetryCapReached(context, vocabularyId)) {
            return false;
        }
        if (sessionMode != null && wordProgress.completedModesInCycle().contains(sessionMode)) {
            return false;
        }

        return context.isFailed(vocabularyId) || wordProgress.isDue(now);
    }

    private List<String> interleave(List<String> reviewIds, List<String> newWordIds) {
        List<String> queue = new ArrayList<>(reviewIds.size() + newWordIds.size());

        int newWordIndex = 0;
        for (int reviewIndex = 0; reviewIndex < reviewIds.size(); reviewIndex++) {
            queue.add(reviewIds.get(reviewIndex));

            if (reviewsPerNewWord > 0 && (reviewIndex + 1) % reviewsPerNewWord == 0 && newWordIndex < newWordIds.size()) {
                queue.add(newWordIds.get(newWordIndex++));
            }
        }

        while (newWordIndex < newWordIds.size()) {
            queue.add(newWordIds.get(newWordIndex++));
        }

        return queue;
    }

    private static Instant dueInstant(WordProgress wordProgress) {
        return wordProgress.nextReviewDate() == null ? Instant.EPOCH : wordProgress.nextReviewDate();
    }
}
