package com.gt.chamlang.session;

import com.gt.chamlang.session.model.SessionWordState;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-session failure and retry bookkeeping, keyed by vocabulary id. Created empty when a session starts and never
 * written to the store.
 */
public final class SessionContext {

    private static final SessionContext EMPTY = new SessionContext(Map.of());

    private final Map<String, SessionWordState> wordStates;

    private SessionContext(Map<String, SessionWordState> wordStates) {
        this.wordStates = wordStates;
    }

    public static SessionContext empty() {
        return EMPTY;
    }

    public SessionContext recordCorrect(String vocabularyId) {
        SessionWordState current = getWordState(vocabularyId);
        return with(vocabularyId, new SessionWordState(current.retryCount(), current.failedInSession(), true));
    }

    public SessionContext recordMiss(String vocabularyId) {
        SessionWordState current = getWordState(vocabularyId);
        return with(vocabularyId, new SessionWordState(current.retryCount() + 1, true, false));
    }

    public SessionWordState getWordState(String vocabularyId) {
        return wordStates.getOrDefault(vocabularyId, SessionWordState.UNTOUCHED);
    }

    public boolean isFailed(String vocabularyId) {
        return getWordState(vocabularyId).failedInSession();
    }

    public int retryCount(String vocabularyId) {
        return getWordState(vocabularyId).retryCount();
    }

    public boolean answeredCorrectly(String vocabularyId) {
        return getWordState(vocabularyId).answeredCorrectly();
    }

    private SessionContext with(String vocabularyId, SessionWordState wordState) {
        Map<String, SessionWordState> updated = new HashMap<>(wordStates);
        updated.put(vocabularyId, wordState);

        return new SessionContext(Map.copyOf(updated));
    }
}
