package com.gt.chamlang.session.model;

import com.gt.chamlang.model.PracticeSession;
import com.gt.chamlang.model.UserPracticeProgress;

/**
 * Outcome of finishing a session. Results rejected during replay of a client-run session were not scheduled and are
 * absent from the saved session. {@code practiceProgress} is null when nothing was recorded.
 */
public record SessionSummary(PracticeSession session,
                             int scheduledCount,
                             int rejectedCount,
                             UserPracticeProgress practiceProgress) { }
