package com.gt.chamlang.session;

import com.gt.chamlang.model.PracticeSession;

import java.time.Instant;
import java.util.List;

public interface PracticeSessionDao {

    void saveSession(PracticeSession practiceSession);

    List<PracticeSession> loadRecentSessions(String language, int maxSessionCnt);

    int purgeSessionsCompletedBefore(Instant cutoff);
}
