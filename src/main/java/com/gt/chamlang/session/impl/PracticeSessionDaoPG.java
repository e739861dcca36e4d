package com.gt.chamlang.session.impl;

import com.gt.chamlang.exception.StoreUnavailableException;
import com.gt.chamlang.model.PracticeMode;
import com.gt.chamlang.model.PracticeResult;
import com.gt.chamlang.model.PracticeSession;
import com.gt.chamlang.session.PracticeSessionDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

public class PracticeSessionDaoPG implements PracticeSessionDao {

    private static final Logger log = LoggerFactory.getLogger(PracticeSessionDaoPG.class);

    private final NamedParameterJdbcTemplate template;

    private static final String INSERT_PRACTICE_SESSION_SQL =
            "INSERT INTO practice_session " +
                    "(id, collection_id, mode, language, topic, level, total_questions, correct_answers, started_at, completed_at, duration_seconds) " +
                    "VALUES (:id, :collectionId, :mode, :language, :topic, :level, :totalQuestions, :correctAnswers, :startedAt, :completedAt, :durationSeconds) " +
                    "ON CONFLICT (id) DO NOTHING";

    private static final String INSERT_PRACTICE_RESULT_SQL =
            "INSERT INTO practice_result " +
                    "(session_id, seq_num, vocabulary_id, word, correct, mode, time_spent_seconds) " +
                    "VALUES (:sessionId, :seqNum, :vocabularyId, :word, :correct, :mode, :timeSpentSeconds) " +
                    "ON CONFLICT (session_id, seq_num) DO NOTHING";

    private static final String GET_RECENT_SESSIONS_SQL =
            "SELECT id, collection_id, mode, language, topic, level, total_questions, correct_answers, started_at, completed_at, duration_seconds " +
            "FROM practice_session " +
            "WHERE language = :language " +
            "ORDER BY completed_at DESC " +
            "LIMIT :maxSessionCnt";

    private static final String GET_SESSION_RESULTS_SQL =
            "SELECT session_id, vocabulary_id, word, correct, mode, time_spent_seconds " +
            "FROM practice_result " +
            "WHERE session_id IN (:sessionIds) " +
            "ORDER BY session_id, seq_num";

    private static final String PURGE_SESSIONS_SQL =
            "DELETE FROM practice_session WHERE completed_at < :cutoff";

    public PracticeSessionDaoPG(NamedParameterJdbcTemplate template) {
        this.template = template;
    }

    @Override
    public void saveSession(PracticeSession practiceSession) {
        MapSqlParameterSource sessionParams = new MapSqlParameterSource();
        sessionParams.addValue("id", practiceSession.id());
        sessionParams.addValue("collectionId", practiceSession.collectionId());
        sessionParams.addValue("mode", practiceSession.mode() == null ? null : practiceSession.mode().getTag());
        sessionParams.addValue("language", practiceSession.language());
        sessionParams.addValue("topic", practiceSession.topic());
        sessionParams.addValue("level", practiceSession.level());
        sessionParams.addValue("totalQuestions", practiceSession.totalQuestions());
        sessionParams.addValue("correctAnswers", practiceSession.correctAnswers());
        sessionParams.addValue("startedAt", toTimestamp(practiceSession.startedAt()));
        sessionParams.addValue("completedAt", toTimestamp(practiceSession.completedAt()));
        sessionParams.addValue("durationSeconds", practiceSession.durationSeconds());

        List<SqlParameterSource> resultParamList = new ArrayList<>();
        int seqNum = 0;
        for (PracticeResult result : practiceSession.results()) {
            MapSqlParameterSource params = new MapSqlParameterSource();
            params.addValue("sessionId", practiceSession.id());
            params.addValue("seqNum", seqNum++);
            params.addValue("vocabularyId", result.vocabularyId());
            params.addValue("word", result.word());
            params.addValue("correct", result.correct());
            params.addValue("mode", result.mode().getTag());
            params.addValue("timeSpentSeconds", result.timeSpentSeconds());
            resultParamList.add(params);
        }

        try {
            template.update(INSERT_PRACTICE_SESSION_SQL, sessionParams);
            if (!resultParamList.isEmpty()) {
                template.batchUpdate(INSERT_PRACTICE_RESULT_SQL, resultParamList.toArray(new SqlParameterSource[0]));
            }
        } catch (DataAccessException ex) {
            String errMsg = "Unable to save practice session " + practiceSession.id();
            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }
    }

    @Override
    public List<PracticeSession> loadRecentSessions(String language, int maxSessionCnt) {
        try {
            List<PracticeSession> sessions = template.query(GET_RECENT_SESSIONS_SQL,
                    Map.of("language", language, "maxSessionCnt", maxSessionCnt),
                    (rs, rowNum) -> new PracticeSession(
                            rs.getString("id"),
                            rs.getString("collection_id"),
                            PracticeMode.fromTag(rs.getString("mode")),
                            rs.getString("language"),
                            rs.getString("topic"),
                            rs.getString("level"),
                            List.of(),
                            rs.getInt("total_questions"),
                            rs.getInt("correct_answers"),
                            toInstant(rs.getTimestamp("started_at")),
                            toInstant(rs.getTimestamp("completed_at")),
                            rs.getLong("duration_seconds")));

            if (sessions.isEmpty()) {
                return sessions;
            }

            Map<String, List<PracticeResult>> resultsBySessionId = loadResults(sessions.stream().map(PracticeSession::id).toList());

            return sessions.stream()
                    .map(session -> new PracticeSession(session.id(), session.collectionId(), session.mode(), session.language(),
                            session.topic(), session.level(), resultsBySessionId.getOrDefault(session.id(), List.of()),
                            session.totalQuestions(), session.correctAnswers(), session.startedAt(), session.completedAt(),
                            session.durationSeconds()))
                    .toList();
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load recent practice sessions for language " + language;
            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }
    }

    @Override
    public int purgeSessionsCompletedBefore(Instant cutoff) {
        try {
            return template.update(PURGE_SESSIONS_SQL, Map.of("cutoff", Timestamp.from(cutoff)));
        } catch (DataAccessException ex) {
            String errMsg = "Unable to purge practice sessions completed before " + cutoff;
            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }
    }

    private Map<String, List<PracticeResult>> loadResults(Collection<String> sessionIds) {
        return template.query(GET_SESSION_RESULTS_SQL, Map.of("sessionIds", sessionIds), (rs) -> {
            Map<String, List<PracticeResult>> resultsBySessionId = new HashMap<>();

            while (rs.next()) {
                PracticeMode mode = PracticeMode.fromTag(rs.getString("mode"));
                if (mode == null) {
                    log.warn("Skipping stored practice result with unrecognized mode {}", rs.getString("mode"));
                    continue;
                }

                resultsBySessionId.computeIfAbsent(rs.getString("session_id"), (sessionId) -> new ArrayList<>())
                        .add(new PracticeResult(
                                rs.getString("vocabulary_id"),
                                rs.getString("word"),
                                rs.getBoolean("correct"),
                                mode,
                                rs.getInt("time_spent_seconds")));
            }

            return resultsBySessionId;
        });
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
