package com.gt.chamlang.progress.impl;

import com.gt.chamlang.exception.StoreUnavailableException;
import com.gt.chamlang.model.UserPracticeProgress;
import com.gt.chamlang.progress.UserPracticeProgressDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class UserPracticeProgressDaoPG implements UserPracticeProgressDao {

    private static final Logger log = LoggerFactory.getLogger(UserPracticeProgressDaoPG.class);

    private final NamedParameterJdbcTemplate template;

    private static final String GET_PRACTICE_PROGRESS_SQL =
            "SELECT language, total_sessions, total_words_practiced, current_streak, longest_streak, last_practice_date " +
            "FROM practice_progress " +
            "WHERE language = :language";

    private static final String UPSERT_PRACTICE_PROGRESS_SQL =
            "INSERT INTO practice_progress " +
                    "(language, total_sessions, total_words_practiced, current_streak, longest_streak, last_practice_date) " +
                    "VALUES (:language, :totalSessions, :totalWordsPracticed, :currentStreak, :longestStreak, :lastPracticeDate) " +
                    "ON CONFLICT (language) " +
                    "DO UPDATE SET " +
                    "   total_sessions = :totalSessions, total_words_practiced = :totalWordsPracticed, " +
                    "   current_streak = :currentStreak, longest_streak = :longestStreak, last_practice_date = :lastPracticeDate ";

    public UserPracticeProgressDaoPG(NamedParameterJdbcTemplate template) {
        this.template = template;
    }

    @Override
    public Optional<UserPracticeProgress> loadPracticeProgress(String language) {
        try {
            List<UserPracticeProgress> results = template.query(GET_PRACTICE_PROGRESS_SQL, Map.of("language", language), (rs, rowNum) -> {
                Date lastPracticeDate = rs.getDate("last_practice_date");

                return new UserPracticeProgress(
                        rs.getString("language"),
                        Map.of(),
                        rs.getInt("total_sessions"),
                        rs.getInt("total_words_practiced"),
                        rs.getInt("current_streak"),
                        rs.getInt("longest_streak"),
                        lastPracticeDate == null ? null : lastPracticeDate.toLocalDate());
            });

            return results.stream().findFirst();
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load practice progress for language " + language;
            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }
    }

    @Override
    public void savePracticeProgress(UserPracticeProgress practiceProgress) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("language", practiceProgress.language());
        params.addValue("totalSessions", practiceProgress.totalSessions());
        params.addValue("totalWordsPracticed", practiceProgress.totalWordsPracticed());
        params.addValue("currentStreak", practiceProgress.currentStreak());
        params.addValue("longestStreak", practiceProgress.longestStreak());
        params.addValue("lastPracticeDate", practiceProgress.lastPracticeDate() == null ? null : Date.valueOf(practiceProgress.lastPracticeDate()));

        try {
            template.update(UPSERT_PRACTICE_PROGRESS_SQL, params);
        } catch (DataAccessException ex) {
            String errMsg = "Unable to save practice progress for language " + practiceProgress.language();
            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }
    }
}
