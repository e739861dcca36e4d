package com.gt.chamlang.progress.impl;

import com.gt.chamlang.exception.StoreUnavailableException;
import com.gt.chamlang.model.PracticeMode;
import com.gt.chamlang.model.WordProgress;
import com.gt.chamlang.progress.WordProgressDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

public class WordProgressDaoPG implements WordProgressDao {

    private static final Logger log = LoggerFactory.getLogger(WordProgressDaoPG.class);

    private static final String MODE_SEPARATOR = ",";

    private final NamedParameterJdbcTemplate template;

    private static final String WORD_PROGRESS_COLUMNS =
            "vocabulary_id, word, correct_count, incorrect_count, mastery_level, last_practiced, next_review_date, " +
            "interval_days, last_interval_days, easiness_factor, consecutive_correct_count, leitner_box, total_reviews, " +
            "completed_modes_in_cycle ";

    private static final String GET_WORD_PROGRESS_SQL =
            "SELECT " + WORD_PROGRESS_COLUMNS +
            "FROM word_progress " +
            "WHERE language = :language " +
            "ORDER BY vocabulary_id";

    private static final String GET_WORD_PROGRESS_BATCH_SQL =
            "SELECT " + WORD_PROGRESS_COLUMNS +
            "FROM word_progress " +
            "WHERE language = :language AND vocabulary_id IN (:vocabularyIds) " +
            "ORDER BY vocabulary_id";

    private static final String UPSERT_WORD_PROGRESS_SQL =
            "INSERT INTO word_progress " +
                    "(language, vocabulary_id, word, correct_count, incorrect_count, mastery_level, last_practiced, next_review_date, " +
                    " interval_days, last_interval_days, easiness_factor, consecutive_correct_count, leitner_box, total_reviews, " +
                    " completed_modes_in_cycle) " +
                    "VALUES (:language, :vocabularyId, :word, :correctCount, :incorrectCount, :masteryLevel, :lastPracticed, :nextReviewDate, " +
                    "        :intervalDays, :lastIntervalDays, :easinessFactor, :consecutiveCorrectCount, :leitnerBox, :totalReviews, " +
                    "        :completedModesInCycle) " +
                    "ON CONFLICT (language, vocabulary_id) " +
                    "DO UPDATE SET " +
                    "   word = :word, correct_count = :correctCount, incorrect_count = :incorrectCount, mastery_level = :masteryLevel, " +
                    "   last_practiced = :lastPracticed, next_review_date = :nextReviewDate, interval_days = :intervalDays, " +
                    "   last_interval_days = :lastIntervalDays, easiness_factor = :easinessFactor, " +
                    "   consecutive_correct_count = :consecutiveCorrectCount, leitner_box = :leitnerBox, total_reviews = :totalReviews, " +
                    "   completed_modes_in_cycle = :completedModesInCycle ";

    public WordProgressDaoPG(NamedParameterJdbcTemplate template) {
        this.template = template;
    }

    @Override
    public List<WordProgress> loadWordProgress(String language) {
        try {
            return template.query(GET_WORD_PROGRESS_SQL, Map.of("language", language), wordProgressRowMapper());
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load word progress for language " + language;
            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }
    }

    @Override
    public List<WordProgress> loadWordProgressBatch(String language, Collection<String> vocabularyIds) {
        if (vocabularyIds == null || vocabularyIds.isEmpty()) {
            return List.of();
        }

        try {
            return template.query(GET_WORD_PROGRESS_BATCH_SQL,
                    Map.of("language", language, "vocabularyIds", vocabularyIds),
                    wordProgressRowMapper());
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load progress for " + vocabularyIds.size() + " words in language " + language;
            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }
    }

    @Override
    public void saveWordProgress(String language, WordProgress wordProgress) {
        try {
            template.update(UPSERT_WORD_PROGRESS_SQL, toParams(language, wordProgress));
        } catch (DataAccessException ex) {
            String errMsg = "Unable to save progress for word " + wordProgress.vocabularyId();
            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }
    }

    @Override
    public int saveWordProgressBatch(String language, Collection<WordProgress> wordProgress) {
        if (wordProgress == null || wordProgress.isEmpty()) {
            return 0;
        }

        SqlParameterSource[] sources = wordProgress.stream()
                .map(progress -> toParams(language, progress))
                .toArray(SqlParameterSource[]::new);

        try {
            int[] rowCnts = template.batchUpdate(UPSERT_WORD_PROGRESS_SQL, sources);
            return Arrays.stream(rowCnts).map(rowCnt -> rowCnt != 0 ? 1 : 0).sum();
        } catch (DataAccessException ex) {
            String errMsg = "Unable to save progress for " + wordProgress.size() + " words in language " + language;
            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }
    }

    // Session-scoped flags are never written; a loaded record always starts with them cleared.
    private static MapSqlParameterSource toParams(String language, WordProgress wordProgress) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("language", language);
        params.addValue("vocabularyId", wordProgress.vocabularyId());
        params.addValue("word", wordProgress.word());
        params.addValue("correctCount", wordProgress.correctCount());
        params.addValue("incorrectCount", wordProgress.incorrectCount());
        params.addValue("masteryLevel", wordProgress.masteryLevel());
        params.addValue("lastPracticed", toTimestamp(wordProgress.lastPracticed()));
        params.addValue("nextReviewDate", toTimestamp(wordProgress.nextReviewDate()));
        params.addValue("intervalDays", wordProgress.intervalDays());
        params.addValue("lastIntervalDays", wordProgress.lastIntervalDays());
        params.addValue("easinessFactor", wordProgress.easinessFactor());
        params.addValue("consecutiveCorrectCount", wordProgress.consecutiveCorrectCount());
        params.addValue("leitnerBox", wordProgress.leitnerBox());
        params.addValue("totalReviews", wordProgress.totalReviews());
        params.addValue("completedModesInCycle", toModeColumn(wordProgress.completedModesInCycle()));

        return params;
    }

    private static RowMapper<WordProgress> wordProgressRowMapper() {
        return (rs, rowNum) -> new WordProgress(
                rs.getString("vocabulary_id"),
                rs.getString("word"),
                rs.getInt("correct_count"),
                rs.getInt("incorrect_count"),
                rs.getInt("mastery_level"),
                toInstant(rs.getTimestamp("last_practiced")),
                toInstant(rs.getTimestamp("next_review_date")),
                rs.getInt("interval_days"),
                rs.getInt("last_interval_days"),
                rs.getDouble("easiness_factor"),
                rs.getInt("consecutive_correct_count"),
                rs.getInt("leitner_box"),
                rs.getInt("total_reviews"),
                false,
                0,
                fromModeColumn(rs.getString("completed_modes_in_cycle")));
    }

    static String toModeColumn(Set<PracticeMode> modes) {
        return modes.stream()
                .map(PracticeMode::getTag)
                .sorted()
                .collect(Collectors.joining(MODE_SEPARATOR));
    }

    static Set<PracticeMode> fromModeColumn(String modeColumn) {
        if (modeColumn == null || modeColumn.isBlank()) {
            return Set.of();
        }

        Set<PracticeMode> modes = EnumSet.noneOf(PracticeMode.class);
        for (String tag : modeColumn.split(MODE_SEPARATOR)) {
            PracticeMode mode = PracticeMode.fromTag(tag);
            if (mode != null) {
                modes.add(mode);
            } else {
                log.warn("Ignoring unrecognized practice mode '{}' in stored cycle", tag);
            }
        }

        return modes;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
