package com.gt.quranquest.progress.impl;

import com.gt.quranquest.exception.DaoException;
import com.gt.quranquest.model.ConfidenceLevel;
import com.gt.quranquest.model.VerseLearningState;
import com.gt.quranquest.model.VerseStatus;
import com.gt.quranquest.progress.VerseLearningStateDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class VerseLearningStateDaoPG implements VerseLearningStateDao {

    private static final Logger log = LoggerFactory.getLogger(VerseLearningStateDaoPG.class);

    private final NamedParameterJdbcTemplate template;

    private static final String GET_VERSE_LEARNING_STATE_SQL =
            "SELECT verse_id, chapter_id, verse_number, status, confidence, read_count, test_attempts, successful_recalls, " +
                    "last_practiced_at, mastered_at " +
            "FROM verse_learning_state " +
            "WHERE verse_id = :verseId";

    private static final String GET_CHAPTER_LEARNING_STATES_SQL =
            "SELECT verse_id, chapter_id, verse_number, status, confidence, read_count, test_attempts, successful_recalls, " +
                    "last_practiced_at, mastered_at " +
            "FROM verse_learning_state " +
            "WHERE chapter_id = :chapterId " +
            "ORDER BY verse_number";

    private static final String UPSERT_VERSE_LEARNING_STATE_SQL =
            "INSERT INTO verse_learning_state " +
                    "(verse_id, chapter_id, verse_number, status, confidence, read_count, test_attempts, successful_recalls, " +
                    " last_practiced_at, mastered_at) " +
            "VALUES (:verseId, :chapterId, :verseNumber, :status, :confidence, :readCount, :testAttempts, :successfulRecalls, " +
                    "        :lastPracticedAt, :masteredAt) " +
            "ON CONFLICT (verse_id) " +
            "DO UPDATE SET " +
                    "   status = :status, confidence = :confidence, read_count = :readCount, test_attempts = :testAttempts, " +
                    "   successful_recalls = :successfulRecalls, last_practiced_at = :lastPracticedAt, mastered_at = :masteredAt ";

    // Unknown status or confidence values, and rows breaking the state invariants, fail the read
    private static final RowMapper<VerseLearningState> STATE_ROW_MAPPER = (rs, rowNum) -> new VerseLearningState(
            rs.getInt("verse_id"),
            rs.getInt("chapter_id"),
            rs.getInt("verse_number"),
            VerseStatus.fromWireName(rs.getString("status")),
            ConfidenceLevel.fromWireName(rs.getString("confidence")),
            rs.getInt("read_count"),
            rs.getInt("test_attempts"),
            rs.getInt("successful_recalls"),
            toInstant(rs.getTimestamp("last_practiced_at")),
            toInstant(rs.getTimestamp("mastered_at")));

    public VerseLearningStateDaoPG(NamedParameterJdbcTemplate template) {
        this.template = template;
    }

    @Override
    public Optional<VerseLearningState> get(int verseId) {
        try {
            List<VerseLearningState> states = template.query(GET_VERSE_LEARNING_STATE_SQL, Map.of("verseId", verseId), STATE_ROW_MAPPER);
            return states.isEmpty() ? Optional.empty() : Optional.of(states.get(0));
        } catch (DataAccessException | IllegalArgumentException ex) {
            log.error("Failed to load learning state for verse {}", verseId, ex);
            throw new DaoException("Failed to load learning state for verse " + verseId, ex);
        }
    }

    @Override
    public void put(VerseLearningState state) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("verseId", state.verseId());
        params.addValue("chapterId", state.chapterId());
        params.addValue("verseNumber", state.verseNumberInChapter());
        params.addValue("status", state.status().getWireName());
        params.addValue("confidence", state.confidence().getWireName());
        params.addValue("readCount", state.readCount());
        params.addValue("testAttempts", state.testAttempts());
        params.addValue("successfulRecalls", state.successfulRecalls());
        params.addValue("lastPracticedAt", toTimestamp(state.lastPracticedAt()));
        params.addValue("masteredAt", toTimestamp(state.masteredAt()));

        try {
            int rowCnt = template.update(UPSERT_VERSE_LEARNING_STATE_SQL, params);
            if (rowCnt == 0) {
                throw new DaoException("Learning state for verse " + state.verseId() + " was not saved");
            }
        } catch (DataAccessException ex) {
            log.error("Failed to save learning state for verse {}", state.verseId(), ex);
            throw new DaoException("Failed to save learning state for verse " + state.verseId(), ex);
        }
    }

    @Override
    public List<VerseLearningState> getForChapter(int chapterId) {
        try {
            return template.query(GET_CHAPTER_LEARNING_STATES_SQL, Map.of("chapterId", chapterId), STATE_ROW_MAPPER);
        } catch (DataAccessException | IllegalArgumentException ex) {
            log.error("Failed to load learning states for chapter {}", chapterId, ex);
            throw new DaoException("Failed to load learning states for chapter " + chapterId, ex);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
