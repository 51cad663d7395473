package com.gt.quranquest.model;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.quranquest.lesson.model.ExerciseType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class VerseLearningStateTests {

    @Test
    public void testCreate_rejectsNegativeCounters() {
        assertThrows(IllegalArgumentException.class,
                () -> new VerseLearningState(1, 1, 1, VerseStatus.Learning, ConfidenceLevel.NotConfident, -1, 0, 0, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new VerseLearningState(1, 1, 1, VerseStatus.Learning, ConfidenceLevel.NotConfident, 0, -1, 0, null, null));
    }

    @Test
    public void testCreate_rejectsMoreRecallsThanAttempts() {
        assertThrows(IllegalArgumentException.class,
                () -> new VerseLearningState(1, 1, 1, VerseStatus.Reviewing, ConfidenceLevel.Confident, 0, 1, 2, null, null));
    }

    @Test
    public void testCreate_rejectsMasteredWithoutTime() {
        assertThrows(IllegalArgumentException.class,
                () -> new VerseLearningState(1, 1, 1, VerseStatus.Mastered, ConfidenceLevel.Confident, 0, 1, 1, null, null));

        VerseLearningState mastered = new VerseLearningState(1, 1, 1, VerseStatus.Mastered, ConfidenceLevel.Confident, 0, 1, 1, null, Instant.EPOCH);
        assertEquals(Instant.EPOCH, mastered.masteredAt());
    }

    @Test
    public void testWireNames() {
        assertEquals("not_confident", ConfidenceLevel.NotConfident.getWireName());
        assertEquals(ConfidenceLevel.SomewhatConfident, ConfidenceLevel.fromWireName("somewhat_confident"));
        assertEquals(VerseStatus.Reviewing, VerseStatus.fromWireName("reviewing"));
        assertEquals(VerseStatus.Mastered, VerseStatus.fromWireName("Mastered"));
    }

    @Test
    public void testFromWireName_unknown() {
        assertThrows(IllegalArgumentException.class, () -> VerseStatus.fromWireName("forgotten"));
        assertThrows(IllegalArgumentException.class, () -> ConfidenceLevel.fromWireName("very_confident"));
        assertThrows(IllegalArgumentException.class, () -> ExerciseType.fromWireName("word_search"));
    }

    @Test
    public void testJsonWireFormat() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();

        assertEquals("\"not_confident\"", objectMapper.writeValueAsString(ConfidenceLevel.NotConfident));
        assertEquals("\"mastered\"", objectMapper.writeValueAsString(VerseStatus.Mastered));
        assertEquals(ConfidenceLevel.SomewhatConfident, objectMapper.readValue("\"somewhat_confident\"", ConfidenceLevel.class));
        assertEquals(ExerciseType.ReciteAyah, objectMapper.readValue("\"recite_ayah\"", ExerciseType.class));

        assertThrows(JsonMappingException.class, () -> objectMapper.readValue("\"very_confident\"", ConfidenceLevel.class));
    }
}
