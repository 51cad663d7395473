package com.gt.quranquest.lesson.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.quranquest.serialization.ExerciseTypeSerializer;

@JsonSerialize(using = ExerciseTypeSerializer.class, as = String.class)
public enum ExerciseType {
    ListenSelect("listen_select"),
    MatchPairs("match_pairs"),
    ReciteWord("recite_word"),
    ReciteAyah("recite_ayah"),
    FillBlank("fill_blank"),
    ArrangeWords("arrange_words"),
    IdentifyLetter("identify_letter"),
    TajweedIdentify("tajweed_identify");

    private final String wireName;

    ExerciseType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ExerciseType fromWireName(String wireName) {
        for (ExerciseType exerciseType : values()) {
            if (exerciseType.wireName.equals(wireName) || exerciseType.name().equals(wireName)) {
                return exerciseType;
            }
        }

        throw new IllegalArgumentException("Unknown ExerciseType '" + wireName + "'");
    }
}
