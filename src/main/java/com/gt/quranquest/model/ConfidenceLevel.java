package com.gt.quranquest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.quranquest.serialization.ConfidenceLevelSerializer;

@JsonSerialize(using = ConfidenceLevelSerializer.class, as = String.class)
public enum ConfidenceLevel {
    NotConfident("not_confident"),
    SomewhatConfident("somewhat_confident"),
    Confident("confident");

    private final String wireName;

    ConfidenceLevel(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ConfidenceLevel fromWireName(String wireName) {
        for (ConfidenceLevel level : values()) {
            if (level.wireName.equals(wireName) || level.name().equals(wireName)) {
                return level;
            }
        }

        throw new IllegalArgumentException("Unknown ConfidenceLevel '" + wireName + "'");
    }
}
