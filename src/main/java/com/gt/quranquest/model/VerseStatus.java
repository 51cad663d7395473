package com.gt.quranquest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.quranquest.serialization.VerseStatusSerializer;

@JsonSerialize(using = VerseStatusSerializer.class, as = String.class)
public enum VerseStatus {
    New("new"),
    Learning("learning"),
    Reviewing("reviewing"),
    Mastered("mastered");

    private final String wireName;

    VerseStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static VerseStatus fromWireName(String wireName) {
        for (VerseStatus status : values()) {
            if (status.wireName.equals(wireName) || status.name().equals(wireName)) {
                return status;
            }
        }

        throw new IllegalArgumentException("Unknown VerseStatus '" + wireName + "'");
    }
}
