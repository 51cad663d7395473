package com.gt.quranquest.alignment.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.quranquest.serialization.WordStatusSerializer;

@JsonSerialize(using = WordStatusSerializer.class, as = String.class)
public enum WordStatus {
    Correct("correct"),
    Incorrect("incorrect"),
    Missing("missing"),
    Extra("extra");

    private final String wireName;

    WordStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
