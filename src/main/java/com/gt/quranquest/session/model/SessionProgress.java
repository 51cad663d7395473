package com.gt.quranquest.session.model;

public record SessionProgress(int total, int masteredCount, double percentage) { }
