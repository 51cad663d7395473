package com.gt.quranquest.session.model;

public record VerseRange(int start, int end) { }
