package com.gt.quranquest.model;

import java.time.Instant;

public record TestResult(int verseId, boolean passed, Instant attemptedAt) { }
