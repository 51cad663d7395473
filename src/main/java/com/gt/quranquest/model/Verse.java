package com.gt.quranquest.model;

public record Verse(int id,
                    int chapterId,
                    int numberInChapter,
                    String text,
                    String translation) { }
